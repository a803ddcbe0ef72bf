/*
 * Copyright (C) 2026, The StructDiff Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.structdiff.benchmarks;

import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.structdiff.diff.DiffConfig;
import org.structdiff.diff.SearchResult;
import org.structdiff.diff.StructuralDiff;
import org.structdiff.junit.TreeReader;
import org.structdiff.tree.SyntaxTree;

@State(Scope.Thread)
public class RouteSearchBenchmark {

	@State(Scope.Benchmark)
	public static class BenchmarkState {

		@Param({ "10", "100", "400" })
		int statements;

		/** Every n-th statement is edited on the right side. */
		@Param({ "1", "10" })
		int editEvery;

		SyntaxTree left;

		SyntaxTree right;

		StructuralDiff search;

		@Setup
		public void setupBenchmark() {
			StringBuilder a = new StringBuilder("class C {\n");
			StringBuilder b = new StringBuilder("class C {\n");
			for (int i = 0; i < statements; i++) {
				String stmt = "  f" + i + "(a, b[" + i + "]);\n";
				a.append(stmt);
				if (i % editEvery == 0) {
					b.append("  // changed " + i + "\n");
					b.append("  f" + i + "(a, x, b[" + i + "]);\n");
				} else {
					b.append(stmt);
				}
			}
			a.append("}\n");
			b.append("}\n");
			left = TreeReader.read(a.toString());
			right = TreeReader.read(b.toString());
			search = new StructuralDiff(
					new DiffConfig(DiffConfig.DEFAULT_GRAPH_LIMIT,
							DiffConfig.DEFAULT_SIZE_FACTOR));
		}
	}

	@Benchmark
	@BenchmarkMode({ Mode.AverageTime })
	@OutputTimeUnit(TimeUnit.MICROSECONDS)
	@Warmup(iterations = 2, time = 5, timeUnit = TimeUnit.SECONDS)
	@Measurement(iterations = 2, time = 5, timeUnit = TimeUnit.SECONDS)
	@Fork(1)
	public void testDiff(Blackhole blackhole, BenchmarkState state) {
		SearchResult r = state.search.diff(state.left, state.right);
		blackhole.consume(r.getVisited());
		blackhole.consume(r.getRoute());
	}

	@Benchmark
	@BenchmarkMode({ Mode.AverageTime })
	@OutputTimeUnit(TimeUnit.MICROSECONDS)
	@Warmup(iterations = 2, time = 5, timeUnit = TimeUnit.SECONDS)
	@Measurement(iterations = 2, time = 5, timeUnit = TimeUnit.SECONDS)
	@Fork(1)
	public void testIdentity(Blackhole blackhole, BenchmarkState state) {
		blackhole.consume(state.search.diff(state.left, state.left));
	}

	public static void main(String[] args) throws RunnerException {
		Options opt = new OptionsBuilder()
				.include(RouteSearchBenchmark.class.getSimpleName())
				.forks(1).jvmArgs("-ea").build();
		new Runner(opt).run();
	}
}
