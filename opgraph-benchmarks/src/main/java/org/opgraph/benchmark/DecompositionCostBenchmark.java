package org.opgraph.benchmark;

import java.util.concurrent.TimeUnit;

import org.opgraph.ArithmeticDecomposer;
import org.opgraph.Decomposition;
import org.openjdk.jmh.annotations.*;

/**
 * Measures end-to-end decomposition cost (parse, tree conversion, lowering)
 * for expressions of increasing size.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class DecompositionCostBenchmark {

    @State(Scope.Thread)
    public static class ExpressionState {

        @Param({"1", "10", "50", "100"})
        int terms;

        String expression;
        ArithmeticDecomposer decomposer;

        @Setup(Level.Trial)
        public void init() {
            decomposer = ArithmeticDecomposer.builder().maxOperations(1_000).build();
            StringBuilder sb = new StringBuilder("(1 + 2)");
            for (int i = 1; i < terms; i++) {
                sb.append(i % 2 == 0 ? " * " : " - ").append("(").append(i).append(" / ").append(i + 1).append(")");
            }
            expression = sb.toString();
        }
    }

    @Benchmark
    public Decomposition decompose(ExpressionState state) {
        return state.decomposer.decompose(state.expression);
    }

    @Benchmark
    public Decomposition decomposeFoldedNegation(ExpressionState state) {
        return state.decomposer.decompose("-(-(-(-(-(-5)))))");
    }
}
