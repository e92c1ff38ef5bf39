package org.opgraph.benchmark;

import java.util.concurrent.TimeUnit;

import org.opgraph.ArithmeticDecomposer;
import org.opgraph.ExpressionParseException;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

/**
 * Syntax validation alone, for accepted and rejected input. Rejection cost
 * includes building the exception.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class ValidationBenchmark {

    @State(Scope.Benchmark)
    public static class SharedState {

        final ArithmeticDecomposer decomposer = ArithmeticDecomposer.withDefaults();
        final String valid = "((7 + 3) * (2 - 8)) / -(4 + 1) - 2.5";
        final String invalid = "((7 + 3) * (2 - 8)) / -(4 + ) - 2.5";
    }

    @Benchmark
    public void validateAccepted(SharedState state) {
        state.decomposer.validate(state.valid);
    }

    @Benchmark
    public void validateRejected(SharedState state, Blackhole bh) {
        try {
            state.decomposer.validate(state.invalid);
        } catch (ExpressionParseException e) {
            bh.consume(e);
        }
    }
}
