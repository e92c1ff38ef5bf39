package org.opgraph.benchmark;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.opgraph.ArithmeticDecomposer;
import org.opgraph.Decomposition;
import org.openjdk.jmh.annotations.*;

/**
 * Several threads decomposing different expressions through one shared
 * decomposer. Gives a contention baseline for the id generator, the only
 * state shared between calls.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Threads(4)
public class ConcurrentDecompositionBenchmark {

    @State(Scope.Benchmark)
    public static class SharedState {

        final String[] expressions = {
                "1 + 2 * 3",
                "(4 - 5) / (6 + 7)",
                "-(8 * 9) + 10",
                "11 / 12 / 13 - 14"
        };

        final ArithmeticDecomposer decomposer = ArithmeticDecomposer.withDefaults();
    }

    @State(Scope.Thread)
    public static class ThreadState {

        private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);
        int threadIndex;

        @Setup(Level.Trial)
        public void init() {
            threadIndex = THREAD_COUNTER.getAndIncrement() % 4;
        }
    }

    @Benchmark
    public Decomposition concurrentDecomposeDifferentExpressions(SharedState shared, ThreadState local) {
        return shared.decomposer.decompose(shared.expressions[local.threadIndex]);
    }
}
