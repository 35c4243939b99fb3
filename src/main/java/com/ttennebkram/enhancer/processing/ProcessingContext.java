package com.ttennebkram.enhancer.processing;

import java.util.function.IntConsumer;
import java.util.stream.IntStream;

/**
 * Per-invocation execution settings handed to every operation.
 * Row loops run through {@link #forEachRow} so serial and parallel runs
 * produce identical pixels: each row is computed independently of the others.
 */
public final class ProcessingContext {

    public static final ProcessingContext SERIAL = new ProcessingContext(false);
    public static final ProcessingContext PARALLEL = new ProcessingContext(true);

    private final boolean parallel;

    private ProcessingContext(boolean parallel) {
        this.parallel = parallel;
    }

    public static ProcessingContext of(boolean parallel) {
        return parallel ? PARALLEL : SERIAL;
    }

    public boolean isParallel() {
        return parallel;
    }

    /**
     * Run the action once for every row index in [0, rows).
     */
    public void forEachRow(int rows, IntConsumer rowAction) {
        IntStream range = IntStream.range(0, rows);
        if (parallel) {
            range = range.parallel();
        }
        range.forEach(rowAction);
    }

    @Override
    public String toString() {
        return parallel ? "ProcessingContext[parallel]" : "ProcessingContext[serial]";
    }
}
