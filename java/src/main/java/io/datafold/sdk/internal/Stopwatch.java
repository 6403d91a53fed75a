package io.datafold.sdk.internal;

/**
 * Monotonic elapsed-time helper reporting fractional milliseconds.
 */
public final class Stopwatch {

    private long start;

    private Stopwatch() {
        this.start = System.nanoTime();
    }

    public static Stopwatch start() {
        return new Stopwatch();
    }

    public void reset() {
        start = System.nanoTime();
    }

    public double elapsedMillis() {
        return (System.nanoTime() - start) / 1_000_000.0d;
    }
}
