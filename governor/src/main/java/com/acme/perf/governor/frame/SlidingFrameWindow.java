package com.acme.perf.governor.frame;

/**
 * Fixed-capacity FIFO ring of frame latencies in milliseconds.
 *
 * <p>Not thread-safe: owned by the governor's execution context.
 */
public final class SlidingFrameWindow {
    private final double[] samples;
    private int head;
    private int size;

    public SlidingFrameWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0: " + capacity);
        }
        this.samples = new double[capacity];
    }

    /**
     * Appends a sample, evicting the oldest one when full.
     *
     * @return false if the latency was negative or not finite and was not stored
     */
    public boolean push(double latencyMs) {
        if (!Double.isFinite(latencyMs) || latencyMs < 0.0d) {
            return false;
        }
        int tail = (head + size) % samples.length;
        samples[tail] = latencyMs;
        if (size == samples.length) {
            head = (head + 1) % samples.length;
        } else {
            size++;
        }
        return true;
    }

    public int capacity() {
        return samples.length;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public double mean() {
        if (size == 0) {
            return Double.NaN;
        }
        double sum = 0.0d;
        for (int i = 0; i < size; i++) {
            sum += samples[(head + i) % samples.length];
        }
        return sum / size;
    }

    public double[] toArray() {
        double[] out = new double[size];
        for (int i = 0; i < size; i++) {
            out[i] = samples[(head + i) % samples.length];
        }
        return out;
    }

    public void clear() {
        head = 0;
        size = 0;
    }
}
