package com.storefront.request_gateway.metrics;

import java.util.Arrays;

/**
 * The most recent {@code capacity} latencies. Once full, each new sample overwrites the
 * oldest one.
 */
public class LatencyRing {

    private final long[] samples;
    private int next;
    private int size;

    public LatencyRing(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.samples = new long[capacity];
    }

    public synchronized void record(long latencyMs) {
        samples[next] = latencyMs;
        next = (next + 1) % samples.length;
        if (size < samples.length) {
            size++;
        }
    }

    /** Copy of the retained samples in ascending order. */
    public synchronized long[] sortedSnapshot() {
        long[] copy = Arrays.copyOf(samples, size);
        Arrays.sort(copy);
        return copy;
    }

    public synchronized int size() {
        return size;
    }

    public synchronized void clear() {
        next = 0;
        size = 0;
    }

    /**
     * Nearest-rank percentile over ascending samples: {@code sorted[floor(n * q)]},
     * clamped to the last sample. 0 when there are no samples.
     */
    static long percentile(long[] sorted, double quantile) {
        if (sorted.length == 0) {
            return 0;
        }
        int index = (int) Math.floor(sorted.length * quantile);
        return sorted[Math.min(index, sorted.length - 1)];
    }

    static double average(long[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        long sum = 0;
        for (long value : values) {
            sum += value;
        }
        return (double) sum / values.length;
    }
}
