package com.hting007.logiq.detect;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Fixed-capacity series of per-window counts; the oldest value is evicted first.
 * Not thread safe: owned by a single pipeline loop.
 */
public class BaselineHistory {

    private final int capacity;
    private final Deque<Long> values;

    public BaselineHistory(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.capacity = capacity;
        this.values = new ArrayDeque<>(capacity);
    }

    public void add(long count) {
        if (values.size() == capacity) {
            values.removeFirst();
        }
        values.addLast(count);
    }

    public int size() {
        return values.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public double mean() {
        if (values.isEmpty()) return 0.0;
        double sum = 0.0;
        for (long v : values) sum += v;
        return sum / values.size();
    }

    /** Population standard deviation (divides by n); 0 for fewer than two values. */
    public double std() {
        if (values.size() < 2) return 0.0;
        return Math.sqrt(squaredDeviations() / values.size());
    }

    /** Sample standard deviation (divides by n - 1); 0 for fewer than two values. */
    public double sampleStd() {
        if (values.size() < 2) return 0.0;
        return Math.sqrt(squaredDeviations() / (values.size() - 1));
    }

    private double squaredDeviations() {
        double mean = mean();
        double s = 0.0;
        for (long v : values) {
            double d = v - mean;
            s += d * d;
        }
        return s;
    }

    /** Oldest first. */
    public List<Long> values() {
        return List.copyOf(values);
    }
}
