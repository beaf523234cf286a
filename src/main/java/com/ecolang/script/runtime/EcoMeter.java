package com.ecolang.script.runtime;

/**
 * Running operation counter for one run. Only ever grows.
 */
public final class EcoMeter {
    private long totalOps;

    /** Charge one category at the given multiplier; returns the amount charged. */
    public long charge(OpCategory category, double scale) {
        long cost = category.scaled(scale);
        add(cost);
        return cost;
    }

    public void add(long ops) {
        if (ops < 0) throw new IllegalArgumentException("op cost must not be negative: " + ops);
        totalOps += ops;
    }

    public long total() {
        return totalOps;
    }
}
