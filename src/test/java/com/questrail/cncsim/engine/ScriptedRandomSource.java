package com.questrail.cncsim.engine;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * RandomSource that returns queued values first and a fixed default after
 * the queue runs dry.
 *
 * <p>With the default of 0.5 every duration draw lands in the middle of its
 * range and every unloading branch goes back to idle.</p>
 */
public final class ScriptedRandomSource implements RandomSource {

    private final Deque<Double> queued = new ArrayDeque<>();
    private final double fallback;
    private int draws;

    public ScriptedRandomSource() {
        this(0.5);
    }

    public ScriptedRandomSource(double fallback) {
        this.fallback = fallback;
    }

    public ScriptedRandomSource enqueue(double... values) {
        for (double v : values) {
            queued.addLast(v);
        }
        return this;
    }

    @Override
    public double nextDouble() {
        draws++;
        Double v = queued.pollFirst();
        return v != null ? v : fallback;
    }

    @Override
    public long nextLong() {
        return 42L;
    }

    public int draws() {
        return draws;
    }
}
