package com.gridcore.calc.util;

import com.gridcore.calc.api.RecalcListener;
import com.gridcore.calc.model.CellAddress;
import com.gridcore.calc.model.CellValue;

/**
 * Collects pass latency, cell counts and cell failures across recalculation
 * passes. Failures are also logged, throttled to one line per second.
 */
public final class RecalcStatsListener implements RecalcListener {
    private static final org.apache.logging.log4j.Logger log = org.apache.logging.log4j.LogManager
            .getLogger(RecalcStatsListener.class);

    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private long passStartNanos, lastLatencyNanos;
    private long totalPasses, totalLatencyNanos, totalCellsEvaluated;
    private long maxLatencyNanos = Long.MIN_VALUE;
    private int lastCellsEvaluated, lastErrorValues, lastFailures;
    private long totalFailures;

    @Override
    public void onRecalcStart(long epoch, int cells) {
        passStartNanos = System.nanoTime();
        lastErrorValues = 0;
        lastFailures = 0;
    }

    @Override
    public void onCellEvaluated(long epoch, CellAddress cell, CellValue value, long durationNanos) {
        if (value.isError())
            lastErrorValues++;
    }

    @Override
    public void onCellError(long epoch, CellAddress cell, Throwable error) {
        lastFailures++;
        totalFailures++;
        errLimiter.log(String.format("Evaluation of %s failed in epoch %d: %s", cell, epoch, error.getMessage()),
                null);
    }

    @Override
    public void onRecalcEnd(long epoch, int cellsEvaluated) {
        lastLatencyNanos = System.nanoTime() - passStartNanos;
        lastCellsEvaluated = cellsEvaluated;
        totalPasses++;
        totalLatencyNanos += lastLatencyNanos;
        totalCellsEvaluated += cellsEvaluated;
        if (lastLatencyNanos > maxLatencyNanos)
            maxLatencyNanos = lastLatencyNanos;
    }

    public long lastLatencyNanos() {
        return lastLatencyNanos;
    }

    public int lastCellsEvaluated() {
        return lastCellsEvaluated;
    }

    /** Cells of the last pass whose value is an error value, failures included. */
    public int lastErrorValues() {
        return lastErrorValues;
    }

    public int lastFailures() {
        return lastFailures;
    }

    public long totalPasses() {
        return totalPasses;
    }

    public long totalCellsEvaluated() {
        return totalCellsEvaluated;
    }

    public long totalFailures() {
        return totalFailures;
    }

    public double avgLatencyMicros() {
        return totalPasses > 0 ? totalLatencyNanos / 1000.0 / totalPasses : 0;
    }

    public long maxLatencyNanos() {
        return totalPasses > 0 ? maxLatencyNanos : 0;
    }

    public void reset() {
        totalPasses = 0;
        totalLatencyNanos = 0;
        totalCellsEvaluated = 0;
        totalFailures = 0;
        maxLatencyNanos = Long.MIN_VALUE;
    }
}
