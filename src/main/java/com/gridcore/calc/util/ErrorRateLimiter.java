package com.gridcore.calc.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits how often an error is logged. Occurrences inside the quiet interval
 * are counted and reported with the next line that gets through.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(0);
    private final AtomicLong suppressed = new AtomicLong(0);

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /** @return true if the line was written, false if it was suppressed */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if ((last == 0 || now - last > minIntervalNanos) && lastLogTime.compareAndSet(last, now)) {
            long skipped = suppressed.getAndSet(0);
            if (skipped > 0)
                logger.error("{} (Throttled, {} similar suppressed)", message, skipped, t);
            else
                logger.error("{} (Throttled)", message, t);
            return true;
        }
        suppressed.incrementAndGet();
        return false;
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
