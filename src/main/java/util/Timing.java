package util;

import org.slf4j.Logger;

/**
 * Lap timer. Each {@link #stop} logs the time since the previous lap (or
 * construction) at debug level and returns it.
 */
public class Timing {
    private final Logger logger;
    private final long start = System.nanoTime();
    private long t0 = start;

    public Timing(Logger logger) {
        this.logger = logger;
    }

    public double stop(String label) {
        long now = System.nanoTime();
        double ms = (now - t0) / 1_000_000.0;
        if (logger.isDebugEnabled())
            logger.debug("{}: {} ms", label, String.format("%.2f", ms));
        t0 = now;
        return ms;
    }

    /** Milliseconds since construction. */
    public double total() {
        return (System.nanoTime() - start) / 1_000_000.0;
    }
}
