package com.netflexity.anomaly.model;

/**
 * Step interval limits of the query backend.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public final class StepIntervals {

    /**
     * Steps of a minute or more are kept on minute boundaries
     */
    public static final long MIN_ALERT_STEP_SECONDS = 60;

    private static final long MAX_POINTS = 300;

    private StepIntervals() {
    }

    /**
     * Smallest step the backend accepts for the given range, in seconds.
     *
     * @param start range start in unix milliseconds
     * @param end   range end in unix milliseconds
     */
    public static long minAllowedStepInterval(long start, long end) {
        long step = (end - start) / MAX_POINTS / 1000;
        if (step < 60) {
            return step;
        }
        return step - step % 60;
    }
}
