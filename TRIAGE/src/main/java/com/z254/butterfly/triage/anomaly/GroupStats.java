package com.z254.butterfly.triage.anomaly;

/**
 * Effective hourly event statistics for a group.
 *
 * @param mean         expected events per hour (seasonal when available, rolling otherwise)
 * @param stdDev       population standard deviation matching {@code mean}
 * @param currentCount events in the most recent hour
 * @param seasonal     whether the same-hour-of-day baseline was used
 */
public record GroupStats(double mean, double stdDev, long currentCount, boolean seasonal) {

    /**
     * Standard score of the current hour, 0 when the baseline has no spread.
     */
    public double zScore() {
        return stdDev == 0 ? 0 : (currentCount - mean) / stdDev;
    }

    /**
     * Relative increase of the current hour over the mean, 0 when the mean is 0.
     */
    public double percentageIncrease() {
        return mean == 0 ? 0 : (currentCount - mean) / mean * 100;
    }
}
