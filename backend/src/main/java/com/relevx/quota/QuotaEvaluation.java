package com.relevx.quota;

/**
 * Outcome of a daily-budget check. Peaks are the largest weekday / day-of-month bucket, excluding daily jobs.
 */
public record QuotaEvaluation(
        boolean admissible,
        int maxDailyRuns,
        int dailyCount,
        int peakWeeklyBucket,
        int peakMonthlyBucket
) {

    /** Worst single-day load implied by the evaluated set. */
    public int peakDayLoad() {
        return dailyCount + Math.max(peakWeeklyBucket, peakMonthlyBucket);
    }
}
