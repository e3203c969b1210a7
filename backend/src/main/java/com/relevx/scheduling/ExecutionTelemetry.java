package com.relevx.scheduling;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Reads the execution system's run telemetry to decide whether a computed occurrence was already served.
 */
public final class ExecutionTelemetry {

    private ExecutionTelemetry() {
    }

    /**
     * True when the last run happened on the same local calendar date as the candidate occurrence. A schedule edit
     * landing on that date must then skip to the following occurrence instead of running twice.
     */
    public static boolean alreadyRanFor(Instant lastRunAt, Instant candidate, String timezone) {
        if (lastRunAt == null || candidate == null || timezone == null) {
            return false;
        }
        ZoneId zone = ZoneId.of(timezone);
        return lastRunAt.atZone(zone).toLocalDate().equals(candidate.atZone(zone).toLocalDate());
    }
}
