package com.relevx.project;

import com.relevx.domain.Frequency;
import com.relevx.scheduling.DeliveryTime;
import com.relevx.scheduling.ProjectSchedule;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Input checks run before any storage access. Failures carry a client-facing message.
 */
final class ProjectInputValidator {

    static final int MAX_TITLE_LENGTH = 200;

    private ProjectInputValidator() {
    }

    static String requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw invalid("User id is required");
        }
        return userId;
    }

    static String requireTitle(String title, String deletionMarker) {
        if (title == null || title.isBlank()) {
            throw invalid("Title is required");
        }
        String trimmed = title.trim();
        if (trimmed.length() > MAX_TITLE_LENGTH) {
            throw invalid("Title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        if (trimmed.startsWith(deletionMarker)) {
            throw invalid("Title must not start with " + deletionMarker);
        }
        return trimmed;
    }

    /** Title used to look up an existing project, trimmed the same way as on create. */
    static String requireLookupTitle(String title) {
        if (title == null || title.isBlank()) {
            throw invalid("Title is required");
        }
        return title.trim();
    }

    static void validate(ProjectSchedule schedule) {
        if (schedule.frequency() == null) {
            throw invalid("Frequency must be one of daily, weekly, monthly");
        }
        if (!DeliveryTime.isValid(schedule.deliveryTime())) {
            throw invalid("Delivery time must be HH:MM (24-hour)");
        }
        if (schedule.timezone() == null || schedule.timezone().isBlank()) {
            throw invalid("Timezone is required");
        }
        try {
            ZoneId.of(schedule.timezone());
        } catch (DateTimeException e) {
            throw invalid("Unknown timezone: " + schedule.timezone());
        }
        if (schedule.frequency() == Frequency.WEEKLY
                && (schedule.dayOfWeek() == null || schedule.dayOfWeek() < 0 || schedule.dayOfWeek() > 6)) {
            throw invalid("Weekly projects need dayOfWeek 0-6 (0 = Sunday)");
        }
        if (schedule.frequency() == Frequency.MONTHLY
                && (schedule.dayOfMonth() == null || schedule.dayOfMonth() < 1 || schedule.dayOfMonth() > 31)) {
            throw invalid("Monthly projects need dayOfMonth 1-31");
        }
    }

    private static ProjectOperationException invalid(String message) {
        return new ProjectOperationException(ProjectStatusMachine.INVALID_REQUEST, message);
    }
}
