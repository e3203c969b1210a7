package com.relevx.push;

import com.relevx.domain.Frequency;
import com.relevx.domain.Project;
import com.relevx.domain.ProjectStatus;

import java.time.Instant;

/**
 * Client-facing project fields. Storage ids and the owning user id are not exposed.
 */
public record ProjectView(
        String title,
        String description,
        Frequency frequency,
        String deliveryTime,
        String timezone,
        Integer dayOfWeek,
        Integer dayOfMonth,
        ProjectStatus status,
        Instant nextRunAt,
        Instant lastRunAt,
        String lastError,
        Instant createdAt,
        Instant updatedAt
) {

    public static ProjectView of(Project p) {
        return new ProjectView(
                p.getTitle(),
                p.getDescription(),
                p.getFrequency(),
                p.getDeliveryTime(),
                p.getTimezone(),
                p.getDayOfWeek(),
                p.getDayOfMonth(),
                p.getStatus(),
                p.getNextRunAt(),
                p.getLastRunAt(),
                p.getLastError(),
                p.getCreatedAt(),
                p.getUpdatedAt());
    }
}
