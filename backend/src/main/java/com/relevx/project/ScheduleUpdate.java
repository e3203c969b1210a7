package com.relevx.project;

import com.relevx.domain.Frequency;
import com.relevx.scheduling.ProjectSchedule;

/**
 * Partial project edit. Null fields keep the stored value.
 */
public record ScheduleUpdate(
        Frequency frequency,
        String deliveryTime,
        String timezone,
        Integer dayOfWeek,
        Integer dayOfMonth,
        String description
) {

    public boolean touchesSchedule() {
        return frequency != null || deliveryTime != null || timezone != null
                || dayOfWeek != null || dayOfMonth != null;
    }

    public ProjectSchedule mergeInto(ProjectSchedule current) {
        return new ProjectSchedule(
                frequency != null ? frequency : current.frequency(),
                deliveryTime != null ? deliveryTime : current.deliveryTime(),
                timezone != null ? timezone : current.timezone(),
                dayOfWeek != null ? dayOfWeek : current.dayOfWeek(),
                dayOfMonth != null ? dayOfMonth : current.dayOfMonth());
    }
}
