package com.relevx.scheduling;

import com.relevx.domain.Frequency;
import com.relevx.domain.Project;

/**
 * Schedule fields of a project as one value. dayOfWeek is 0-6 (Sunday first); dayOfMonth is 1-31.
 */
public record ProjectSchedule(
        Frequency frequency,
        String deliveryTime,
        String timezone,
        Integer dayOfWeek,
        Integer dayOfMonth
) {

    public static ProjectSchedule of(Project project) {
        return new ProjectSchedule(
                project.getFrequency(),
                project.getDeliveryTime(),
                project.getTimezone(),
                project.getDayOfWeek(),
                project.getDayOfMonth());
    }

    /**
     * Writes the schedule fields onto the project. Day fields not meaningful for the frequency are cleared so
     * quota buckets never see stale values.
     */
    public void applyTo(Project project) {
        project.setFrequency(frequency);
        project.setDeliveryTime(deliveryTime);
        project.setTimezone(timezone);
        project.setDayOfWeek(frequency == Frequency.WEEKLY ? dayOfWeek : null);
        project.setDayOfMonth(frequency == Frequency.MONTHLY ? dayOfMonth : null);
    }
}
