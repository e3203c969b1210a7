package com.relevx.project;

import com.relevx.domain.Frequency;
import com.relevx.scheduling.ProjectSchedule;

public record NewProjectRequest(
        String title,
        String description,
        Frequency frequency,
        String deliveryTime,
        String timezone,
        Integer dayOfWeek,
        Integer dayOfMonth
) {

    public ProjectSchedule schedule() {
        return new ProjectSchedule(frequency, deliveryTime, timezone, dayOfWeek, dayOfMonth);
    }
}
