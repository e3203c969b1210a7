package com.relevx.project;

import com.relevx.domain.ProjectStatus;

/**
 * Caller-initiated status changes.
 */
public enum ProjectTransition {
    ACTIVATE(ProjectStatus.ACTIVE),
    PAUSE(ProjectStatus.PAUSED),
    DELETE(ProjectStatus.DELETED);

    private final ProjectStatus target;

    ProjectTransition(ProjectStatus target) {
        this.target = target;
    }

    public ProjectStatus target() {
        return target;
    }
}
