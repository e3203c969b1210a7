package com.relevx.project;

import com.relevx.domain.ProjectStatus;

import java.time.Instant;

/**
 * Outcome of a lifecycle operation. On success status and nextRunAt describe the project after the change; on
 * failure errorCode and errorMessage are set, status is the unchanged status when a project was loaded, and detail
 * optionally carries the underlying cause.
 */
public record ProjectResult(
        boolean ok,
        ProjectStatus status,
        Instant nextRunAt,
        String errorCode,
        String errorMessage,
        String detail
) {

    public static ProjectResult success(ProjectStatus status, Instant nextRunAt) {
        return new ProjectResult(true, status, nextRunAt, null, null, null);
    }

    public static ProjectResult failure(String errorCode, String errorMessage) {
        return failure(errorCode, errorMessage, null);
    }

    public static ProjectResult failure(ProjectStatus status, String errorCode, String errorMessage) {
        return new ProjectResult(false, status, null, errorCode, errorMessage, null);
    }

    public static ProjectResult failure(String errorCode, String errorMessage, String detail) {
        return new ProjectResult(false, null, null, errorCode, errorMessage, detail);
    }
}
