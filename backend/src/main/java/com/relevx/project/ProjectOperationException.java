package com.relevx.project;

import com.relevx.domain.ProjectStatus;
import lombok.Getter;

/**
 * Thrown inside {@link ProjectStatusMachine} when a request is invalid or a business rule rejects it. Mapped to a
 * failed {@link ProjectResult} before leaving the service; callers never see it.
 */
@Getter
public class ProjectOperationException extends RuntimeException {

    /** One of the error code constants on {@link ProjectStatusMachine}. */
    private final String errorCode;

    /** Status of the project the rejection applies to, null when no project was loaded. */
    private final ProjectStatus currentStatus;

    public ProjectOperationException(String errorCode, String message) {
        this(errorCode, message, null);
    }

    public ProjectOperationException(String errorCode, String message, ProjectStatus currentStatus) {
        super(message);
        this.errorCode = errorCode;
        this.currentStatus = currentStatus;
    }

    ProjectOperationException withCurrentStatus(ProjectStatus status) {
        return new ProjectOperationException(errorCode, getMessage(), status);
    }
}
