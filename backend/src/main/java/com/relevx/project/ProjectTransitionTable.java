package com.relevx.project;

import com.relevx.domain.ProjectStatus;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Which caller-initiated status changes are legal.
 * <ul>
 *   <li>target equal to current: status_unchanged</li>
 *   <li>RUNNING or ERROR (owned by the execution system) block everything except delete</li>
 *   <li>activate from DRAFT or PAUSED, quota checked</li>
 *   <li>pause from DRAFT or ACTIVE</li>
 *   <li>delete from any non-deleted status</li>
 *   <li>DRAFT, RUNNING and ERROR are never valid targets</li>
 * </ul>
 */
@Component
public class ProjectTransitionTable {

    private static final Set<ProjectStatus> EXECUTION_OWNED = EnumSet.of(ProjectStatus.RUNNING, ProjectStatus.ERROR);
    private static final Set<ProjectStatus> ACTIVATABLE = EnumSet.of(ProjectStatus.DRAFT, ProjectStatus.PAUSED);

    /**
     * @throws ProjectOperationException status_unchanged or invalid_status when the change is not allowed
     */
    public ProjectTransition resolve(ProjectStatus current, ProjectStatus target) {
        if (current == target) {
            throw new ProjectOperationException(ProjectStatusMachine.STATUS_UNCHANGED,
                    "Project is already " + target.wireName());
        }
        ProjectTransition transition = transitionTo(target);
        if (EXECUTION_OWNED.contains(current) && transition != ProjectTransition.DELETE) {
            throw invalid(current, target);
        }
        boolean allowed = switch (transition) {
            case ACTIVATE -> ACTIVATABLE.contains(current);
            case PAUSE, DELETE -> current != ProjectStatus.DELETED;
        };
        if (!allowed) {
            throw invalid(current, target);
        }
        return transition;
    }

    /** Schedule edits re-check quota and the guard window only for active projects. */
    public boolean scheduleEditRequiresQuota(ProjectStatus status) {
        return status == ProjectStatus.ACTIVE;
    }

    private static ProjectTransition transitionTo(ProjectStatus target) {
        for (ProjectTransition t : ProjectTransition.values()) {
            if (t.target() == target) {
                return t;
            }
        }
        throw new ProjectOperationException(ProjectStatusMachine.INVALID_STATUS,
                "Status " + target.wireName() + " cannot be set directly");
    }

    private static ProjectOperationException invalid(ProjectStatus current, ProjectStatus target) {
        return new ProjectOperationException(ProjectStatusMachine.INVALID_STATUS,
                "Cannot change status from " + current.wireName() + " to " + target.wireName());
    }
}
