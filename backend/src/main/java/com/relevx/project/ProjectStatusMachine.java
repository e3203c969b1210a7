package com.relevx.project;

import com.relevx.billing.BillingException;
import com.relevx.billing.PlanResolver;
import com.relevx.cache.ActiveProjectListCache;
import com.relevx.common.UserLocks;
import com.relevx.config.ErrorProperties;
import com.relevx.config.SchedulingProperties;
import com.relevx.domain.Plan;
import com.relevx.domain.Project;
import com.relevx.domain.ProjectRepository;
import com.relevx.domain.ProjectStatus;
import com.relevx.domain.ProjectsChangedEvent;
import com.relevx.quota.QuotaEvaluation;
import com.relevx.quota.QuotaValidator;
import com.relevx.scheduling.ExecutionTelemetry;
import com.relevx.scheduling.ProjectSchedule;
import com.relevx.scheduling.RecurrenceCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Project lifecycle: create, edit schedule, activate/pause, soft delete.
 * <p>
 * Every schedule-changing operation recomputes nextRunAt; activation and edits of active projects are admitted only
 * when the user's active set stays within the effective plan's daily budget. Mutations of one user are serialized
 * through {@link UserLocks} and written conditionally on the version read. After each successful mutation the cached
 * list is invalidated and a {@link ProjectsChangedEvent} is published.
 * <p>
 * Operations returning {@link ProjectResult} never throw: business rejections and infrastructure failures come back as
 * a failed result. Rejections of a loaded project carry its unchanged status.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectStatusMachine {

    public static final String INVALID_REQUEST = "invalid_request";
    public static final String PROJECT_NOT_FOUND = "project_not_found";
    public static final String PROJECT_EXISTS = "project_exists";
    public static final String STATUS_UNCHANGED = "status_unchanged";
    public static final String INVALID_STATUS = "invalid_status";
    public static final String MAX_DAILY_RUNS = "max_daily_runs";
    public static final String USER_PLAN_NOT_FOUND = "user_plan_not_found";
    public static final String DELIVERY_WINDOW_TOO_CLOSE = "delivery_window_too_close";
    public static final String CONCURRENT_MODIFICATION = "concurrent_modification";
    public static final String INTERNAL_ERROR = "internal_error";

    private final ProjectRepository projectRepository;
    private final ActiveProjectListCache activeProjectListCache;
    private final QuotaValidator quotaValidator;
    private final RecurrenceCalculator recurrenceCalculator;
    private final PlanResolver planResolver;
    private final ProjectTransitionTable transitionTable;
    private final UserLocks userLocks;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final SchedulingProperties schedulingProperties;
    private final ErrorProperties errorProperties;
    private final Clock clock;

    /**
     * Creates a DRAFT project with a computed nextRunAt.
     */
    public ProjectResult createProject(String userId, NewProjectRequest request) {
        return execute("createProject", userId, request != null ? request.title() : null, () -> {
            ProjectInputValidator.requireUserId(userId);
            if (request == null) {
                throw new ProjectOperationException(INVALID_REQUEST, "Project data is required");
            }
            String title = ProjectInputValidator.requireTitle(request.title(), schedulingProperties.getDeletionMarker());
            ProjectSchedule schedule = request.schedule();
            ProjectInputValidator.validate(schedule);

            return userLocks.withLock(userId, () -> {
                if (projectRepository.existsByUserIdAndTitle(userId, title)) {
                    throw new ProjectOperationException(PROJECT_EXISTS, "A project with this title already exists");
                }
                Instant now = clock.instant();
                Project project = new Project();
                project.setUserId(userId);
                project.setTitle(title);
                project.setDescription(request.description());
                schedule.applyTo(project);
                project.setStatus(ProjectStatus.DRAFT);
                project.setNextRunAt(recurrenceCalculator.computeNextRun(schedule, false));
                project.setCreatedAt(now);
                project.setUpdatedAt(now);
                Project saved = projectRepository.save(project);
                afterMutation(userId, title);
                log.info("Project '{}' created for user {}; nextRunAt {}", title, userId, saved.getNextRunAt());
                return ProjectResult.success(saved.getStatus(), saved.getNextRunAt());
            });
        });
    }

    /**
     * Partial edit. Schedule changes on an active project are quota-checked and must land at least the guard window
     * ahead of now; other statuses just recompute nextRunAt.
     */
    public ProjectResult updateProjectSchedule(String userId, String requestedTitle, ScheduleUpdate update) {
        return execute("updateProjectSchedule", userId, requestedTitle, () -> {
            ProjectInputValidator.requireUserId(userId);
            String title = ProjectInputValidator.requireLookupTitle(requestedTitle);
            if (update == null || (!update.touchesSchedule() && update.description() == null)) {
                throw new ProjectOperationException(INVALID_REQUEST, "Nothing to update");
            }

            return userLocks.withLock(userId, () -> {
                Project project = loadProject(userId, title);
                return rejectingWithStatus(project, () -> reschedule(userId, project, update));
            });
        });
    }

    private ProjectResult reschedule(String userId, Project project, ScheduleUpdate update) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (update.description() != null) {
            fields.put("description", update.description());
        }
        if (!update.touchesSchedule()) {
            write(project, fields);
            return ProjectResult.success(project.getStatus(), project.getNextRunAt());
        }

        ProjectSchedule merged = update.mergeInto(ProjectSchedule.of(project));
        ProjectInputValidator.validate(merged);
        Instant nextRunAt;
        if (transitionTable.scheduleEditRequiresQuota(project.getStatus())) {
            requireAdmissible(userId, project, merged);
            nextRunAt = nextRunAfterEdit(project, merged);
        } else {
            nextRunAt = recurrenceCalculator.computeNextRun(merged, false);
        }

        Project edited = project.copy();
        merged.applyTo(edited);
        fields.put("frequency", edited.getFrequency());
        fields.put("deliveryTime", edited.getDeliveryTime());
        fields.put("timezone", edited.getTimezone());
        fields.put("dayOfWeek", edited.getDayOfWeek());
        fields.put("dayOfMonth", edited.getDayOfMonth());
        fields.put("nextRunAt", nextRunAt);
        write(project, fields);
        log.info("Project '{}' of user {} rescheduled; prevNextRunAt {}, nextRunAt {}",
                project.getTitle(), userId, project.getNextRunAt(), nextRunAt);
        return ProjectResult.success(project.getStatus(), nextRunAt);
    }

    /**
     * Requests a status change. Activation is quota-checked against the effective plan; DELETED delegates to
     * soft delete.
     */
    public ProjectResult toggleStatus(String userId, String requestedTitle, ProjectStatus target) {
        return execute("toggleStatus", userId, requestedTitle, () -> {
            ProjectInputValidator.requireUserId(userId);
            String title = ProjectInputValidator.requireLookupTitle(requestedTitle);
            if (target == null) {
                throw new ProjectOperationException(INVALID_REQUEST, "Target status is required");
            }

            return userLocks.withLock(userId, () -> {
                Project project = loadProject(userId, title);
                return rejectingWithStatus(project, () -> {
                    ProjectTransition transition = transitionTable.resolve(project.getStatus(), target);
                    return switch (transition) {
                        case DELETE -> softDelete(project);
                        case PAUSE -> {
                            write(project, Map.of("status", ProjectStatus.PAUSED));
                            log.info("Project '{}' of user {} paused", project.getTitle(), userId);
                            yield ProjectResult.success(ProjectStatus.PAUSED, project.getNextRunAt());
                        }
                        case ACTIVATE -> activate(userId, project);
                    };
                });
            });
        });
    }

    /**
     * Soft delete: status DELETED and the title renamed with the deletion marker, freeing the original title.
     */
    public ProjectResult deleteProject(String userId, String requestedTitle) {
        return execute("deleteProject", userId, requestedTitle, () -> {
            ProjectInputValidator.requireUserId(userId);
            String title = ProjectInputValidator.requireLookupTitle(requestedTitle);
            return userLocks.withLock(userId, () -> {
                Project project = loadProject(userId, title);
                return rejectingWithStatus(project, () -> {
                    transitionTable.resolve(project.getStatus(), ProjectStatus.DELETED);
                    return softDelete(project);
                });
            });
        });
    }

    /**
     * Next run for an unsaved schedule, after validation.
     */
    public ProjectResult computeNextRunAt(ProjectSchedule schedule) {
        return execute("computeNextRunAt", null, null, () -> {
            if (schedule == null) {
                throw new ProjectOperationException(INVALID_REQUEST, "Schedule is required");
            }
            ProjectInputValidator.validate(schedule);
            return ProjectResult.success(null, recurrenceCalculator.computeNextRun(schedule, false));
        });
    }

    /**
     * Whether one more active project with this schedule would fit the user's effective plan.
     */
    public ProjectResult validateQuota(String userId, ProjectSchedule schedule) {
        return execute("validateQuota", userId, null, () -> {
            ProjectInputValidator.requireUserId(userId);
            if (schedule == null) {
                throw new ProjectOperationException(INVALID_REQUEST, "Schedule is required");
            }
            ProjectInputValidator.validate(schedule);
            requireAdmissible(userId, null, schedule);
            return ProjectResult.success(null, null);
        });
    }

    /**
     * Non-deleted projects of the user, oldest first.
     *
     * @throws ProjectOperationException invalid_request when userId is blank
     * @throws DataAccessException when the list cannot be loaded from storage
     */
    public List<Project> listProjects(String userId) {
        ProjectInputValidator.requireUserId(userId);
        return activeProjectListCache.getOrLoad(userId).copyProjects();
    }

    /** Business rejections raised while working on a loaded project report its current status. */
    private static ProjectResult rejectingWithStatus(Project project, Supplier<ProjectResult> action) {
        try {
            return action.get();
        } catch (ProjectOperationException e) {
            throw e.getCurrentStatus() != null ? e : e.withCurrentStatus(project.getStatus());
        }
    }

    private ProjectResult activate(String userId, Project project) {
        requireAdmissible(userId, project, ProjectSchedule.of(project));
        Instant nextRunAt = project.getNextRunAt();
        if (nextRunAt == null || !nextRunAt.isAfter(clock.instant())) {
            nextRunAt = recurrenceCalculator.computeNextRun(ProjectSchedule.of(project), false);
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("status", ProjectStatus.ACTIVE);
        fields.put("nextRunAt", nextRunAt);
        write(project, fields);
        log.info("Project '{}' of user {} activated; nextRunAt {}", project.getTitle(), userId, nextRunAt);
        return ProjectResult.success(ProjectStatus.ACTIVE, nextRunAt);
    }

    private ProjectResult softDelete(Project project) {
        String deletedTitle = schedulingProperties.getDeletionMarker() + project.getTitle() + "#" + project.getId();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("title", deletedTitle);
        fields.put("status", ProjectStatus.DELETED);
        write(project, fields);
        log.info("Project '{}' of user {} deleted", project.getTitle(), project.getUserId());
        return ProjectResult.success(ProjectStatus.DELETED, null);
    }

    /**
     * Locates the project in the cached list, then re-reads it so status and version are current.
     */
    private Project loadProject(String userId, String title) {
        String id = activeProjectListCache.getOrLoad(userId).projects().stream()
                .filter(p -> title.equals(p.getTitle()))
                .map(Project::getId)
                .findFirst()
                .orElseThrow(() -> new ProjectOperationException(PROJECT_NOT_FOUND, "Project not found"));
        return projectRepository.findById(id)
                .filter(p -> p.getStatus() != ProjectStatus.DELETED && title.equals(p.getTitle()))
                .orElseThrow(() -> {
                    activeProjectListCache.invalidate(userId);
                    return new ProjectOperationException(PROJECT_NOT_FOUND, "Project not found");
                });
    }

    /**
     * Checks the user's active set, with {@code project} (if any) replaced by {@code schedule}, against the plan.
     */
    private void requireAdmissible(String userId, Project project, ProjectSchedule schedule) {
        Plan plan = planResolver.resolveEffectivePlan(userId)
                .orElseThrow(() -> new ProjectOperationException(USER_PLAN_NOT_FOUND, "Could not find user's plan"));
        List<Project> candidateSet = new ArrayList<>();
        for (Project active : activeProjectListCache.activeProjects(userId)) {
            if (project == null || !active.getId().equals(project.getId())) {
                candidateSet.add(active);
            }
        }
        candidateSet.add(QuotaValidator.candidate(schedule));
        QuotaEvaluation evaluation = quotaValidator.evaluate(plan.getMaxDailyRuns(), candidateSet);
        if (!evaluation.admissible()) {
            log.info("Quota rejected for user {} on plan {}: daily {}, peak weekly {}, peak monthly {}, max {}",
                    userId, plan.getPlanName(), evaluation.dailyCount(), evaluation.peakWeeklyBucket(),
                    evaluation.peakMonthlyBucket(), evaluation.maxDailyRuns());
            throw new ProjectOperationException(MAX_DAILY_RUNS,
                    "User has reached the maximum number of daily runs. Please subscribe to a higher plan, if available.");
        }
    }

    private Instant nextRunAfterEdit(Project project, ProjectSchedule schedule) {
        Instant candidate = recurrenceCalculator.computeNextRun(schedule, false);
        if (ExecutionTelemetry.alreadyRanFor(project.getLastRunAt(), candidate, schedule.timezone())) {
            candidate = recurrenceCalculator.computeNextRun(schedule, true);
        }
        Duration lead = Duration.between(clock.instant(), candidate);
        if (lead.compareTo(schedulingProperties.getGuardWindow()) < 0) {
            throw new ProjectOperationException(DELIVERY_WINDOW_TOO_CLOSE,
                    "The delivery time cannot be updated this close to the next run. Please choose a later time.");
        }
        return candidate;
    }

    private void write(Project project, Map<String, Object> changes) {
        Map<String, Object> fields = new LinkedHashMap<>(changes);
        fields.put("updatedAt", clock.instant());
        if (!projectRepository.updateFields(project.getId(), project.getVersion(), fields)) {
            throw new ProjectOperationException(CONCURRENT_MODIFICATION,
                    "Project was modified concurrently, please retry");
        }
        afterMutation(project.getUserId(), project.getTitle());
    }

    private void afterMutation(String userId, String title) {
        activeProjectListCache.invalidate(userId);
        applicationEventPublisher.publishEvent(new ProjectsChangedEvent(userId, title));
    }

    private ProjectResult execute(String operation, String userId, String title, Supplier<ProjectResult> action) {
        try {
            return action.get();
        } catch (ProjectOperationException e) {
            log.info("{} rejected for user {} project '{}': {} {}", operation, userId, title,
                    e.getErrorCode(), e.getMessage());
            return ProjectResult.failure(e.getCurrentStatus(), e.getErrorCode(), e.getMessage());
        } catch (OptimisticLockingFailureException e) {
            log.info("{} lost a concurrent write for user {} project '{}'", operation, userId, title);
            return ProjectResult.failure(CONCURRENT_MODIFICATION, "Project was modified concurrently, please retry");
        } catch (DuplicateKeyException e) {
            log.info("{} hit a duplicate title for user {} project '{}'", operation, userId, title);
            return ProjectResult.failure(PROJECT_EXISTS, "A project with this title already exists");
        } catch (DataAccessException | BillingException e) {
            log.error("{} failed for user {} project '{}'", operation, userId, title, e);
            return internalError(e);
        } catch (RuntimeException e) {
            log.error("{} failed unexpectedly for user {} project '{}'", operation, userId, title, e);
            return internalError(e);
        }
    }

    private ProjectResult internalError(RuntimeException e) {
        return ProjectResult.failure(INTERNAL_ERROR, "Internal error, please try again later",
                errorProperties.isIncludeDetail() ? e.getMessage() : null);
    }
}
