package com.relevx.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.relevx.common.UserLocks;
import com.relevx.config.SchedulingProperties;
import com.relevx.domain.Project;
import com.relevx.domain.ProjectRepository;
import com.relevx.domain.ProjectStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Per-user cache of non-deleted projects with a write TTL. Storage stays authoritative: misses fall back to
 * {@link ProjectRepository}, mutations invalidate, and {@link #refresh} replaces the entry with a fresh load.
 * Loads run under the user's lock, the same lock mutations hold while writing and invalidating, so a load started
 * before a mutation can never be stored after that mutation's invalidation.
 */
@Component
@Slf4j
public class ActiveProjectListCache {

    private final Cache<String, ActiveProjectSnapshot> snapshots;
    private final ProjectRepository projectRepository;
    private final UserLocks userLocks;
    private final SchedulingProperties properties;
    private final Clock clock;

    @Autowired
    public ActiveProjectListCache(ProjectRepository projectRepository, UserLocks userLocks,
                                  SchedulingProperties properties, Clock clock) {
        this(projectRepository, userLocks, properties, clock, Ticker.systemTicker());
    }

    ActiveProjectListCache(ProjectRepository projectRepository, UserLocks userLocks,
                           SchedulingProperties properties, Clock clock, Ticker ticker) {
        this.projectRepository = projectRepository;
        this.userLocks = userLocks;
        this.properties = properties;
        this.clock = clock;
        this.snapshots = Caffeine.newBuilder()
                .expireAfterWrite(properties.getActiveListTtl())
                .maximumSize(properties.getActiveListMaxSize())
                .ticker(ticker)
                .build();
    }

    public Optional<ActiveProjectSnapshot> get(String userId) {
        return Optional.ofNullable(snapshots.getIfPresent(userId));
    }

    /** Cached snapshot, or a storage load that is stored before returning. */
    public ActiveProjectSnapshot getOrLoad(String userId) {
        ActiveProjectSnapshot cached = snapshots.getIfPresent(userId);
        if (cached != null) {
            return cached;
        }
        return userLocks.withLock(userId, () -> {
            ActiveProjectSnapshot loadedMeanwhile = snapshots.getIfPresent(userId);
            return loadedMeanwhile != null ? loadedMeanwhile : set(userId, load(userId));
        });
    }

    public ActiveProjectSnapshot set(String userId, List<Project> projects) {
        Instant now = clock.instant();
        ActiveProjectSnapshot snapshot = new ActiveProjectSnapshot(userId, projects, now,
                now.plus(properties.getActiveListTtl()));
        snapshots.put(userId, snapshot);
        return snapshot;
    }

    /** Authoritative reload replacing the entry. */
    public ActiveProjectSnapshot refresh(String userId) {
        ActiveProjectSnapshot snapshot = userLocks.withLock(userId, () -> set(userId, load(userId)));
        log.debug("Refreshed {} projects for user {}", snapshot.projects().size(), userId);
        return snapshot;
    }

    public void invalidate(String userId) {
        snapshots.invalidate(userId);
    }

    /** Copies of the user's projects with status ACTIVE. */
    public List<Project> activeProjects(String userId) {
        return getOrLoad(userId).projects().stream()
                .filter(p -> p.getStatus() == ProjectStatus.ACTIVE)
                .map(Project::copy)
                .toList();
    }

    private List<Project> load(String userId) {
        return projectRepository.findByUserIdAndStatusNotOrderByCreatedAtAsc(userId, ProjectStatus.DELETED);
    }
}
