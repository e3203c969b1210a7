package com.relevx.cache;

import com.relevx.domain.Project;

import java.time.Instant;
import java.util.List;

/**
 * Cached non-deleted projects of one user. The list is unmodifiable and holds copies owned by the cache.
 */
public record ActiveProjectSnapshot(String userId, List<Project> projects, Instant fetchedAt, Instant expiresAt) {

    public ActiveProjectSnapshot {
        projects = projects.stream().map(Project::copy).toList();
    }

    /** Fresh copies for a caller that may mutate them. */
    public List<Project> copyProjects() {
        return projects.stream().map(Project::copy).toList();
    }
}
