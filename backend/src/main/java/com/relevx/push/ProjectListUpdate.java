package com.relevx.push;

import com.relevx.cache.ActiveProjectSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Payload pushed to a live subscription: the user's full non-deleted project list.
 */
public record ProjectListUpdate(List<ProjectView> projects, Instant fetchedAt) {

    public static ProjectListUpdate of(ActiveProjectSnapshot snapshot) {
        return new ProjectListUpdate(
                snapshot.projects().stream().map(ProjectView::of).toList(),
                snapshot.fetchedAt());
    }
}
