package com.relevx.domain;

/**
 * Application event: a user's project set changed. Consumed by the cache refresh listener, which reloads the
 * authoritative list and pushes it to the user's live subscription.
 */
public record ProjectsChangedEvent(String userId, String projectTitle) {
}
