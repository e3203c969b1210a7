package com.relevx.push;

/**
 * Outbound channel to a user's live project-list subscription.
 */
public interface ProjectListPublisher {

    /** Emits to the user's subscription if one is registered; no-op otherwise. */
    void publish(String userId, ProjectListUpdate update);
}
