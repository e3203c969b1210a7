package com.relevx.push;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * user id to live subscription. At most one subscription per user.
 */
public class SubscriptionRegistry {

    private final Map<String, ProjectListSubscription> subscriptions = new ConcurrentHashMap<>();

    /** Registers the handle and returns the one it replaced, if any. */
    public Optional<ProjectListSubscription> register(ProjectListSubscription subscription) {
        return Optional.ofNullable(subscriptions.put(subscription.getUserId(), subscription));
    }

    /** Removes the handle only if it is still the registered one. */
    public boolean remove(ProjectListSubscription subscription) {
        return subscriptions.remove(subscription.getUserId(), subscription);
    }

    public Optional<ProjectListSubscription> find(String userId) {
        return Optional.ofNullable(subscriptions.get(userId));
    }

    public int size() {
        return subscriptions.size();
    }
}
