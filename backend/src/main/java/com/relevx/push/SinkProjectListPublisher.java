package com.relevx.push;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Publishes into the registered subscription's sink.
 */
@RequiredArgsConstructor
@Slf4j
public class SinkProjectListPublisher implements ProjectListPublisher {

    private final SubscriptionRegistry registry;

    @Override
    public void publish(String userId, ProjectListUpdate update) {
        registry.find(userId).ifPresentOrElse(
                s -> s.emit(update),
                () -> log.debug("No live subscription for user {}, update dropped", userId));
    }
}
