package com.relevx.push;

import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.UUID;

/**
 * One live subscription handle. Identity matters: the registry only removes the handle that is still registered.
 */
public class ProjectListSubscription {

    private static final Sinks.EmitFailureHandler RETRY_CONCURRENT_EMIT =
            Sinks.EmitFailureHandler.busyLooping(Duration.ofMillis(200));

    @Getter
    private final String userId;
    @Getter
    private final String id = UUID.randomUUID().toString();
    private final Sinks.Many<ProjectListUpdate> sink = Sinks.many().unicast().onBackpressureBuffer();

    public ProjectListSubscription(String userId) {
        this.userId = userId;
    }

    public void emit(ProjectListUpdate update) {
        sink.emitNext(update, RETRY_CONCURRENT_EMIT);
    }

    public void complete() {
        sink.emitComplete(RETRY_CONCURRENT_EMIT);
    }

    public Flux<ProjectListUpdate> updates() {
        return sink.asFlux();
    }
}
