package com.relevx.push;

import com.relevx.cache.ActiveProjectListCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Lifecycle of a user's live project-list stream. A new subscription replaces the previous one; the first element
 * is the current list, followed by every pushed update. When the stream ends the registry slot and the cache entry
 * are released.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectSubscriptionService {

    private final SubscriptionRegistry registry;
    private final ActiveProjectListCache cache;

    public Flux<ProjectListUpdate> subscribe(String userId) {
        ProjectListSubscription subscription = new ProjectListSubscription(userId);
        registry.register(subscription).ifPresent(previous -> {
            previous.complete();
            cache.invalidate(userId);
            log.info("Replaced live subscription {} of user {}", previous.getId(), userId);
        });
        log.info("Live subscription {} opened for user {}", subscription.getId(), userId);

        Mono<ProjectListUpdate> initial = Mono.fromCallable(() -> ProjectListUpdate.of(cache.getOrLoad(userId)))
                .subscribeOn(Schedulers.boundedElastic());
        return initial.concatWith(subscription.updates())
                .doFinally(signal -> release(subscription, signal.toString()));
    }

    private void release(ProjectListSubscription subscription, String reason) {
        if (registry.remove(subscription)) {
            cache.invalidate(subscription.getUserId());
        }
        log.info("Live subscription {} of user {} closed ({})",
                subscription.getId(), subscription.getUserId(), reason);
    }
}
