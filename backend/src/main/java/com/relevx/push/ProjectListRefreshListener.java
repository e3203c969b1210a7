package com.relevx.push;

import com.relevx.cache.ActiveProjectListCache;
import com.relevx.cache.ActiveProjectSnapshot;
import com.relevx.config.AsyncConfig;
import com.relevx.domain.ProjectsChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * After a project mutation: reload the user's list into the cache and push it to the live subscription.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProjectListRefreshListener {

    private final ActiveProjectListCache cache;
    private final ProjectListPublisher publisher;

    @Async(AsyncConfig.PUSH_EXECUTOR)
    @EventListener
    public void onProjectsChanged(ProjectsChangedEvent event) {
        try {
            ActiveProjectSnapshot snapshot = cache.refresh(event.userId());
            publisher.publish(event.userId(), ProjectListUpdate.of(snapshot));
        } catch (RuntimeException e) {
            cache.invalidate(event.userId());
            log.error("Project list refresh failed for user {} after change to '{}'",
                    event.userId(), event.projectTitle(), e);
        }
    }
}
