package com.relevx.api.controller;

import com.relevx.api.dto.ErrorBody;
import com.relevx.push.ProjectListUpdate;
import com.relevx.push.ProjectSubscriptionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * GET /projects/subscribe: live project list as server-sent events. The caller is identified by X-User-Id.
 */
@RestController
@RequestMapping("/api/v1/projects")
@RequiredArgsConstructor
public class ProjectSubscriptionController {

    public static final String USER_HEADER = "X-User-Id";
    static final String EVENT_NAME = "projects";

    private final ProjectSubscriptionService subscriptionService;

    @GetMapping("/subscribe")
    public ResponseEntity<?> subscribe(@RequestHeader(value = USER_HEADER, required = false) String userId) {
        if (userId == null || userId.isBlank()) {
            return ResponseEntity.badRequest().body(ErrorBody.of("UNAUTHENTICATED", USER_HEADER + " header is required"));
        }
        Flux<ServerSentEvent<ProjectListUpdate>> events = subscriptionService.subscribe(userId.trim())
                .map(update -> ServerSentEvent.builder(update).event(EVENT_NAME).build());
        return ResponseEntity.ok().contentType(MediaType.TEXT_EVENT_STREAM).body(events);
    }
}
