package com.relevx.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Scheduler configuration. Documented in application.yml under relevx.scheduling.
 */
@ConfigurationProperties(prefix = "relevx.scheduling")
@Getter
@Setter
public class SchedulingProperties {

    /**
     * Minimum distance between now and the next run of an active project after a schedule edit. Edits landing
     * closer are rejected so the execution system's pre-run work is not cut short.
     */
    private Duration guardWindow = Duration.ofMinutes(16);

    /**
     * Lifetime of a cached active project list.
     */
    private Duration activeListTtl = Duration.ofMinutes(5);

    /**
     * Maximum number of users with a cached project list.
     */
    private long activeListMaxSize = 10_000;

    /**
     * Title prefix of soft-deleted projects. Final title is marker + original title + "#" + id.
     */
    private String deletionMarker = "[DELETED]:";
}
