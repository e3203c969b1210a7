package com.relevx.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A user's recurring research delivery job. Title is unique per user and acts as the lookup key.
 * lastRunAt/lastError are written by the execution system only.
 */
@Document(collection = "projects")
@CompoundIndex(name = "user_title", def = "{'userId': 1, 'title': 1}", unique = true)
@CompoundIndex(name = "user_status", def = "{'userId': 1, 'status': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Project {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String userId;
    private String title;
    private String description;
    private Frequency frequency;
    /** HH:MM, 24-hour, local to {@link #timezone}. */
    private String deliveryTime;
    /** IANA zone id, e.g. America/New_York. */
    private String timezone;
    /** 0-6, Sunday first. Weekly only. */
    private Integer dayOfWeek;
    /** 1-31, clamped to month length. Monthly only. */
    private Integer dayOfMonth;
    private ProjectStatus status;
    private Instant nextRunAt;
    private Instant lastRunAt;
    private String lastError;
    private Instant createdAt;
    private Instant updatedAt;
    @Version
    private Long version;

    /**
     * Field-by-field copy. Used wherever a project leaves an owner that must not be mutated from outside.
     */
    public Project copy() {
        Project p = new Project();
        p.setId(id);
        p.setUserId(userId);
        p.setTitle(title);
        p.setDescription(description);
        p.setFrequency(frequency);
        p.setDeliveryTime(deliveryTime);
        p.setTimezone(timezone);
        p.setDayOfWeek(dayOfWeek);
        p.setDayOfMonth(dayOfMonth);
        p.setStatus(status);
        p.setNextRunAt(nextRunAt);
        p.setLastRunAt(lastRunAt);
        p.setLastError(lastError);
        p.setCreatedAt(createdAt);
        p.setUpdatedAt(updatedAt);
        p.setVersion(version);
        return p;
    }
}
