package com.relevx.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a project. RUNNING and ERROR are owned by the execution system.
 */
public enum ProjectStatus {
    DRAFT,
    ACTIVE,
    PAUSED,
    RUNNING,
    ERROR,
    DELETED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProjectStatus fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (ProjectStatus s : values()) {
            if (s.name().equalsIgnoreCase(value.trim())) {
                return s;
            }
        }
        return null;
    }
}
