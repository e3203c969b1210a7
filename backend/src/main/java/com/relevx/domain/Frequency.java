package com.relevx.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Recurrence unit of a project. Serialized in lower case (daily, weekly, monthly) to match stored documents.
 */
public enum Frequency {
    DAILY,
    WEEKLY,
    MONTHLY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse of the wire name; returns null for blank or unknown values so callers can report an input error.
     */
    @JsonCreator
    public static Frequency fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (Frequency f : values()) {
            if (f.name().equalsIgnoreCase(value.trim())) {
                return f;
            }
        }
        return null;
    }
}
