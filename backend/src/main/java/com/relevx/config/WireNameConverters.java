package com.relevx.config;

import com.relevx.domain.Frequency;
import com.relevx.domain.ProjectStatus;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;

/**
 * Enum to wire-name converters for MongoDB. Unknown stored values read as null.
 */
final class WireNameConverters {

    private WireNameConverters() {
    }

    @WritingConverter
    static class FrequencyToWireName implements Converter<Frequency, String> {
        @Override
        public String convert(Frequency source) {
            return source.wireName();
        }
    }

    @ReadingConverter
    static class WireNameToFrequency implements Converter<String, Frequency> {
        @Override
        public Frequency convert(String source) {
            return Frequency.fromWireName(source);
        }
    }

    @WritingConverter
    static class ProjectStatusToWireName implements Converter<ProjectStatus, String> {
        @Override
        public String convert(ProjectStatus source) {
            return source.wireName();
        }
    }

    @ReadingConverter
    static class WireNameToProjectStatus implements Converter<String, ProjectStatus> {
        @Override
        public ProjectStatus convert(String source) {
            return ProjectStatus.fromWireName(source);
        }
    }
}
