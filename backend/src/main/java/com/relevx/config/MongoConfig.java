package com.relevx.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.Arrays;

/**
 * MongoDB configuration: frequency and status are stored by their lower-case wire names (daily, active, ...).
 * Indexes are created from @CompoundIndex on domain documents at startup.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(Arrays.asList(
                new WireNameConverters.FrequencyToWireName(),
                new WireNameConverters.WireNameToFrequency(),
                new WireNameConverters.ProjectStatusToWireName(),
                new WireNameConverters.WireNameToProjectStatus()
        ));
    }
}
