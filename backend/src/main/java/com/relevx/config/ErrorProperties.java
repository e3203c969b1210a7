package com.relevx.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Error reporting configuration under relevx.errors.
 */
@ConfigurationProperties(prefix = "relevx.errors")
@Getter
@Setter
public class ErrorProperties {

    /**
     * When true, internal_error results carry the underlying exception message in detail. Off in prod.
     */
    private boolean includeDetail = true;
}
