package com.relevx.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Billing provider configuration. Documented in application.yml under relevx.billing.
 */
@ConfigurationProperties(prefix = "relevx.billing")
@Getter
@Setter
public class BillingProperties {

    private Stripe stripe = new Stripe();

    @Getter
    @Setter
    public static class Stripe {
        /** Stripe REST API base URL. */
        private String baseUrl = "https://api.stripe.com";
        /** Secret key sent as bearer token. */
        private String apiKey;
        /** Token bucket: subscription lookups per second. */
        private int maxRequestsPerSecond = 20;
        /** How long a caller waits for a permit before the lookup fails. */
        private long localLimiterTimeoutMs = 500;
        /** Response timeout in seconds for one lookup. */
        private int readTimeoutSeconds = 10;
    }
}
