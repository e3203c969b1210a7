package com.relevx.billing;

import com.relevx.config.BillingProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Stripe client and its local rate limiter, from relevx.billing.stripe.
 */
@Configuration
public class BillingConfig {

    @Bean
    public StripeClient stripeClient(WebClient.Builder webClientBuilder, BillingProperties properties) {
        BillingProperties.Stripe stripe = properties.getStripe();
        return new WebClientStripeClient(webClientBuilder, stripe.getBaseUrl(), stripe.getApiKey());
    }

    @Bean(name = "stripeRateLimiter")
    public RateLimiter stripeRateLimiter(BillingProperties properties) {
        BillingProperties.Stripe stripe = properties.getStripe();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, stripe.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, stripe.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("stripe", config);
    }
}
