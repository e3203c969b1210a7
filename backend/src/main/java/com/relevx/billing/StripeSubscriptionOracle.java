package com.relevx.billing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relevx.config.BillingProperties;
import com.relevx.domain.UserProfile;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;

/**
 * Subscription check against Stripe. A user is subscribed when their subscription id is set and Stripe reports the
 * subscription as active or trialing. Lookups are throttled by the stripeRateLimiter and bounded by the read timeout;
 * any lookup failure surfaces as {@link BillingException}.
 */
@Component
@Slf4j
public class StripeSubscriptionOracle implements SubscriptionOracle {

    private static final Set<String> SUBSCRIBED_STATUSES = Set.of("active", "trialing");

    private final StripeClient stripeClient;
    private final RateLimiter stripeRateLimiter;
    private final ObjectMapper objectMapper;
    private final BillingProperties billingProperties;

    public StripeSubscriptionOracle(StripeClient stripeClient,
                                    @Qualifier("stripeRateLimiter") RateLimiter stripeRateLimiter,
                                    ObjectMapper objectMapper,
                                    BillingProperties billingProperties) {
        this.stripeClient = stripeClient;
        this.stripeRateLimiter = stripeRateLimiter;
        this.objectMapper = objectMapper;
        this.billingProperties = billingProperties;
    }

    @Override
    public boolean isSubscribed(UserProfile user) {
        String subscriptionId = user.getBilling() != null ? user.getBilling().getStripeSubscriptionId() : null;
        if (subscriptionId == null || subscriptionId.isBlank()) {
            return false;
        }
        if (!stripeRateLimiter.acquirePermission()) {
            throw new BillingException("Local limiter timeout before subscription lookup for user " + user.getId());
        }
        Duration readTimeout = Duration.ofSeconds(Math.max(1, billingProperties.getStripe().getReadTimeoutSeconds()));
        String json = stripeClient.getSubscription(subscriptionId)
                .timeout(readTimeout)
                .onErrorMap(e -> !(e instanceof BillingException),
                        e -> new BillingException("Subscription lookup failed for user " + user.getId() + ": " + e, e))
                .block();
        String status = parseStatus(json);
        boolean subscribed = SUBSCRIBED_STATUSES.contains(status);
        log.debug("Subscription {} of user {} has status {}", subscriptionId, user.getId(), status);
        return subscribed;
    }

    String parseStatus(String json) {
        if (json == null || json.isBlank()) {
            throw new BillingException("Empty subscription response");
        }
        try {
            JsonNode status = objectMapper.readTree(json).path("status");
            if (!status.isTextual()) {
                throw new BillingException("Subscription response has no status");
            }
            return status.asText();
        } catch (JsonProcessingException e) {
            throw new BillingException("Unreadable subscription response", e);
        }
    }
}
