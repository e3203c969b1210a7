package com.relevx.billing;

import reactor.core.publisher.Mono;

/**
 * Minimal Stripe REST access. Returns the raw subscription JSON.
 */
public interface StripeClient {

    Mono<String> getSubscription(String subscriptionId);
}
