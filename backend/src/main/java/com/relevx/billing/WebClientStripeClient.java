package com.relevx.billing;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Stripe client over WebClient: GET {baseUrl}/v1/subscriptions/{id} with the secret key as bearer token.
 */
public class WebClientStripeClient implements StripeClient {

    private final WebClient webClient;

    public WebClientStripeClient(WebClient.Builder builder, String baseUrl, String apiKey) {
        WebClient.Builder b = builder.clone()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (apiKey != null && !apiKey.isBlank()) {
            b.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        this.webClient = b.build();
    }

    @Override
    public Mono<String> getSubscription(String subscriptionId) {
        return webClient.get()
                .uri("/v1/subscriptions/{id}", subscriptionId)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class,
                        e -> new BillingException("Stripe subscription lookup failed: " + e.getStatusCode(), e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new BillingException("Stripe unreachable: " + e.getMessage(), e));
    }
}
