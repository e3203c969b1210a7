package com.relevx.billing;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientStripeClientTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private WebClientStripeClient client(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            lastRequest.set(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
        return new WebClientStripeClient(builder, "https://stripe.test", "sk_test_123");
    }

    @Test
    void getsSubscriptionWithBearerKey() {
        String json = client(HttpStatus.OK, "{\"status\":\"active\"}").getSubscription("sub_1").block();

        assertThat(json).contains("active");
        assertThat(lastRequest.get().url().toString()).isEqualTo("https://stripe.test/v1/subscriptions/sub_1");
        assertThat(lastRequest.get().headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk_test_123");
    }

    @Test
    void httpErrorBecomesBillingException() {
        WebClientStripeClient client = client(HttpStatus.NOT_FOUND, "{\"error\":{\"message\":\"No such subscription\"}}");

        assertThatThrownBy(() -> client.getSubscription("sub_missing").block())
                .isInstanceOf(BillingException.class)
                .hasMessageContaining("404");
    }

    @Test
    void connectionFailureBecomesBillingException() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> Mono.error(
                new WebClientRequestException(new ConnectException("Connection refused"), HttpMethod.GET,
                        request.url(), new HttpHeaders())));
        WebClientStripeClient client = new WebClientStripeClient(builder, "https://stripe.test", "sk_test_123");

        assertThatThrownBy(() -> client.getSubscription("sub_1").block())
                .isInstanceOf(BillingException.class)
                .hasMessageContaining("unreachable")
                .hasCauseInstanceOf(WebClientRequestException.class);
    }
}
