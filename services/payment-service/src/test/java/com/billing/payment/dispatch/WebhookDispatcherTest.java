package com.billing.payment.dispatch;

import com.billing.events.PaymentOutcome;
import com.billing.events.PaymentWebhookEvent;
import com.billing.events.signature.WebhookSignature;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WebhookDispatcherTest {

    private static final String TARGET = "http://subscriptions.test/v1/webhooks/payment";
    private static final String PAYLOAD = "{\"eventType\":\"payment.completed\",\"paymentId\":\"p-1\"}";
    private static final String KEY = "webhook_p-1";

    private final WebhookSignature signature = new WebhookSignature("dispatch-secret");
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private MockRestServiceServer server;
    private WebhookDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        dispatcher = new WebhookDispatcher(builder.build(), TARGET, signature, meterRegistry, 1, 0);
    }

    private String expectedSignature() {
        return signature.sign(PAYLOAD.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void deliversSignedPayloadOnFirstAttempt() {
        server.expect(ExpectedCount.once(), requestTo(TARGET))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("X-Webhook-Signature", expectedSignature()))
                .andExpect(header("Idempotency-Key", KEY))
                .andExpect(content().string(PAYLOAD))
                .andRespond(withSuccess());

        DeliveryResult result = dispatcher.deliver(PAYLOAD, KEY, 3);

        assertThat(result).isEqualTo(new DeliveryResult.Delivered(200, 1));
        server.verify();
        assertThat(meterRegistry.counter("webhook_deliveries_total", "result", "delivered").count()).isEqualTo(1.0);
    }

    @Test
    void retriesServerErrorsWithSameBytesAndKey() {
        server.expect(ExpectedCount.once(), requestTo(TARGET))
                .andExpect(header("X-Webhook-Signature", expectedSignature()))
                .andExpect(header("Idempotency-Key", KEY))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        server.expect(ExpectedCount.once(), requestTo(TARGET))
                .andExpect(header("X-Webhook-Signature", expectedSignature()))
                .andExpect(header("Idempotency-Key", KEY))
                .andExpect(content().string(PAYLOAD))
                .andRespond(withSuccess());

        DeliveryResult result = dispatcher.deliver(PAYLOAD, KEY, 3);

        assertThat(result).isEqualTo(new DeliveryResult.Delivered(200, 2));
        server.verify();
    }

    @Test
    void retriesNetworkErrors() {
        server.expect(ExpectedCount.once(), requestTo(TARGET))
                .andRespond(withException(new IOException("connection reset")));
        server.expect(ExpectedCount.once(), requestTo(TARGET))
                .andRespond(withSuccess());

        assertThat(dispatcher.deliver(PAYLOAD, KEY, 3)).isInstanceOf(DeliveryResult.Delivered.class);
        server.verify();
    }

    @Test
    void clientErrorIsFinal() {
        server.expect(ExpectedCount.once(), requestTo(TARGET))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST));

        DeliveryResult result = dispatcher.deliver(PAYLOAD, KEY, 3);

        assertThat(result).isInstanceOf(DeliveryResult.Rejected.class);
        assertThat(((DeliveryResult.Rejected) result).statusCode()).isEqualTo(400);
        assertThat(result.attempts()).isEqualTo(1);
        server.verify();
    }

    @Test
    void notFoundIsFinal() {
        server.expect(ExpectedCount.once(), requestTo(TARGET))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(dispatcher.deliver(PAYLOAD, KEY, 3)).isInstanceOf(DeliveryResult.Rejected.class);
        server.verify();
    }

    @Test
    void exhaustsAfterMaxAttempts() {
        server.expect(ExpectedCount.times(3), requestTo(TARGET))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        DeliveryResult result = dispatcher.deliver(PAYLOAD, KEY, 3);

        assertThat(result).isInstanceOf(DeliveryResult.Exhausted.class);
        DeliveryResult.Exhausted exhausted = (DeliveryResult.Exhausted) result;
        assertThat(exhausted.lastStatusCode()).isEqualTo(429);
        assertThat(exhausted.attempts()).isEqualTo(3);
        server.verify();
        assertThat(meterRegistry.counter("webhook_deliveries_total", "result", "exhausted").count()).isEqualTo(1.0);
    }

    @Test
    void sendSerializesEventAndUsesStableKey() {
        PaymentWebhookEvent event = PaymentWebhookEvent.from(
                new PaymentOutcome.Success("pay-42", new BigDecimal("9.99"), "USD", Instant.parse("2026-01-01T00:00:00Z")),
                "sub-1", null);
        server.expect(ExpectedCount.once(), requestTo(TARGET))
                .andExpect(header("Idempotency-Key", "webhook_pay-42"))
                .andRespond(withSuccess());

        assertThat(dispatcher.send(event)).isTrue();
        server.verify();
    }

    @Test
    void sendReportsFailureWhenRejected() {
        PaymentWebhookEvent event = PaymentWebhookEvent.from(
                new PaymentOutcome.Failure("pay-43", new BigDecimal("9.99"), "USD", Instant.now(), "declined"),
                "sub-1", null);
        server.expect(ExpectedCount.once(), requestTo(TARGET))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThat(dispatcher.send(event, 1)).isFalse();
    }

    @Test
    void retryableStatuses() {
        assertThat(WebhookDispatcher.isRetryable(408)).isTrue();
        assertThat(WebhookDispatcher.isRetryable(429)).isTrue();
        assertThat(WebhookDispatcher.isRetryable(500)).isTrue();
        assertThat(WebhookDispatcher.isRetryable(504)).isTrue();
        assertThat(WebhookDispatcher.isRetryable(400)).isFalse();
        assertThat(WebhookDispatcher.isRetryable(404)).isFalse();
        assertThat(WebhookDispatcher.isRetryable(409)).isFalse();
        assertThat(WebhookDispatcher.isRetryable(409, "IDEMPOTENCY_REQUEST_IN_PROGRESS")).isTrue();
        assertThat(WebhookDispatcher.isRetryable(409, "IDEMPOTENCY_KEY_REUSED")).isFalse();
        assertThat(WebhookDispatcher.isRetryable(409, null)).isFalse();
        assertThat(WebhookDispatcher.isRetryable(503, null)).isTrue();
    }

    @Test
    void retriesWhileReceiverStillProcessesSameKey() {
        server.expect(ExpectedCount.once(), requestTo(TARGET))
                .andExpect(header("Idempotency-Key", KEY))
                .andRespond(withStatus(HttpStatus.CONFLICT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"statusCode\":409,\"code\":\"IDEMPOTENCY_REQUEST_IN_PROGRESS\"}"));
        server.expect(ExpectedCount.once(), requestTo(TARGET))
                .andExpect(header("X-Webhook-Signature", expectedSignature()))
                .andExpect(header("Idempotency-Key", KEY))
                .andRespond(withSuccess());

        DeliveryResult result = dispatcher.deliver(PAYLOAD, KEY, 3);

        assertThat(result).isEqualTo(new DeliveryResult.Delivered(200, 2));
        server.verify();
    }

    @Test
    void keyReusedConflictIsFinal() {
        server.expect(ExpectedCount.once(), requestTo(TARGET))
                .andRespond(withStatus(HttpStatus.CONFLICT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"statusCode\":409,\"code\":\"IDEMPOTENCY_KEY_REUSED\"}"));

        DeliveryResult result = dispatcher.deliver(PAYLOAD, KEY, 3);

        assertThat(result).isInstanceOf(DeliveryResult.Rejected.class);
        assertThat(((DeliveryResult.Rejected) result).statusCode()).isEqualTo(409);
        server.verify();
    }

    @Test
    void inProgressConflictOnEveryAttemptEndsExhausted() {
        server.expect(ExpectedCount.times(2), requestTo(TARGET))
                .andRespond(withStatus(HttpStatus.CONFLICT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"code\":\"IDEMPOTENCY_REQUEST_IN_PROGRESS\"}"));

        DeliveryResult result = dispatcher.deliver(PAYLOAD, KEY, 2);

        assertThat(result).isInstanceOf(DeliveryResult.Exhausted.class);
        DeliveryResult.Exhausted exhausted = (DeliveryResult.Exhausted) result;
        assertThat(exhausted.lastStatusCode()).isEqualTo(409);
        assertThat(exhausted.lastError()).contains("IDEMPOTENCY_REQUEST_IN_PROGRESS");
        assertThat(exhausted.attempts()).isEqualTo(2);
        server.verify();
    }

    @Test
    void backoffDoublesAndStaysWithinJitter() {
        WebhookDispatcher jittered = new WebhookDispatcher(RestClient.create(), TARGET, signature,
                meterRegistry, 100, 50);

        assertThat(jittered.backoffMs(1)).isBetween(100L, 150L);
        assertThat(jittered.backoffMs(2)).isBetween(200L, 250L);
        assertThat(jittered.backoffMs(3)).isBetween(400L, 450L);
    }

    @Test
    void rejectsNonPositiveAttempts() {
        assertThatThrownBy(() -> dispatcher.deliver(PAYLOAD, KEY, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
