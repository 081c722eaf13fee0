package com.billing.payment.dispatch;

import com.billing.common.error.ErrorCodes;
import com.billing.events.PaymentWebhookEvent;
import com.billing.events.WebhookHeaders;
import com.billing.events.serde.EventObjectMapper;
import com.billing.events.signature.WebhookSignature;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Posts signed payment-outcome webhooks to the subscription service.
 *
 * <p>Each attempt signs the same bytes again and carries the same idempotency key, so the
 * receiver can tell redeliveries apart from new events. Network errors, 408, 429, 5xx and a 409
 * saying an earlier attempt with the same key is still in flight are retried with exponential
 * backoff plus jitter; any other non-2xx answer is final.
 */
@Component
public class WebhookDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WebhookDispatcher.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private final RestClient restClient;
    private final URI targetUrl;
    private final WebhookSignature signature;
    private final MeterRegistry meterRegistry;
    private final long baseDelayMs;
    private final long jitterMaxMs;

    public WebhookDispatcher(@Qualifier("webhookRestClient") RestClient restClient,
                             @Value("${webhook.target-url}") String targetUrl,
                             WebhookSignature signature,
                             MeterRegistry meterRegistry,
                             @Value("${webhook.dispatch.base-delay-ms:1000}") long baseDelayMs,
                             @Value("${webhook.dispatch.jitter-max-ms:250}") long jitterMaxMs) {
        this.restClient = restClient;
        this.targetUrl = URI.create(targetUrl);
        this.signature = signature;
        this.meterRegistry = meterRegistry;
        this.baseDelayMs = baseDelayMs;
        this.jitterMaxMs = jitterMaxMs;
    }

    /**
     * Serializes the event once and delivers it. Returns true only when the receiver accepted it.
     */
    public boolean send(PaymentWebhookEvent event, int maxAttempts) {
        String payload;
        try {
            payload = EventObjectMapper.instance().writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize webhook for payment " + event.paymentId(), e);
        }
        DeliveryResult result = deliver(payload, WebhookHeaders.webhookIdempotencyKey(event.paymentId()), maxAttempts);
        return result instanceof DeliveryResult.Delivered;
    }

    public boolean send(PaymentWebhookEvent event) {
        return send(event, DEFAULT_MAX_ATTEMPTS);
    }

    public DeliveryResult deliver(String payload, String idempotencyKey, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        byte[] body = payload.getBytes(StandardCharsets.UTF_8);
        Integer lastStatus = null;
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Answer answer = post(body, idempotencyKey);
                int status = answer.status();
                if (status >= 200 && status < 300) {
                    meterRegistry.counter("webhook_deliveries_total", "result", "delivered").increment();
                    log.info("Webhook {} delivered on attempt {}/{} ({})", idempotencyKey, attempt, maxAttempts, status);
                    return new DeliveryResult.Delivered(status, attempt);
                }
                if (!isRetryable(status, answer.errorCode())) {
                    meterRegistry.counter("webhook_deliveries_total", "result", "rejected").increment();
                    log.error("Webhook {} rejected with status {}, not retrying", idempotencyKey, status);
                    return new DeliveryResult.Rejected(status, "Receiver answered " + status, attempt);
                }
                lastStatus = status;
                lastError = answer.errorCode() == null
                        ? "Receiver answered " + status
                        : "Receiver answered " + status + " " + answer.errorCode();
            } catch (RestClientException e) {
                lastStatus = null;
                lastError = e.getMessage();
            }
            log.warn("Webhook {} attempt {}/{} failed: {}", idempotencyKey, attempt, maxAttempts, lastError);

            if (attempt < maxAttempts) {
                try {
                    Thread.sleep(backoffMs(attempt));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return exhausted(idempotencyKey, lastStatus, "Interrupted while backing off: " + lastError, attempt);
                }
            }
        }
        return exhausted(idempotencyKey, lastStatus, lastError, maxAttempts);
    }

    private DeliveryResult exhausted(String idempotencyKey, Integer lastStatus, String lastError, int attempts) {
        meterRegistry.counter("webhook_deliveries_total", "result", "exhausted").increment();
        log.error("Webhook {} not delivered after {} attempts: {}", idempotencyKey, attempts, lastError);
        return new DeliveryResult.Exhausted(lastStatus, lastError, attempts);
    }

    private Answer post(byte[] body, String idempotencyKey) {
        return restClient.post()
                .uri(targetUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .header(WebhookHeaders.SIGNATURE, signature.sign(body))
                .header(WebhookHeaders.IDEMPOTENCY_KEY, idempotencyKey)
                .body(body)
                .exchange((request, response) -> {
                    int status = response.getStatusCode().value();
                    return new Answer(status, status == 409 ? errorCode(response) : null);
                });
    }

    static boolean isRetryable(int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    /**
     * A 409 is final unless the receiver reports that the same key is still being processed.
     */
    static boolean isRetryable(int status, String errorCode) {
        if (status == 409) {
            return ErrorCodes.IDEMPOTENCY_REQUEST_IN_PROGRESS.equals(errorCode);
        }
        return isRetryable(status);
    }

    private static String errorCode(ClientHttpResponse response) {
        try (InputStream in = response.getBody()) {
            JsonNode code = EventObjectMapper.instance().readTree(in).path("code");
            return code.isTextual() ? code.asText() : null;
        } catch (IOException e) {
            log.debug("Could not read error code from webhook response: {}", e.getMessage());
            return null;
        }
    }

    long backoffMs(int attempt) {
        long jitter = jitterMaxMs > 0 ? ThreadLocalRandom.current().nextLong(jitterMaxMs + 1) : 0;
        return baseDelayMs * (1L << (attempt - 1)) + jitter;
    }

    private record Answer(int status, String errorCode) {
    }
}
