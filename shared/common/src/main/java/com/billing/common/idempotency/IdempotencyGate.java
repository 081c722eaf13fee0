package com.billing.common.idempotency;

import com.billing.common.error.ApiException;
import com.billing.common.error.ErrorCodes;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Wraps a mutating controller operation so that a retried request carrying the same
 * {@code Idempotency-Key} gets the stored response instead of executing twice.
 *
 * <p>Only 2xx responses are stored. If the operation throws, the claim is released and the
 * exception propagates to the normal error handling, so the client may retry with the same key.
 */
@Component
public class IdempotencyGate {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyGate.class);

    public static final String REPLAYED_HEADER = "Idempotent-Replayed";
    static final int MAX_KEY_LENGTH = 255;

    private final IdempotencyStore store;
    private final RequestFingerprint fingerprint;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final boolean requireKey;

    public IdempotencyGate(IdempotencyStore store,
                           RequestFingerprint fingerprint,
                           ObjectMapper objectMapper,
                           MeterRegistry meterRegistry,
                           @Value("${idempotency.require-key:false}") boolean requireKey) {
        this.store = store;
        this.fingerprint = fingerprint;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.requireKey = requireKey;
    }

    @SuppressWarnings("unchecked")
    public ResponseEntity<Object> execute(String key, String method, String path, Object body,
                                          Supplier<? extends ResponseEntity<?>> operation) {
        if (key == null || key.isBlank()) {
            if (requireKey) {
                throw ApiException.badRequest(ErrorCodes.IDEMPOTENCY_KEY_REQUIRED,
                        "Idempotency-Key header is required");
            }
            return (ResponseEntity<Object>) operation.get();
        }
        if (key.length() > MAX_KEY_LENGTH) {
            throw ApiException.badRequest(ErrorCodes.VALIDATION_FAILED,
                    "Idempotency-Key must be at most " + MAX_KEY_LENGTH + " characters");
        }

        IdempotencyDecision decision;
        try {
            decision = store.check(key, method, path, fingerprint.of(body));
        } catch (ApiException e) {
            meterRegistry.counter("idempotency_conflicts_total", "code", e.getCode()).increment();
            throw e;
        }

        if (decision instanceof IdempotencyDecision.Replay replay) {
            meterRegistry.counter("idempotency_replays_total").increment();
            log.info("Replaying stored response for idempotency key {} ({} {})", key, method, path);
            ResponseEntity.BodyBuilder builder = ResponseEntity.status(replay.status())
                    .header(REPLAYED_HEADER, "true");
            if (replay.body() != null) {
                builder.contentType(MediaType.APPLICATION_JSON);
            }
            return builder.body(replay.body());
        }

        ResponseEntity<?> response;
        try {
            response = operation.get();
        } catch (RuntimeException e) {
            releaseQuietly(key);
            throw e;
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            releaseQuietly(key);
            return (ResponseEntity<Object>) response;
        }

        String serialized = serialize(response.getBody());
        try {
            store.commit(key, response.getStatusCode().value(), serialized);
        } catch (RuntimeException e) {
            log.error("Failed to store response for idempotency key {}; a retry will execute again", key, e);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.addAll(response.getHeaders());
        if (serialized != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        return ResponseEntity.status(response.getStatusCode()).headers(headers).body(serialized);
    }

    private String serialize(Object body) {
        if (body == null) {
            return null;
        }
        if (body instanceof String s) {
            return s;
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response for idempotency cache", e);
        }
    }

    private void releaseQuietly(String key) {
        try {
            store.release(key);
        } catch (RuntimeException e) {
            log.warn("Failed to release idempotency key {}; it stays claimed until it expires", key, e);
        }
    }
}
