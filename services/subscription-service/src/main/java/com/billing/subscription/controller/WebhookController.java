package com.billing.subscription.controller;

import com.billing.common.error.ApiException;
import com.billing.common.error.ErrorCodes;
import com.billing.common.idempotency.IdempotencyGate;
import com.billing.events.PaymentWebhookEvent;
import com.billing.events.WebhookHeaders;
import com.billing.events.serde.EventObjectMapper;
import com.billing.events.signature.SignatureCheck;
import com.billing.events.signature.WebhookSignature;
import com.billing.subscription.service.SubscriptionErrorCodes;
import com.billing.subscription.service.WebhookReconciler;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Inbound payment-outcome webhooks. The signature is checked over the raw request bytes before
 * anything else touches the body.
 */
@RestController
@RequestMapping("/v1/webhooks")
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private static final String SIGNATURE_REJECTED = "Webhook signature verification failed";

    private final WebhookSignature webhookSignature;
    private final IdempotencyGate idempotencyGate;
    private final WebhookReconciler reconciler;
    private final Validator validator;
    private final MeterRegistry meterRegistry;

    public WebhookController(WebhookSignature webhookSignature,
                             IdempotencyGate idempotencyGate,
                             WebhookReconciler reconciler,
                             Validator validator,
                             MeterRegistry meterRegistry) {
        this.webhookSignature = webhookSignature;
        this.idempotencyGate = idempotencyGate;
        this.reconciler = reconciler;
        this.validator = validator;
        this.meterRegistry = meterRegistry;
    }

    @PostMapping("/payment")
    public ResponseEntity<Object> receivePaymentWebhook(
            @RequestHeader(value = WebhookHeaders.SIGNATURE, required = false) String signature,
            @RequestHeader(value = WebhookHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @RequestBody(required = false) byte[] rawBody,
            HttpServletRequest httpRequest) {
        byte[] body = rawBody == null ? new byte[0] : rawBody;
        verifySignature(body, signature, httpRequest);

        return idempotencyGate.execute(idempotencyKey, httpRequest.getMethod(), httpRequest.getRequestURI(), body,
                () -> ResponseEntity.ok(reconciler.reconcile(parse(body))));
    }

    private void verifySignature(byte[] body, String signature, HttpServletRequest request) {
        SignatureCheck check = webhookSignature.check(body, signature);
        if (check.isValid()) {
            return;
        }
        meterRegistry.counter("webhook_signature_rejections_total", "reason", check.name().toLowerCase()).increment();
        log.warn("Rejected webhook from {}: signature {}", request.getRemoteAddr(), check);
        // callers get the same message either way; the code only separates absent from wrong
        String code = check == SignatureCheck.MISMATCH
                ? SubscriptionErrorCodes.INVALID_SIGNATURE
                : SubscriptionErrorCodes.MISSING_SIGNATURE;
        throw ApiException.unauthorized(code, SIGNATURE_REJECTED);
    }

    private PaymentWebhookEvent parse(byte[] body) {
        PaymentWebhookEvent event;
        try {
            event = EventObjectMapper.instance().readValue(body, PaymentWebhookEvent.class);
        } catch (IOException e) {
            throw ApiException.badRequest(ErrorCodes.VALIDATION_FAILED, "Malformed webhook payload");
        }
        if (event == null) {
            throw ApiException.badRequest(ErrorCodes.VALIDATION_FAILED, "Malformed webhook payload");
        }
        Set<ConstraintViolation<PaymentWebhookEvent>> violations = validator.validate(event);
        if (!violations.isEmpty()) {
            Map<String, Object> fields = new TreeMap<>();
            for (ConstraintViolation<PaymentWebhookEvent> violation : violations) {
                fields.put(violation.getPropertyPath().toString(), violation.getMessage());
            }
            throw ApiException.badRequest(ErrorCodes.VALIDATION_FAILED, "Invalid webhook payload",
                    Map.of("fields", fields));
        }
        return event;
    }
}
