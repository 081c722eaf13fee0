package com.billing.subscription.controller;

import com.billing.common.idempotency.IdempotencyGate;
import com.billing.events.WebhookHeaders;
import com.billing.subscription.dto.CancelSubscriptionRequest;
import com.billing.subscription.dto.ChangePlanRequest;
import com.billing.subscription.dto.CreateSubscriptionRequest;
import com.billing.subscription.dto.SubscriptionResponse;
import com.billing.subscription.entity.SubscriptionStatus;
import com.billing.subscription.service.SubscriptionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1/subscriptions")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final IdempotencyGate idempotencyGate;

    public SubscriptionController(SubscriptionService subscriptionService, IdempotencyGate idempotencyGate) {
        this.subscriptionService = subscriptionService;
        this.idempotencyGate = idempotencyGate;
    }

    @PostMapping
    public ResponseEntity<Object> createSubscription(
            @RequestHeader(value = WebhookHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody CreateSubscriptionRequest request,
            HttpServletRequest httpRequest) {
        return idempotencyGate.execute(idempotencyKey, httpRequest.getMethod(), httpRequest.getRequestURI(), request,
                () -> ResponseEntity.status(HttpStatus.CREATED).body(subscriptionService.create(request)));
    }

    @GetMapping
    public ResponseEntity<List<SubscriptionResponse>> listSubscriptions(
            @RequestParam UUID userId,
            @RequestParam(required = false) SubscriptionStatus status) {
        return ResponseEntity.ok(subscriptionService.list(userId, status));
    }

    @GetMapping("/{id}")
    public ResponseEntity<SubscriptionResponse> getSubscription(@PathVariable UUID id) {
        return ResponseEntity.ok(subscriptionService.get(id));
    }

    @PatchMapping("/{id}/upgrade")
    public ResponseEntity<Object> upgrade(
            @PathVariable UUID id,
            @RequestHeader(value = WebhookHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody ChangePlanRequest request,
            HttpServletRequest httpRequest) {
        return idempotencyGate.execute(idempotencyKey, httpRequest.getMethod(), httpRequest.getRequestURI(), request,
                () -> ResponseEntity.ok(subscriptionService.upgrade(id, request.newPlanId())));
    }

    @PatchMapping("/{id}/downgrade")
    public ResponseEntity<Object> downgrade(
            @PathVariable UUID id,
            @RequestHeader(value = WebhookHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody ChangePlanRequest request,
            HttpServletRequest httpRequest) {
        return idempotencyGate.execute(idempotencyKey, httpRequest.getMethod(), httpRequest.getRequestURI(), request,
                () -> ResponseEntity.ok(subscriptionService.downgrade(id, request.newPlanId())));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Object> cancel(
            @PathVariable UUID id,
            @RequestHeader(value = WebhookHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody(required = false) CancelSubscriptionRequest request,
            HttpServletRequest httpRequest) {
        String reason = request == null ? null : request.reason();
        return idempotencyGate.execute(idempotencyKey, httpRequest.getMethod(), httpRequest.getRequestURI(), request,
                () -> ResponseEntity.ok(subscriptionService.cancel(id, reason)));
    }
}
