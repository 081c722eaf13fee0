package com.billing.payment.controller;

import com.billing.common.idempotency.IdempotencyGate;
import com.billing.events.WebhookHeaders;
import com.billing.payment.dto.InitiatePaymentRequest;
import com.billing.payment.dto.PaymentResponse;
import com.billing.payment.service.PaymentService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/v1/payments")
public class PaymentController {

    private final PaymentService paymentService;
    private final IdempotencyGate idempotencyGate;

    public PaymentController(PaymentService paymentService, IdempotencyGate idempotencyGate) {
        this.paymentService = paymentService;
        this.idempotencyGate = idempotencyGate;
    }

    @PostMapping("/initiate")
    public ResponseEntity<Object> initiatePayment(
            @RequestHeader(value = WebhookHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody InitiatePaymentRequest request,
            HttpServletRequest httpRequest) {
        return idempotencyGate.execute(idempotencyKey, httpRequest.getMethod(), httpRequest.getRequestURI(), request,
                () -> ResponseEntity.status(HttpStatus.CREATED).body(paymentService.initiate(request)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PaymentResponse> getPayment(@PathVariable UUID id) {
        return ResponseEntity.ok(paymentService.get(id));
    }

    @GetMapping("/reference/{reference}")
    public ResponseEntity<PaymentResponse> getPaymentByReference(@PathVariable String reference) {
        return ResponseEntity.ok(paymentService.getByReference(reference));
    }

    @PostMapping("/{id}/webhook/resend")
    public ResponseEntity<Object> resendWebhook(
            @PathVariable UUID id,
            @RequestHeader(value = WebhookHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            HttpServletRequest httpRequest) {
        return idempotencyGate.execute(idempotencyKey, httpRequest.getMethod(), httpRequest.getRequestURI(), null,
                () -> ResponseEntity.status(HttpStatus.ACCEPTED).body(paymentService.resendWebhook(id)));
    }
}
