package com.billing.payment.dto;

import com.billing.payment.entity.WebhookDeliveryStatus;

import java.time.Instant;
import java.util.UUID;

public record WebhookResendResponse(
        UUID paymentId,
        UUID deliveryId,
        WebhookDeliveryStatus status,
        Instant queuedAt
) {}
