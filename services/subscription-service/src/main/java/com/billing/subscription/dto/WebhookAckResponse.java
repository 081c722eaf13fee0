package com.billing.subscription.dto;

import java.time.Instant;
import java.util.UUID;

public record WebhookAckResponse(
        boolean received,
        Instant processedAt,
        UUID subscriptionId,
        String newStatus
) {}
