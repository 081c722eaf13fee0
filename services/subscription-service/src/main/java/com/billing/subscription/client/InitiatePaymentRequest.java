package com.billing.subscription.client;

import java.math.BigDecimal;
import java.util.Map;

public record InitiatePaymentRequest(
        String externalReference,
        BigDecimal amount,
        String currency,
        Map<String, Object> metadata
) {}
