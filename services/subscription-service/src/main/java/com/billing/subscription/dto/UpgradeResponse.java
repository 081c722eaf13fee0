package com.billing.subscription.dto;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.math.BigDecimal;

public record UpgradeResponse(
        @JsonUnwrapped SubscriptionResponse subscription,
        BigDecimal proratedAmount
) {}
