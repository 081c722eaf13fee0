package com.billing.subscription.dto;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.time.Instant;

public record DowngradeResponse(
        @JsonUnwrapped SubscriptionResponse subscription,
        Instant effectiveDate,
        String note
) {}
