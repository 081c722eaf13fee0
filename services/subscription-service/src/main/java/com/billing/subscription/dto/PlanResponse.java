package com.billing.subscription.dto;

import com.billing.subscription.entity.Plan;

import java.math.BigDecimal;
import java.util.UUID;

public record PlanResponse(
        UUID id,
        String name,
        String description,
        BigDecimal price,
        String currency,
        String billingCycle
) {
    public static PlanResponse from(Plan plan) {
        return new PlanResponse(plan.getId(), plan.getName(), plan.getDescription(), plan.getPrice(),
                plan.getCurrency(), plan.getBillingCycle().name());
    }
}
