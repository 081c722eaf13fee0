package com.billing.subscription.entity;

import java.util.Set;

public enum SubscriptionStatus {
    PENDING,
    ACTIVE,
    CANCELLED,
    EXPIRED;

    public static final Set<SubscriptionStatus> LIVE = Set.of(PENDING, ACTIVE);

    public boolean canTransitionTo(SubscriptionStatus target) {
        return allowedTransitions().contains(target);
    }

    public boolean isTerminal() {
        return allowedTransitions().isEmpty();
    }

    private Set<SubscriptionStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> Set.of(ACTIVE, CANCELLED);
            case ACTIVE -> Set.of(CANCELLED, EXPIRED);
            case CANCELLED, EXPIRED -> Set.of();
        };
    }
}
