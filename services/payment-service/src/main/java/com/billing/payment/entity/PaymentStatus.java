package com.billing.payment.entity;

public enum PaymentStatus {
    PENDING,
    PROCESSING,
    SUCCESS,
    FAILED;

    public boolean canTransitionTo(PaymentStatus target) {
        return switch (this) {
            case PENDING -> target == PROCESSING || target == SUCCESS || target == FAILED;
            case PROCESSING -> target == SUCCESS || target == FAILED;
            case SUCCESS, FAILED -> false;
        };
    }

    public boolean isSettled() {
        return this == SUCCESS || this == FAILED;
    }
}
