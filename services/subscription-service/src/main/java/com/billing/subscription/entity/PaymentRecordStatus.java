package com.billing.subscription.entity;

public enum PaymentRecordStatus {
    PENDING,
    SUCCESS,
    FAILED
}
