package com.billing.subscription.service;

public final class SubscriptionErrorCodes {
    private SubscriptionErrorCodes() {}

    public static final String SUBSCRIPTION_NOT_FOUND = "SUBSCRIPTION_NOT_FOUND";
    public static final String PLAN_NOT_FOUND = "PLAN_NOT_FOUND";
    public static final String ACTIVE_SUBSCRIPTION_EXISTS = "ACTIVE_SUBSCRIPTION_EXISTS";
    public static final String INVALID_SUBSCRIPTION_STATE = "INVALID_SUBSCRIPTION_STATE";
    public static final String INVALID_UPGRADE = "INVALID_UPGRADE";
    public static final String INVALID_DOWNGRADE = "INVALID_DOWNGRADE";
    public static final String ALREADY_CANCELLED = "ALREADY_CANCELLED";

    public static final String MISSING_SIGNATURE = "MISSING_SIGNATURE";
    public static final String INVALID_SIGNATURE = "INVALID_SIGNATURE";
    public static final String PAYMENT_REFERENCE_MISMATCH = "PAYMENT_REFERENCE_MISMATCH";
}
