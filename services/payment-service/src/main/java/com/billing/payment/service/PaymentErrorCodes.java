package com.billing.payment.service;

public final class PaymentErrorCodes {
    private PaymentErrorCodes() {}

    public static final String PAYMENT_NOT_FOUND = "PAYMENT_NOT_FOUND";
    public static final String PAYMENT_NOT_SETTLED = "PAYMENT_NOT_SETTLED";
    public static final String API_KEY_REQUIRED = "API_KEY_REQUIRED";
    public static final String INVALID_API_KEY = "INVALID_API_KEY";
}
