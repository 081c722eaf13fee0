package com.billing.events;

public final class EventTypes {
    private EventTypes() {}

    public static final String PAYMENT_COMPLETED = "payment.completed";
    public static final String PAYMENT_FAILED = "payment.failed";

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILED = "failed";
}
