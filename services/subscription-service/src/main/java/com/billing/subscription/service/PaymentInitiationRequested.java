package com.billing.subscription.service;

import java.util.UUID;

/**
 * Published inside the transaction that created a pending payment record; handled after commit.
 */
public record PaymentInitiationRequested(UUID paymentRecordId) {}
