package com.billing.subscription.service;

import java.util.UUID;

public sealed interface InitiationResult permits InitiationResult.Initiated, InitiationResult.Failed {

    UUID paymentRecordId();

    record Initiated(UUID paymentRecordId, String paymentId) implements InitiationResult {}

    record Failed(UUID paymentRecordId, String reason) implements InitiationResult {}
}
