package com.billing.payment.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;

/**
 * Decides whether a simulated payment goes through. {@code payment.simulate.force-outcome} pins the
 * answer ({@code success} or {@code failure}); otherwise the payment id picks a stable bucket so a
 * given payment always settles the same way.
 */
@Component
public class PaymentOutcomeSimulator {

    private final double successRate;
    private final String forceOutcome;

    public PaymentOutcomeSimulator(@Value("${payment.simulate.success-rate:0.8}") double successRate,
                                   @Value("${payment.simulate.force-outcome:}") String forceOutcome) {
        if (successRate < 0 || successRate > 1) {
            throw new IllegalArgumentException("payment.simulate.success-rate must be between 0 and 1");
        }
        this.successRate = successRate;
        this.forceOutcome = forceOutcome == null ? "" : forceOutcome.trim().toLowerCase(Locale.ROOT);
    }

    public boolean succeeds(UUID paymentId) {
        if ("success".equals(forceOutcome)) {
            return true;
        }
        if ("failure".equals(forceOutcome)) {
            return false;
        }
        int bucket = Math.floorMod(paymentId.hashCode(), 100);
        return bucket < successRate * 100;
    }
}
