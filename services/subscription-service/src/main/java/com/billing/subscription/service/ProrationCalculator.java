package com.billing.subscription.service;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Charge for moving between plans mid-cycle. Billing periods are not split: an upgrade is charged
 * the full price difference, a downgrade is free and waits for the next billing boundary.
 */
@Component
public class ProrationCalculator {

    public BigDecimal proratedAmount(BigDecimal currentPrice, BigDecimal newPrice) {
        BigDecimal difference = newPrice.subtract(currentPrice);
        return difference.signum() > 0
                ? difference.setScale(2, RoundingMode.HALF_UP)
                : BigDecimal.ZERO.setScale(2);
    }

    public boolean isUpgrade(BigDecimal currentPrice, BigDecimal newPrice) {
        return newPrice.compareTo(currentPrice) > 0;
    }

    public boolean isDowngrade(BigDecimal currentPrice, BigDecimal newPrice) {
        return newPrice.compareTo(currentPrice) < 0;
    }
}
