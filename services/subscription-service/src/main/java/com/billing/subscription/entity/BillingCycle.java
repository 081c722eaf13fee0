package com.billing.subscription.entity;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

public enum BillingCycle {
    MONTHLY,
    YEARLY;

    public Instant plusCycles(Instant from, long cycles) {
        ZonedDateTime start = from.atZone(ZoneOffset.UTC);
        return switch (this) {
            case MONTHLY -> start.plusMonths(cycles).toInstant();
            case YEARLY -> start.plusYears(cycles).toInstant();
        };
    }

    /**
     * First cycle boundary after {@code now}, counting whole cycles from {@code start}.
     */
    public Instant nextBoundary(Instant start, Instant now) {
        long cycles = 1;
        Instant boundary = plusCycles(start, cycles);
        while (!boundary.isAfter(now)) {
            cycles++;
            boundary = plusCycles(start, cycles);
        }
        return boundary;
    }
}
