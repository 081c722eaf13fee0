package com.billing.events.signature;

public enum SignatureCheck {
    VALID,
    MISSING,
    MALFORMED,
    MISMATCH;

    public boolean isValid() {
        return this == VALID;
    }
}
