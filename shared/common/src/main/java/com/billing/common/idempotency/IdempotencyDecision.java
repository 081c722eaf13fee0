package com.billing.common.idempotency;

/**
 * Outcome of looking up an idempotency key before running a mutation.
 */
public sealed interface IdempotencyDecision permits IdempotencyDecision.Proceed, IdempotencyDecision.Replay {

    /** The key was free and is now claimed by the caller. */
    record Proceed() implements IdempotencyDecision {}

    /** The same request already completed; hand back its response without executing again. */
    record Replay(int status, String body) implements IdempotencyDecision {}

    static IdempotencyDecision proceed() {
        return new Proceed();
    }
}
