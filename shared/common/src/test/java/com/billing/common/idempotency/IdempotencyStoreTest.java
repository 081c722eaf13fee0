package com.billing.common.idempotency;

import com.billing.common.error.ApiException;
import com.billing.common.error.ErrorCodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IdempotencyStoreTest {

    private IdempotencyRecordRepository repository;
    private IdempotencyStore store;

    @BeforeEach
    void setUp() {
        repository = mock(IdempotencyRecordRepository.class);
        store = new IdempotencyStore(repository, Duration.ofHours(24), Duration.ofMinutes(5));
    }

    private void claimReturns(int first, int... rest) {
        Integer[] boxed = new Integer[rest.length];
        for (int i = 0; i < rest.length; i++) {
            boxed[i] = rest[i];
        }
        when(repository.claim(anyString(), anyString(), anyString(), anyString(), any(), any()))
                .thenReturn(first, boxed);
    }

    private static IdempotencyRecord completed(String method, String path, String hash, Instant expiresAt) {
        IdempotencyRecord record = new IdempotencyRecord("k-1", method, path, hash, expiresAt);
        record.complete(201, "{\"id\":\"sub-1\"}", expiresAt);
        return record;
    }

    @Test
    void freeKeyIsClaimed() {
        claimReturns(1);

        assertThat(store.check("k-1", "POST", "/v1/subscriptions", "h1"))
                .isInstanceOf(IdempotencyDecision.Proceed.class);
    }

    @Test
    void completedMatchingRequestIsReplayed() {
        claimReturns(0);
        when(repository.findById("k-1")).thenReturn(Optional.of(
                completed("POST", "/v1/subscriptions", "h1", Instant.now().plusSeconds(3600))));

        IdempotencyDecision decision = store.check("k-1", "POST", "/v1/subscriptions", "h1");

        assertThat(decision).isEqualTo(new IdempotencyDecision.Replay(201, "{\"id\":\"sub-1\"}"));
    }

    @Test
    void differentBodyUnderSameKeyConflicts() {
        claimReturns(0);
        when(repository.findById("k-1")).thenReturn(Optional.of(
                completed("POST", "/v1/subscriptions", "h1", Instant.now().plusSeconds(3600))));

        assertThatThrownBy(() -> store.check("k-1", "POST", "/v1/subscriptions", "h2"))
                .isInstanceOf(ApiException.class)
                .hasMessageContaining("POST /v1/subscriptions")
                .extracting(e -> ((ApiException) e).getCode())
                .isEqualTo(ErrorCodes.IDEMPOTENCY_KEY_REUSED);
    }

    @Test
    void sameBodyOnDifferentPathConflicts() {
        claimReturns(0);
        when(repository.findById("k-1")).thenReturn(Optional.of(
                completed("POST", "/v1/subscriptions", "h1", Instant.now().plusSeconds(3600))));

        assertThatThrownBy(() -> store.check("k-1", "DELETE", "/v1/subscriptions/s-1", "h1"))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getCode())
                .isEqualTo(ErrorCodes.IDEMPOTENCY_KEY_REUSED);
    }

    @Test
    void inFlightClaimReportsInProgress() {
        claimReturns(0);
        when(repository.findById("k-1")).thenReturn(Optional.of(
                new IdempotencyRecord("k-1", "POST", "/v1/subscriptions", "h1", Instant.now().plusSeconds(300))));

        assertThatThrownBy(() -> store.check("k-1", "POST", "/v1/subscriptions", "h1"))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getCode())
                .isEqualTo(ErrorCodes.IDEMPOTENCY_REQUEST_IN_PROGRESS);
    }

    @Test
    void expiredRecordIsTreatedAsAbsent() {
        claimReturns(0, 1);
        when(repository.findById("k-1")).thenReturn(Optional.of(
                completed("POST", "/v1/subscriptions", "old-hash", Instant.now().minusSeconds(1))));

        IdempotencyDecision decision = store.check("k-1", "POST", "/v1/subscriptions", "new-hash");

        assertThat(decision).isInstanceOf(IdempotencyDecision.Proceed.class);
        verify(repository).deleteIfExpired(eq("k-1"), any());
    }
}
