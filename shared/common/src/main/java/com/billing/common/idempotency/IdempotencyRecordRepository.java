package com.billing.common.idempotency;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

public interface IdempotencyRecordRepository extends JpaRepository<IdempotencyRecord, String> {

    /**
     * Atomically claims a key. Returns 1 when this caller inserted the row, 0 when the key exists.
     */
    @Modifying
    @Query(value = """
            INSERT INTO idempotency_keys
                (idempotency_key, request_method, request_path, request_hash, created_at, expires_at)
            VALUES (:key, :method, :path, :hash, :createdAt, :expiresAt)
            ON CONFLICT (idempotency_key) DO NOTHING
            """, nativeQuery = true)
    int claim(@Param("key") String key,
              @Param("method") String method,
              @Param("path") String path,
              @Param("hash") String hash,
              @Param("createdAt") Instant createdAt,
              @Param("expiresAt") Instant expiresAt);

    @Modifying
    @Query("""
            UPDATE IdempotencyRecord r
               SET r.responseStatus = :status, r.responseBody = :body, r.expiresAt = :expiresAt
             WHERE r.key = :key AND r.responseStatus IS NULL
            """)
    int complete(@Param("key") String key,
                 @Param("status") int status,
                 @Param("body") String body,
                 @Param("expiresAt") Instant expiresAt);

    @Modifying
    @Query("DELETE FROM IdempotencyRecord r WHERE r.key = :key AND r.responseStatus IS NULL")
    int releaseClaim(@Param("key") String key);

    @Modifying
    @Query("DELETE FROM IdempotencyRecord r WHERE r.key = :key AND r.expiresAt < :now")
    int deleteIfExpired(@Param("key") String key, @Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM IdempotencyRecord r WHERE r.expiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") Instant cutoff);
}
