package com.billing.common.idempotency;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * One idempotency key. Inserted as an in-flight claim (no response yet) before the guarded
 * operation runs, completed with the response once it succeeds, then immutable until it expires.
 */
@Entity
@Table(name = "idempotency_keys")
public class IdempotencyRecord {

    @Id
    @Column(name = "idempotency_key")
    private String key;

    @Column(name = "request_method", nullable = false)
    private String requestMethod;

    @Column(name = "request_path", nullable = false)
    private String requestPath;

    @Column(name = "request_hash", nullable = false)
    private String requestHash;

    @Column(name = "response_status")
    private Integer responseStatus;

    @Column(name = "response_body", columnDefinition = "text")
    private String responseBody;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    protected IdempotencyRecord() {}

    public IdempotencyRecord(String key, String requestMethod, String requestPath, String requestHash,
                             Instant expiresAt) {
        this.key = key;
        this.requestMethod = requestMethod;
        this.requestPath = requestPath;
        this.requestHash = requestHash;
        this.createdAt = Instant.now();
        this.expiresAt = expiresAt;
    }

    public boolean isCompleted() {
        return responseStatus != null;
    }

    public boolean isExpired(Instant now) {
        return expiresAt.isBefore(now);
    }

    public boolean matches(String method, String path, String hash) {
        return requestMethod.equals(method) && requestPath.equals(path) && requestHash.equals(hash);
    }

    public void complete(int status, String body, Instant expiresAt) {
        this.responseStatus = status;
        this.responseBody = body;
        this.expiresAt = expiresAt;
    }

    public String getKey() { return key; }
    public String getRequestMethod() { return requestMethod; }
    public String getRequestPath() { return requestPath; }
    public String getRequestHash() { return requestHash; }
    public Integer getResponseStatus() { return responseStatus; }
    public String getResponseBody() { return responseBody; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getExpiresAt() { return expiresAt; }
}
