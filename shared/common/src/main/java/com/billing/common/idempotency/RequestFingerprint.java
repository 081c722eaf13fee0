package com.billing.common.idempotency;

import com.billing.events.serde.EventObjectMapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 over a canonical rendering of a request body: parsed to a JSON tree and written back
 * with object keys sorted, so field order and whitespace do not change the digest.
 */
@Component
public class RequestFingerprint {

    private final ObjectMapper canonicalMapper = EventObjectMapper.instance();

    public String of(Object body) {
        return sha256Hex(canonicalBytes(body));
    }

    byte[] canonicalBytes(Object body) {
        if (body == null) {
            return new byte[0];
        }
        try {
            Object tree;
            if (body instanceof byte[] raw) {
                if (raw.length == 0) {
                    return raw;
                }
                try {
                    tree = canonicalMapper.readValue(raw, Object.class);
                } catch (IOException notJson) {
                    return raw;
                }
            } else {
                tree = canonicalMapper.readValue(canonicalMapper.writeValueAsBytes(body), Object.class);
            }
            return canonicalMapper.writeValueAsString(tree).getBytes(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to canonicalize request body", e);
        }
    }

    private static String sha256Hex(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
