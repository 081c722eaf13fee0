package com.billing.events.signature;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * HMAC-SHA256 over the exact bytes that travel on the wire. Senders sign the serialized body they
 * are about to send; receivers verify the raw body they received, never a re-serialization.
 */
public final class WebhookSignature {

    private static final String ALGORITHM = "HmacSHA256";
    private static final Pattern HEX_SHA256 = Pattern.compile("^[0-9a-fA-F]{64}$");

    private final SecretKeySpec key;

    public WebhookSignature(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("Webhook secret is not configured");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    public String sign(byte[] payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return HexFormat.of().formatHex(mac.doFinal(payload));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute HMAC", e);
        }
    }

    public boolean verify(byte[] payload, String signature) {
        return check(payload, signature).isValid();
    }

    public SignatureCheck check(byte[] payload, String signature) {
        if (signature == null || signature.isBlank()) {
            return SignatureCheck.MISSING;
        }
        String candidate = signature.trim();
        if (!HEX_SHA256.matcher(candidate).matches()) {
            return SignatureCheck.MALFORMED;
        }
        byte[] expected = HexFormat.of().parseHex(sign(payload));
        byte[] actual = HexFormat.of().parseHex(candidate);
        // constant-time compare
        return MessageDigest.isEqual(expected, actual) ? SignatureCheck.VALID : SignatureCheck.MISMATCH;
    }
}
