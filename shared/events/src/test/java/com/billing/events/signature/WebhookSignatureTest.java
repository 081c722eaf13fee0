package com.billing.events.signature;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookSignatureTest {

    private final WebhookSignature signature = new WebhookSignature("test-webhook-secret");

    private static final byte[] PAYLOAD = """
            {"eventType":"payment.completed","paymentId":"p-1","externalReference":"s-1","status":"success"}
            """.getBytes(StandardCharsets.UTF_8);

    @Test
    void signedPayloadVerifies() {
        String hex = signature.sign(PAYLOAD);

        assertThat(hex).hasSize(64).matches("[0-9a-f]+");
        assertThat(signature.verify(PAYLOAD, hex)).isTrue();
        assertThat(signature.verify(PAYLOAD, hex.toUpperCase())).isTrue();
    }

    @Test
    void knownVectorMatches() {
        // RFC 4231 test case 2
        WebhookSignature rfc = new WebhookSignature("Jefe");
        byte[] data = "what do ya want for nothing?".getBytes(StandardCharsets.UTF_8);

        assertThat(rfc.sign(data))
                .isEqualTo("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843");
    }

    @Test
    void flippingAnyPayloadByteBreaksVerification() {
        String hex = signature.sign(PAYLOAD);
        for (int i = 0; i < PAYLOAD.length; i++) {
            byte[] tampered = PAYLOAD.clone();
            tampered[i] ^= 0x01;
            assertThat(signature.verify(tampered, hex)).as("byte %d", i).isFalse();
        }
    }

    @Test
    void flippingAnySignatureCharacterBreaksVerification() {
        String hex = signature.sign(PAYLOAD);
        for (int i = 0; i < hex.length(); i++) {
            char c = hex.charAt(i);
            char replacement = c == '0' ? '1' : '0';
            String tampered = hex.substring(0, i) + replacement + hex.substring(i + 1);
            assertThat(signature.check(PAYLOAD, tampered)).as("char %d", i).isEqualTo(SignatureCheck.MISMATCH);
        }
    }

    @Test
    void distinguishesMissingMalformedAndMismatch() {
        assertThat(signature.check(PAYLOAD, null)).isEqualTo(SignatureCheck.MISSING);
        assertThat(signature.check(PAYLOAD, "  ")).isEqualTo(SignatureCheck.MISSING);
        assertThat(signature.check(PAYLOAD, "not-hex")).isEqualTo(SignatureCheck.MALFORMED);
        assertThat(signature.check(PAYLOAD, "abcd")).isEqualTo(SignatureCheck.MALFORMED);
        assertThat(signature.check(PAYLOAD, new WebhookSignature("other-secret").sign(PAYLOAD)))
                .isEqualTo(SignatureCheck.MISMATCH);
    }

    @Test
    void rejectsBlankSecret() {
        assertThatThrownBy(() -> new WebhookSignature(" "))
                .isInstanceOf(IllegalStateException.class);
    }
}
