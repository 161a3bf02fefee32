package com.hubrelay.webhooks.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@DisplayName("HmacVerifier Tests")
class HmacVerifierTest {

    private static final String SECRET = "It's a Secret to Everybody";
    private static final byte[] BODY = "Hello, World!".getBytes(StandardCharsets.UTF_8);

    private final HmacVerifier verifier = new HmacVerifier();

    @Nested
    @DisplayName("Known vectors")
    class KnownVectorTest {

        @Test
        @DisplayName("Should produce the digest GitHub documents for its example payload")
        void shouldMatchGitHubExample() {
            assertThat(verifier.sign(BODY, SECRET, HmacVerifier.Algorithm.SHA256))
                    .isEqualTo("sha256=757107ea0eb2509fc211221cce984b8a37570b6d7586c22c46f4379c8b043e17");
        }

        @Test
        @DisplayName("Should accept the documented signature")
        void shouldAcceptDocumentedSignature() {
            assertThat(verifier.verify(BODY,
                    "sha256=757107ea0eb2509fc211221cce984b8a37570b6d7586c22c46f4379c8b043e17", SECRET)).isTrue();
        }
    }

    @Nested
    @DisplayName("Verification")
    class VerificationTest {

        @Test
        @DisplayName("Should accept signatures of both algorithms")
        void shouldAcceptBothAlgorithms() {
            for (HmacVerifier.Algorithm algorithm : HmacVerifier.Algorithm.values()) {
                String header = verifier.sign(BODY, SECRET, algorithm);
                assertThat(header).startsWith(algorithm.getPrefix() + "=");
                assertThat(verifier.verify(BODY, header, SECRET)).isTrue();
            }
        }

        @Test
        @DisplayName("Should accept upper-case hex digits")
        void shouldIgnoreHexCase() {
            String header = verifier.sign(BODY, SECRET, HmacVerifier.Algorithm.SHA256);
            assertThat(verifier.verify(BODY, header.toUpperCase(), SECRET)).isTrue();
        }

        @Test
        @DisplayName("Should reject any single flipped body bit")
        void shouldRejectFlippedBodyBits() {
            String header = verifier.sign(BODY, SECRET, HmacVerifier.Algorithm.SHA256);
            for (int i = 0; i < BODY.length * 8; i++) {
                byte[] tampered = BODY.clone();
                tampered[i / 8] ^= (byte) (1 << (i % 8));
                assertThat(verifier.verify(tampered, header, SECRET)).as("bit %d", i).isFalse();
            }
        }

        @Test
        @DisplayName("Should reject a flipped signature digit")
        void shouldRejectTamperedSignature() {
            String header = verifier.sign(BODY, SECRET, HmacVerifier.Algorithm.SHA1);
            char last = header.charAt(header.length() - 1);
            String tampered = header.substring(0, header.length() - 1) + (last == '0' ? '1' : '0');
            assertThat(verifier.verify(BODY, tampered, SECRET)).isFalse();
        }

        @Test
        @DisplayName("Should reject another secret")
        void shouldRejectWrongSecret() {
            String header = verifier.sign(BODY, SECRET, HmacVerifier.Algorithm.SHA256);
            assertThat(verifier.verify(BODY, header, "another secret")).isFalse();
        }

        @Test
        @DisplayName("Should reject malformed headers")
        void shouldRejectMalformedHeaders() {
            String digest = verifier.sign(BODY, SECRET, HmacVerifier.Algorithm.SHA256).substring("sha256=".length());
            assertThat(verifier.verify(BODY, null, SECRET)).isFalse();
            assertThat(verifier.verify(BODY, digest, SECRET)).isFalse();
            assertThat(verifier.verify(BODY, "=" + digest, SECRET)).isFalse();
            assertThat(verifier.verify(BODY, "md5=" + digest, SECRET)).isFalse();
            assertThat(verifier.verify(BODY, "sha256=", SECRET)).isFalse();
        }
    }
}
