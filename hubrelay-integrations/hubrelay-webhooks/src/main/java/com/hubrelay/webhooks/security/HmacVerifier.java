package com.hubrelay.webhooks.security;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Verifies GitHub webhook HMAC signatures.
 *
 * <p>GitHub signs every delivery with the secret configured on the hook and
 * sends the result in two headers:
 *
 * <pre>
 *   X-Hub-Signature:     sha1=&lt;hex-digest&gt;
 *   X-Hub-Signature-256: sha256=&lt;hex-digest&gt;
 * </pre>
 *
 * The digest is always computed over the raw request bytes; a re-serialized
 * JSON body is not guaranteed to be byte-identical to what GitHub signed.
 */
public final class HmacVerifier {

    /** Signature algorithms GitHub uses, keyed by their header prefix. */
    public enum Algorithm {
        SHA1("sha1", "HmacSHA1"),
        SHA256("sha256", "HmacSHA256");

        private final String prefix;
        private final String macName;

        Algorithm(String prefix, String macName) {
            this.prefix = prefix;
            this.macName = macName;
        }

        public String getPrefix()  { return prefix; }
        public String getMacName() { return macName; }

        static Algorithm fromPrefix(String prefix) {
            for (Algorithm algorithm : values()) {
                if (algorithm.prefix.equals(prefix)) {
                    return algorithm;
                }
            }
            return null;
        }
    }

    /**
     * Verifies a signature header value against the raw request body.
     *
     * @param rawBody         the exact bytes received in the HTTP request body
     * @param signatureHeader {@code algorithm=hexdigest}, e.g. {@code sha256=5f3c...}
     * @param secret          the secret bound to the target subscription
     * @return {@code true} if the signature is valid, {@code false} otherwise
     */
    public boolean verify(byte[] rawBody, String signatureHeader, String secret) {
        if (signatureHeader == null || secret == null || rawBody == null) {
            return false;
        }
        int separator = signatureHeader.indexOf('=');
        if (separator <= 0) {
            return false;
        }
        Algorithm algorithm = Algorithm.fromPrefix(
                signatureHeader.substring(0, separator).trim().toLowerCase(Locale.ROOT));
        if (algorithm == null) {
            return false;
        }
        String receivedHex = signatureHeader.substring(separator + 1).trim().toLowerCase(Locale.ROOT);
        String expectedHex = computeHmac(algorithm, rawBody, secret);
        // Constant-time comparison to prevent timing attacks
        return MessageDigest.isEqual(
                expectedHex.getBytes(StandardCharsets.UTF_8),
                receivedHex.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Produces the header value GitHub would send for {@code rawBody}.
     */
    public String sign(byte[] rawBody, String secret, Algorithm algorithm) {
        return algorithm.getPrefix() + "=" + computeHmac(algorithm, rawBody, secret);
    }

    private static String computeHmac(Algorithm algorithm, byte[] data, String secret) {
        try {
            Mac mac = Mac.getInstance(algorithm.getMacName());
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), algorithm.getMacName()));
            return HexFormat.of().formatHex(mac.doFinal(data));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException(algorithm.getMacName() + " unavailable", e);
        }
    }
}
