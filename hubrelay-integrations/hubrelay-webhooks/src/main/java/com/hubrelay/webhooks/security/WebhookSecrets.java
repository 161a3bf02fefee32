package com.hubrelay.webhooks.security;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Derives per-subscription webhook secrets from one process-wide root secret.
 *
 * <p>The secret handed to GitHub when a hook is registered is
 * {@code hex(HMAC-SHA256(root, uuidBytes(subscriptionId) || utf8(userId)))},
 * so only the root secret and the subscription row need to be persisted.
 * Rotating the root secret invalidates every registered hook.
 */
public final class WebhookSecrets {

    private static final String ALGORITHM = "HmacSHA256";

    private final byte[] rootKey;

    /**
     * @param rootSecret the process-wide signing key; must not be blank
     */
    public WebhookSecrets(String rootSecret) {
        if (rootSecret == null || rootSecret.isBlank()) {
            throw new IllegalArgumentException("rootSecret must not be null or blank");
        }
        this.rootKey = rootSecret.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Returns the secret for the subscription identified by {@code subscriptionId},
     * owned by {@code userId}.  The result is stable across restarts.
     */
    public String secretFor(UUID subscriptionId, String userId) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(rootKey, ALGORITHM));
            mac.update(uuidBytes(subscriptionId));
            mac.update(userId.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(mac.doFinal());
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private static byte[] uuidBytes(UUID id) {
        return ByteBuffer.allocate(16)
                .putLong(id.getMostSignificantBits())
                .putLong(id.getLeastSignificantBits())
                .array();
    }
}
