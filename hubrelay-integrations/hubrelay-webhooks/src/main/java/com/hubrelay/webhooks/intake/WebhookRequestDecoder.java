package com.hubrelay.webhooks.intake;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hubrelay.webhooks.model.EventKind;
import com.hubrelay.webhooks.model.GitHubEvent;
import com.hubrelay.webhooks.security.HmacVerifier;
import com.hubrelay.webhooks.subscription.Subscription;
import com.hubrelay.webhooks.subscription.SubscriptionRegistry;
import com.hubrelay.webhooks.subscription.SubscriptionStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns a raw {@link WebhookRequest} into a {@link DecodedDelivery}.
 *
 * <p>Checks run in a fixed order and the first failure wins:
 * <ol>
 *   <li>subscription id present and known</li>
 *   <li>signature, event and delivery headers present</li>
 *   <li>event kind supported</li>
 *   <li>signature valid over the raw body</li>
 *   <li>body is a non-empty JSON object</li>
 *   <li>body binds to the payload type of the event kind</li>
 * </ol>
 */
public class WebhookRequestDecoder {

    private static final Logger log = LoggerFactory.getLogger(WebhookRequestDecoder.class);

    public static final String SIGNATURE_HEADER     = "X-Hub-Signature";
    public static final String SIGNATURE_256_HEADER = "X-Hub-Signature-256";
    public static final String EVENT_HEADER         = "X-GitHub-Event";
    public static final String DELIVERY_HEADER      = "X-GitHub-Delivery";

    private final SubscriptionRegistry registry;
    private final HmacVerifier         verifier;
    private final ObjectMapper         mapper;
    private final String               globalSecret;

    /**
     * @param globalSecret optional secret accepted for every subscription, for hooks created by hand
     *                     on GitHub; {@code null} to accept only derived secrets
     */
    public WebhookRequestDecoder(SubscriptionRegistry registry, HmacVerifier verifier,
                                 ObjectMapper mapper, String globalSecret) {
        this.registry = registry;
        this.verifier = verifier;
        this.mapper = mapper;
        this.globalSecret = globalSecret != null && !globalSecret.isBlank() ? globalSecret : null;
    }

    public DecodedDelivery decode(WebhookRequest request) throws WebhookRejectedException {
        Subscription subscription = resolveSubscription(request.getSubscriptionId());

        String signature = optional(request, SIGNATURE_256_HEADER);
        if (signature == null) {
            signature = optional(request, SIGNATURE_HEADER);
        }
        if (signature == null) {
            throw new WebhookRejectedException(RejectionReason.MALFORMED_REQUEST, "Missing signature header");
        }
        String eventHeader = require(request, EVENT_HEADER, "event type");
        String deliveryId = require(request, DELIVERY_HEADER, "delivery ID");

        EventKind kind = EventKind.fromHeader(eventHeader).orElseThrow(() ->
                new WebhookRejectedException(RejectionReason.UNSUPPORTED_EVENT_KIND,
                        "Unsupported event type '" + eventHeader + "'"));

        byte[] body = request.getBody();
        if (!signatureMatches(body, signature, subscription)) {
            throw new WebhookRejectedException(RejectionReason.INVALID_SIGNATURE, "Invalid signature");
        }

        JsonNode tree = parseObject(body);
        GitHubEvent event = bind(kind, tree);
        log.debug("Decoded delivery {} of {} for {}", deliveryId, event, subscription.getId());
        return new DecodedDelivery(subscription, event, deliveryId);
    }

    private Subscription resolveSubscription(String rawId) throws WebhookRejectedException {
        if (rawId == null || rawId.isBlank()) {
            throw new WebhookRejectedException(RejectionReason.SUBSCRIPTION_NOT_FOUND, "Webhook not found");
        }
        UUID id;
        try {
            id = UUID.fromString(rawId.trim());
        } catch (IllegalArgumentException e) {
            throw new WebhookRejectedException(RejectionReason.SUBSCRIPTION_NOT_FOUND, "Webhook not found");
        }
        Optional<Subscription> subscription;
        try {
            subscription = registry.get(id);
        } catch (SubscriptionStoreException e) {
            throw new WebhookRejectedException(RejectionReason.STORE_UNAVAILABLE,
                    "Subscription store unavailable", e);
        }
        return subscription.orElseThrow(() ->
                new WebhookRejectedException(RejectionReason.SUBSCRIPTION_NOT_FOUND, "Webhook not found"));
    }

    private static String require(WebhookRequest request, String header, String description)
            throws WebhookRejectedException {
        String value = request.header(header);
        if (value == null || value.isBlank()) {
            throw new WebhookRejectedException(RejectionReason.MALFORMED_REQUEST,
                    "Missing " + description + " header");
        }
        return value.trim();
    }

    /** The trimmed header value, or {@code null} when absent or blank. */
    private static String optional(WebhookRequest request, String header) {
        String value = request.header(header);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private boolean signatureMatches(byte[] body, String signature, Subscription subscription) {
        if (verifier.verify(body, signature, registry.secretFor(subscription))) {
            return true;
        }
        return globalSecret != null && verifier.verify(body, signature, globalSecret);
    }

    private JsonNode parseObject(byte[] body) throws WebhookRejectedException {
        if (body.length == 0) {
            throw new WebhookRejectedException(RejectionReason.MALFORMED_BODY, "Request body must be JSON");
        }
        JsonNode tree;
        try {
            tree = mapper.readTree(body);
        } catch (IOException e) {
            throw new WebhookRejectedException(RejectionReason.MALFORMED_BODY, "JSON parse error", e);
        }
        if (tree == null || !tree.isObject() || tree.isEmpty()) {
            throw new WebhookRejectedException(RejectionReason.MALFORMED_BODY, "Request body must be a JSON object");
        }
        return tree;
    }

    private GitHubEvent bind(EventKind kind, JsonNode tree) throws WebhookRejectedException {
        for (String field : kind.getRequiredFields()) {
            JsonNode value = tree.get(field);
            if (value == null || value.isNull()) {
                throw new WebhookRejectedException(RejectionReason.PAYLOAD_SCHEMA_MISMATCH,
                        "Payload of '" + kind + "' is missing '" + field + "'");
            }
        }
        try {
            return mapper.treeToValue(tree, kind.getPayloadType());
        } catch (JsonProcessingException e) {
            throw new WebhookRejectedException(RejectionReason.PAYLOAD_SCHEMA_MISMATCH,
                    "Payload does not match '" + kind + "' schema: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new WebhookRejectedException(RejectionReason.PAYLOAD_SCHEMA_MISMATCH,
                    "Payload does not match '" + kind + "' schema", e);
        }
    }
}
