package com.hubrelay.webhooks.intake;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Transport-neutral view of one inbound webhook HTTP request.
 *
 * Header lookups are case-insensitive.  The body is kept exactly as received
 * because the signature covers those bytes.
 */
public final class WebhookRequest {

    private final String subscriptionId;
    private final Map<String, String> headers;
    private final byte[] body;

    /**
     * @param subscriptionId the id taken from the request path or the {@code id} query parameter; may be null
     * @param headers        request headers (first value per name)
     * @param body           raw request body, never re-serialized
     */
    public WebhookRequest(String subscriptionId, Map<String, String> headers, byte[] body) {
        this.subscriptionId = subscriptionId;
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body != null ? body : new byte[0];
    }

    public String getSubscriptionId()      { return subscriptionId; }
    public Map<String, String> getHeaders() { return headers; }
    public byte[] getBody()                { return body; }

    public String header(String name) { return headers.get(name); }
}
