package com.hubrelay.webhooks.intake;

/** Thrown by {@link WebhookRequestDecoder} when a delivery cannot be accepted. */
public class WebhookRejectedException extends Exception {

    private final RejectionReason reason;

    public WebhookRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public WebhookRejectedException(RejectionReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public RejectionReason getReason() { return reason; }
}
