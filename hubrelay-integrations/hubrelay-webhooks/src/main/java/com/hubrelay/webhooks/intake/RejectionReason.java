package com.hubrelay.webhooks.intake;

/**
 * Why an inbound delivery was not accepted into the pipeline, with the HTTP
 * status reported back to GitHub.
 *
 * <p>None of these are retried internally; GitHub's own redelivery policy
 * applies.  {@link #UNSUPPORTED_EVENT_KIND} answers 202 so GitHub does not
 * keep redelivering an event the relay will never process.
 */
public enum RejectionReason {

    SUBSCRIPTION_NOT_FOUND(404),
    MALFORMED_REQUEST(400),
    UNSUPPORTED_EVENT_KIND(202),
    INVALID_SIGNATURE(401),
    MALFORMED_BODY(400),
    PAYLOAD_SCHEMA_MISMATCH(400),
    /** The subscription store could not be read; GitHub may redeliver later. */
    STORE_UNAVAILABLE(503);

    private final int httpStatus;

    RejectionReason(int httpStatus) { this.httpStatus = httpStatus; }

    public int getHttpStatus() { return httpStatus; }
}
