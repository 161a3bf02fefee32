package com.hubrelay.webhooks.handler;

/**
 * SPI for receiving flushed notifications.
 *
 * <p>Implement this interface to forward notifications to the chat platform
 * (or anywhere else).  One call is made per flushed aggregation or per
 * event that is never aggregated.
 *
 * <p>Handler implementations must be thread-safe: notifications of different
 * subscriptions are delivered concurrently from the delivery executor.
 */
@FunctionalInterface
public interface DeliveryHandler {

    /**
     * Called once for every flushed notification.
     *
     * @param notification the notification, carrying the destination channel
     * @throws DeliveryException if the handler cannot deliver the notification
     *         (the caller logs the error; the notification is not retried)
     */
    void deliver(Notification notification) throws DeliveryException;
}
