package com.hubrelay.webhooks.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reference implementation that logs every notification at INFO level.
 * Used by the launcher when no chat integration is wired in, and handy
 * during integration testing.
 */
public class LoggingDeliveryHandler implements DeliveryHandler {

    private static final Logger log = LoggerFactory.getLogger(LoggingDeliveryHandler.class);

    @Override
    public void deliver(Notification notification) {
        log.info("Notification for channel {}: kind={} action={} subject={} repository={} deliveries={}",
                notification.getChannelId(),
                notification.getKind(),
                notification.getAction() != null ? notification.getAction().value() : "-",
                notification.getEvent().getSubjectNumber(),
                notification.getEvent().getRepository() != null
                        ? notification.getEvent().getRepository().getFullName() : null,
                notification.getDeliveryIds());
        if (notification.getPushMetrics() != null) {
            log.info("  push: {} commit(s), {} distinct",
                    notification.getPushMetrics().getSize(), notification.getPushMetrics().getDistinctSize());
        }
    }
}
