package com.communitybot.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production delivery listener: failures go to the log, nothing is retried.
 */
public class LoggingDeliveryListener implements DeliveryListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingDeliveryListener.class);

    @Override
    public void onDeliveryFailure(DeliveryFailure failure) {
        log.warn("Delivery failed: {} {}: {}", failure.getOperation(), failure.getSubjectId(), failure.getReason());
        log.debug("Delivery failure cause", failure.getCause());
    }
}
