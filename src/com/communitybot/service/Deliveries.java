package com.communitybot.service;

import java.time.Clock;

/**
 * Runs best-effort platform calls and turns their failures into {@link DeliveryFailure} values.
 */
class Deliveries {

    interface PlatformCall {
        void run() throws PlatformException;
    }

    private final DeliveryListener listener;
    private final Clock clock;

    Deliveries(DeliveryListener listener, Clock clock) {
        this.listener = listener;
        this.clock = clock;
    }

    /**
     * @return null when the call went through, otherwise the reported failure
     */
    DeliveryFailure attempt(String operation, String subjectId, PlatformCall call) {
        try {
            call.run();
            return null;
        } catch (PlatformException | RuntimeException ex) {
            return report(operation, subjectId, ex);
        }
    }

    DeliveryFailure report(String operation, String subjectId, Throwable cause) {
        DeliveryFailure failure = new DeliveryFailure(operation, subjectId, cause, clock.instant());
        listener.onDeliveryFailure(failure);
        return failure;
    }
}
