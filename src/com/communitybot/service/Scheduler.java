package com.communitybot.service;

import java.time.Duration;
import java.time.Instant;

/**
 * Fire-once delayed callbacks. Callbacks run on the same loop as inbound events.
 * There is no cancellation: callers make the callback itself a no-op when it is no longer needed.
 */
public interface Scheduler {
    void after(Duration delay, Runnable callback);

    void at(Instant when, Runnable callback);
}
