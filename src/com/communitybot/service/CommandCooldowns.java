package com.communitybot.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-member cooldown shared by a group of commands. Using any command of the group starts
 * the cooldown for all of them.
 */
public class CommandCooldowns {
    public static final Duration DEFAULT_COOLDOWN = Duration.ofMinutes(5);

    // user id -> end of the cooldown
    private final Map<Long, Instant> expiries = new ConcurrentHashMap<>();
    private final Duration cooldown;
    private final Clock clock;

    public CommandCooldowns(Duration cooldown, Clock clock) {
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("Cooldown must not be negative");
        }
        this.cooldown = cooldown;
        this.clock = clock;
    }

    /**
     * Starts the cooldown for {@code userId} unless one is running.
     * @return 0 if the member may go ahead, otherwise the whole seconds left, rounded up
     */
    public synchronized long tryStart(long userId) {
        Instant now = clock.instant();
        long left = remainingSeconds(userId, now);
        if (left > 0) {
            return left;
        }
        expiries.put(userId, now.plus(cooldown));
        return 0;
    }

    public long remainingSeconds(long userId) {
        return remainingSeconds(userId, clock.instant());
    }

    private long remainingSeconds(long userId, Instant now) {
        Instant until = expiries.get(userId);
        if (until == null || !now.isBefore(until)) {
            return 0;
        }
        long millis = Duration.between(now, until).toMillis();
        return (millis + 999) / 1000;
    }
}
