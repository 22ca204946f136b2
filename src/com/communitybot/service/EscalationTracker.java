package com.communitybot.service;

import com.communitybot.model.EscalationAction;
import com.communitybot.model.StrikeRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Anti-ping strike counting. Pure state and policy; applying the action is up to the caller,
 * and a failed delivery never rolls a strike back.
 *
 * <p>Offenses inside one window raise the level by one. The first offense after the window
 * lapsed starts a new window at level 1. Stale records are left in place; they are replaced
 * by the next offense.</p>
 */
public class EscalationTracker {
    public static final Duration DEFAULT_WINDOW = Duration.ofHours(24);
    public static final int DEFAULT_BASE_MINUTES = 5;
    public static final int DEFAULT_MAX_MINUTES = 120;

    private final Map<Long, StrikeRecord> strikes = new ConcurrentHashMap<>();
    private final Duration window;
    private final int baseMinutes;
    private final int maxMinutes;

    public EscalationTracker() {
        this(DEFAULT_WINDOW, DEFAULT_BASE_MINUTES, DEFAULT_MAX_MINUTES);
    }

    public EscalationTracker(Duration window, int baseMinutes, int maxMinutes) {
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Strike window must be positive");
        }
        if (baseMinutes < 1 || maxMinutes < baseMinutes) {
            throw new IllegalArgumentException("Timeout minutes must satisfy 1 <= base <= max");
        }
        this.window = window;
        this.baseMinutes = baseMinutes;
        this.maxMinutes = maxMinutes;
    }

    /**
     * Registers one offense at {@code now} and returns the resulting escalation level (1 = first in window).
     * {@code now} must not go backwards between calls.
     */
    public synchronized int registerOffense(long userId, Instant now) {
        StrikeRecord record = strikes.get(userId);
        if (record == null || !now.isBefore(record.windowResetAt)) {
            strikes.put(userId, new StrikeRecord(1, now.plus(window)));
            return 1;
        }
        record.count++;
        return record.count;
    }

    /**
     * Level 1 and below warn; level n >= 2 times out for base * 2^(n-2) minutes, capped.
     */
    public EscalationAction actionForLevel(int level) {
        if (level <= 1) {
            return EscalationAction.warn();
        }
        long minutes = baseMinutes;
        for (int i = 2; i < level && minutes < maxMinutes; i++) {
            minutes *= 2;
        }
        return EscalationAction.timeout((int) Math.min(minutes, maxMinutes));
    }

    /** Current count for a user, 0 if the user has no live window at {@code now}. */
    public synchronized int currentLevel(long userId, Instant now) {
        StrikeRecord record = strikes.get(userId);
        if (record == null || !now.isBefore(record.windowResetAt)) {
            return 0;
        }
        return record.count;
    }
}
