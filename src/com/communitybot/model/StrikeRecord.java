package com.communitybot.model;

import java.time.Instant;

/**
 * Anti-ping offenses of one user inside the current window.
 */
public class StrikeRecord {
    public int count;
    public Instant windowResetAt;

    public StrikeRecord(int count, Instant windowResetAt) {
        this.count = count;
        this.windowResetAt = windowResetAt;
    }
}
