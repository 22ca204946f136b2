package com.communitybot.model;

import java.time.Instant;

/**
 * A community member the bot has seen.
 */
public class Member {
    public long telegramId;
    public String username;    // nullable, without the leading '@'
    public String displayName;
    public Instant firstSeenAt;

    public Member() {}
    public Member(long telegramId, String username, String displayName) {
        this.telegramId = telegramId;
        this.username = username;
        this.displayName = displayName;
        this.firstSeenAt = Instant.now();
    }
}
