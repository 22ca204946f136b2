package com.communitybot.model;

import java.time.Instant;

/**
 * Support ticket. claimedBy is set at most once.
 */
public class Ticket {
    public String id;
    public String key;
    public long openerId;
    public String openerName;
    public Long claimedBy; // nullable until claimed
    public SurfaceHandle surface;
    public Instant openedAt;

    public Ticket() {}

    public boolean isClaimed() {
        return claimedBy != null;
    }
}
