package com.communitybot.model;

import java.time.Instant;

/**
 * One message of a ticket conversation, in arrival order.
 */
public class TranscriptLine {
    public final Instant timestamp;
    public final long authorId;
    public final String authorName;
    public final String text;

    public TranscriptLine(Instant timestamp, long authorId, String authorName, String text) {
        this.timestamp = timestamp;
        this.authorId = authorId;
        this.authorName = authorName;
        this.text = text;
    }
}
