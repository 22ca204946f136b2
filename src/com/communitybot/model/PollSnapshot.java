package com.communitybot.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Immutable copy of a poll's state, taken inside the engine's critical section and
 * used for rendering outside of it.
 */
public final class PollSnapshot {
    private final String id;
    private final String question;
    private final String title;
    private final String footer;
    private final List<String> options;
    private final List<Integer> tally;
    private final Map<Long, Integer> voters;
    private final Instant endAt;
    private final boolean ended;
    private final String voterRoleId;
    private final long chatId;
    private final Integer threadId;

    private PollSnapshot(Poll poll, String title, String footer) {
        this.id = poll.id;
        this.question = poll.question;
        this.title = title;
        this.footer = footer;
        this.options = Collections.unmodifiableList(new ArrayList<>(poll.options));
        List<Integer> counts = new ArrayList<>(poll.tally.length);
        for (int c : poll.tally) {
            counts.add(c);
        }
        this.tally = Collections.unmodifiableList(counts);
        this.voters = Map.copyOf(poll.voters);
        this.endAt = poll.endAt;
        this.ended = poll.ended;
        this.voterRoleId = poll.voterRoleId;
        this.chatId = poll.chatId;
        this.threadId = poll.threadId;
    }

    public static PollSnapshot of(Poll poll) {
        return new PollSnapshot(poll, poll.title, poll.footer);
    }

    /**
     * Snapshot with close-time title/footer overrides applied. A null override keeps the poll's own text.
     */
    public static PollSnapshot closing(Poll poll, String titleOverride, String footerOverride) {
        return new PollSnapshot(poll,
                titleOverride != null ? titleOverride : poll.title,
                footerOverride != null ? footerOverride : poll.footer);
    }

    public String getId() { return id; }
    public String getQuestion() { return question; }
    public String getTitle() { return title; }
    public String getFooter() { return footer; }
    public List<String> getOptions() { return options; }
    public List<Integer> getTally() { return tally; }
    public Map<Long, Integer> getVoters() { return voters; }
    public Instant getEndAt() { return endAt; }
    public boolean isEnded() { return ended; }
    public String getVoterRoleId() { return voterRoleId; }
    public long getChatId() { return chatId; }
    public Integer getThreadId() { return threadId; }

    public int votesFor(int optionIndex) {
        return tally.get(optionIndex);
    }

    public int totalVotes() {
        int total = 0;
        for (int c : tally) {
            total += c;
        }
        return total;
    }

    @Override
    public String toString() {
        return "PollSnapshot{id='" + id + "', tally=" + tally + ", ended=" + ended + '}';
    }
}
