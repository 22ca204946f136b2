package com.communitybot.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Live button poll. Owned by PollService; never handed out directly, only as a PollSnapshot.
 */
public class Poll {
    public String id;
    public String question;
    public String title;   // nullable
    public String footer;  // nullable
    public List<String> options = new ArrayList<>();
    public int[] tally;
    // user id -> currently chosen option index
    public Map<Long, Integer> voters = new LinkedHashMap<>();
    public Instant createdAt;
    public Instant endAt;
    public boolean ended;
    public String voterRoleId; // nullable
    public long issuerId;
    public long chatId;
    public Integer threadId; // forum topic, null outside topics
    public PollHandle handle;

    public Poll() {}
}
