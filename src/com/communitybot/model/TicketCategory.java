package com.communitybot.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One entry of the ticket panel: where tickets of this kind are opened and which
 * roles, besides the claim-all roles, may claim them.
 */
public class TicketCategory {
    public final String key;
    public final String label;
    public final String description;
    public final long chatId;
    public final Set<String> extraClaimRoles;

    public TicketCategory(String key, String label, String description, long chatId, Set<String> extraClaimRoles) {
        this.key = key;
        this.label = label;
        this.description = description;
        this.chatId = chatId;
        this.extraClaimRoles = Collections.unmodifiableSet(new LinkedHashSet<>(extraClaimRoles));
    }
}
