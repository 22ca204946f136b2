package com.communitybot.service;

import com.communitybot.model.TicketCategory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Who may claim a ticket: anyone holding a claim-all role, plus, per category, the
 * category's extra roles. A pure function of the category and the actor's role set.
 */
public class ClaimEligibility {
    private final Set<String> claimAllRoles;

    public ClaimEligibility(Set<String> claimAllRoles) {
        this.claimAllRoles = Collections.unmodifiableSet(new LinkedHashSet<>(claimAllRoles));
    }

    public boolean canClaim(TicketCategory category, Set<String> actorRoles) {
        if (actorRoles == null || actorRoles.isEmpty()) {
            return false;
        }
        for (String role : actorRoles) {
            if (claimAllRoles.contains(role) || category.extraClaimRoles.contains(role)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> getClaimAllRoles() {
        return claimAllRoles;
    }
}
