package com.communitybot.service;

import com.communitybot.model.Member;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Member directory:
 * - remembers every member the bot sees, so @username mentions resolve to ids
 * - answers role lookups; the configured role lists are the starting point, promotions move members between them
 */
public class MemberService {
    private static final Logger log = LoggerFactory.getLogger(MemberService.class);

    // In-memory storage: Map<Telegram ID, Member>
    private final Map<Long, Member> members = new ConcurrentHashMap<>();
    // lower-case username -> Telegram ID
    private final Map<String, Long> usernames = new ConcurrentHashMap<>();
    // role name -> member ids; the set of role names is fixed by configuration
    private final Map<String, Set<Long>> roles;
    private final Clock clock;

    public MemberService(Map<String, Set<Long>> roles, Clock clock) {
        Map<String, Set<Long>> copy = new ConcurrentHashMap<>();
        roles.forEach((role, ids) -> {
            Set<Long> holders = ConcurrentHashMap.newKeySet();
            holders.addAll(ids);
            copy.put(role, holders);
        });
        this.roles = Collections.unmodifiableMap(copy);
        this.clock = clock;
    }

    /**
     * Registers a member if unseen, otherwise refreshes username and display name.
     * @return the stored member
     */
    public Member remember(long telegramId, String username, String displayName) {
        Member member = members.computeIfAbsent(telegramId, id -> {
            Member m = new Member();
            m.telegramId = id;
            m.firstSeenAt = clock.instant();
            log.debug("New member seen: {} ({})", displayName, id);
            return m;
        });
        if (member.username != null && !member.username.equalsIgnoreCase(username == null ? "" : username)) {
            usernames.remove(member.username.toLowerCase(Locale.ROOT), telegramId);
        }
        member.username = username;
        member.displayName = displayName;
        if (username != null && !username.isBlank()) {
            usernames.put(username.toLowerCase(Locale.ROOT), telegramId);
        }
        return member;
    }

    public Optional<Member> find(long telegramId) {
        return Optional.ofNullable(members.get(telegramId));
    }

    /**
     * @param username with or without the leading '@'
     */
    public Optional<Long> findIdByUsername(String username) {
        if (username == null) {
            return Optional.empty();
        }
        String key = username.startsWith("@") ? username.substring(1) : username;
        return Optional.ofNullable(usernames.get(key.toLowerCase(Locale.ROOT)));
    }

    public String displayNameOf(long telegramId) {
        Member member = members.get(telegramId);
        return member != null && member.displayName != null ? member.displayName : String.valueOf(telegramId);
    }

    public Set<String> rolesOf(long telegramId) {
        Set<String> result = new LinkedHashSet<>();
        roles.forEach((role, ids) -> {
            if (ids.contains(telegramId)) {
                result.add(role);
            }
        });
        return result;
    }

    public boolean hasAnyRole(long telegramId, Set<String> wanted) {
        for (String role : wanted) {
            Set<Long> ids = roles.get(role);
            if (ids != null && ids.contains(telegramId)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasRole(long telegramId, String role) {
        Set<Long> ids = roles.get(role);
        return ids != null && ids.contains(telegramId);
    }

    /**
     * Moves a member from one role to another.
     * @return false if either role is unknown or the member does not hold {@code fromRole}
     */
    public synchronized boolean moveRole(long telegramId, String fromRole, String toRole) {
        Set<Long> from = roles.get(fromRole);
        Set<Long> to = roles.get(toRole);
        if (from == null || to == null || !from.contains(telegramId)) {
            return false;
        }
        from.remove(telegramId);
        to.add(telegramId);
        log.info("Member {} moved from role {} to {}", telegramId, fromRole, toRole);
        return true;
    }

    public boolean isKnownRole(String role) {
        return roles.containsKey(role);
    }

    public List<Member> listAll() {
        return new ArrayList<>(members.values());
    }

    public int countAll() {
        return members.size();
    }
}
