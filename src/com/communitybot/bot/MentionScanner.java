package com.communitybot.bot;

import com.communitybot.service.MemberService;
import org.telegram.telegrambots.meta.api.objects.MessageEntity;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves the members a message mentions: {@code text_mention} entities carry the user,
 * {@code @username} mentions are looked up in the member directory.
 */
public class MentionScanner {
    private final MemberService members;

    public MentionScanner(MemberService members) {
        this.members = members;
    }

    public Set<Long> mentionedUserIds(String text, List<MessageEntity> entities) {
        Set<Long> ids = new LinkedHashSet<>();
        if (text == null || entities == null) {
            return ids;
        }
        for (MessageEntity entity : entities) {
            if ("text_mention".equals(entity.getType()) && entity.getUser() != null) {
                ids.add(entity.getUser().getId());
            } else if ("mention".equals(entity.getType())) {
                int start = entity.getOffset();
                int end = start + entity.getLength();
                if (start < 0 || end > text.length() || start >= end) {
                    continue;
                }
                members.findIdByUsername(text.substring(start, end)).ifPresent(ids::add);
            }
        }
        return ids;
    }
}
