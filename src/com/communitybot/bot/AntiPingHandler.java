package com.communitybot.bot;

import com.communitybot.model.EscalationAction;
import com.communitybot.service.DeliveryFailure;
import com.communitybot.service.DeliveryListener;
import com.communitybot.service.EscalationTracker;
import com.communitybot.service.MemberService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.api.methods.groupadministration.RestrictChatMember;
import org.telegram.telegrambots.meta.api.objects.ChatPermissions;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Warns, then times out, members who keep mentioning protected staff.
 * The strike is counted before anything is sent; a timeout the bot is not allowed to
 * apply is reported in the chat and the strike stays.
 */
public class AntiPingHandler {
    private static final Logger log = LoggerFactory.getLogger(AntiPingHandler.class);

    static final String WARN_MESSAGE =
            "Heya %s, please avoid pinging the SLT and ALT.. If you do so one more time, you will be timed out. Thanks!";

    private final AbsSender sender;
    private final TelegramReplies replies;
    private final EscalationTracker tracker;
    private final MemberService members;
    private final MentionScanner scanner;
    private final Set<String> protectedRoles;
    private final Clock clock;
    private final DeliveryListener deliveries;

    public AntiPingHandler(AbsSender sender, EscalationTracker tracker, MemberService members,
                           Set<String> protectedRoles, Clock clock, DeliveryListener deliveries) {
        this.sender = sender;
        this.replies = new TelegramReplies(sender);
        this.tracker = tracker;
        this.members = members;
        this.scanner = new MentionScanner(members);
        this.protectedRoles = protectedRoles;
        this.clock = clock;
        this.deliveries = deliveries;
    }

    /**
     * Checks a group message for mentions of protected members and escalates if there are any.
     * Media messages are checked through their caption.
     * @return true if the message was an offense
     */
    public boolean onMessage(Message message) {
        Set<Long> mentioned = message.hasText()
                ? scanner.mentionedUserIds(message.getText(), message.getEntities())
                : scanner.mentionedUserIds(message.getCaption(), message.getCaptionEntities());
        Set<Long> protectedIds = mentioned.stream()
                .filter(id -> members.hasAnyRole(id, protectedRoles))
                .collect(Collectors.toSet());
        if (protectedIds.isEmpty()) {
            return false;
        }

        long authorId = message.getFrom().getId();
        Instant now = clock.instant();
        EscalationAction action = onMentionObserved(authorId, protectedIds, now);
        String who = mentionOf(message);

        if (!action.isTimeout()) {
            replies.reply(message, String.format(WARN_MESSAGE, who));
            return true;
        }

        int minutes = action.getMinutes();
        try {
            restrict(message.getChatId(), authorId, now.plus(Duration.ofMinutes(minutes)));
            replies.reply(message, who + " has been timed out for " + minutes + " minute(s) for pinging SLT/ALT again.");
        } catch (TelegramApiException e) {
            // Missing rights or the author is an admin; the strike stands
            deliveries.onDeliveryFailure(new DeliveryFailure("antiping.timeout", String.valueOf(authorId), e, now));
            replies.reply(message, "Timeout escalation would be " + minutes + " minute(s), but I lack permission.");
        }
        return true;
    }

    /**
     * Counts one offense for {@code authorId}, whatever the number of protected members mentioned.
     */
    EscalationAction onMentionObserved(long authorId, Set<Long> mentionedProtectedIds, Instant now) {
        int level = tracker.registerOffense(authorId, now);
        EscalationAction action = tracker.actionForLevel(level);
        log.info("Member {} mentioned protected member(s) {}: level {}, {}", authorId, mentionedProtectedIds, level, action);
        return action;
    }

    private void restrict(long chatId, long userId, Instant until) throws TelegramApiException {
        ChatPermissions muted = new ChatPermissions();
        muted.setCanSendMessages(false);
        muted.setCanSendOtherMessages(false);
        muted.setCanAddWebPagePreviews(false);
        muted.setCanSendPolls(false);

        RestrictChatMember restrict = RestrictChatMember.builder()
                .chatId(String.valueOf(chatId))
                .userId(userId)
                .permissions(muted)
                .untilDate((int) until.getEpochSecond())
                .build();
        sender.execute(restrict);
    }

    private static String mentionOf(Message message) {
        String username = message.getFrom().getUserName();
        return username != null ? "@" + username : message.getFrom().getFirstName();
    }
}
