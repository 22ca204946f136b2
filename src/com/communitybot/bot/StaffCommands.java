package com.communitybot.bot;

import com.communitybot.config.BotConfig;
import com.communitybot.service.MemberService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.DeleteMessage;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Staff commands. Arguments are separated by '|':
 * <pre>
 * /promote @user | old role | new role | reason
 * /infractions @user | points | reason
 * /update 1.4 | What changed | https://example.org/shot.png
 * /stafffeedback @staff | review | rating
 * </pre>
 * Members are named by @username or numeric id; a username resolves once its owner has been seen by the bot.
 */
public class StaffCommands {
    private static final Logger log = LoggerFactory.getLogger(StaffCommands.class);

    static final String NO_PERMISSION = "You do not have permission to use this command.";
    static final String PROMOTE_USAGE = "Usage: /promote @user | <old role> | <new role> | <reason>";
    static final String INFRACTION_USAGE = "Usage: /infractions @user | <points> | <reason>";
    static final String UPDATE_USAGE = "Usage: /update <number> | <description> [| <image url> ...]";
    static final String FEEDBACK_USAGE = "Usage: /stafffeedback @staff | <review> | <rating>";
    private static final int MAX_IMAGES = 3;

    private final AbsSender sender;
    private final TelegramReplies replies;
    private final BotConfig config;
    private final MemberService members;

    public StaffCommands(AbsSender sender, BotConfig config, MemberService members) {
        this.sender = sender;
        this.replies = new TelegramReplies(sender);
        this.config = config;
        this.members = members;
    }

    public void onPromote(Message m, String args) {
        long issuer = m.getFrom().getId();
        if (!members.hasAnyRole(issuer, config.promotionRoles)) {
            replies.reply(m, NO_PERMISSION);
            return;
        }
        List<String> parts = segments(args, 4);
        if (parts.size() != 4) {
            replies.reply(m, PROMOTE_USAGE);
            return;
        }
        String oldRole = parts.get(1);
        String newRole = parts.get(2);
        String reason = parts.get(3);
        Optional<Long> target = resolve(parts.get(0));
        if (target.isEmpty()) {
            replies.reply(m, "Could not find member " + parts.get(0) + ".");
            return;
        }
        for (String role : new String[]{oldRole, newRole}) {
            if (!members.isKnownRole(role)) {
                replies.reply(m, "Unknown role: " + role);
                return;
            }
        }
        long memberId = target.get();
        if (!members.moveRole(memberId, oldRole, newRole)) {
            replies.reply(m, "The user does not have the old role " + oldRole + ".");
            return;
        }
        log.info("Member {} promoted from {} to {} by {}", memberId, oldRole, newRole, issuer);
        replies.send(m.getChatId(), m.getMessageThreadId(), "STAFF PROMOTION\n"
                + "The Community Standards team has decided to award you a promotion. Congratulations!\n\n"
                + "Staff Member: " + members.displayNameOf(memberId) + "\n\n"
                + "Old Rank: " + oldRole + "\n\n"
                + "New Rank: " + newRole + "\n\n"
                + "Reason: " + reason + "\n\n"
                + "Issued by " + TicketInteractions.nameOf(m.getFrom()));
    }

    public void onInfraction(Message m, String args) {
        if (!members.hasAnyRole(m.getFrom().getId(), config.infractionRoles)) {
            replies.reply(m, NO_PERMISSION);
            return;
        }
        List<String> parts = segments(args, 3);
        if (parts.size() != 3) {
            replies.reply(m, INFRACTION_USAGE);
            return;
        }
        int points;
        try {
            points = Integer.parseInt(parts.get(1));
        } catch (NumberFormatException e) {
            replies.reply(m, "Points must be a whole number.");
            return;
        }
        Optional<Long> target = resolve(parts.get(0));
        if (target.isEmpty()) {
            replies.reply(m, "Could not find member " + parts.get(0) + ".");
            return;
        }
        long memberId = target.get();
        String reason = parts.get(2);
        log.info("Infraction of {} point(s) issued to {} by {}", points, memberId, m.getFrom().getId());
        replies.send(m.getChatId(), m.getMessageThreadId(), "Infraction Issued\n\n"
                + "User: " + members.displayNameOf(memberId) + "\n"
                + "Points: " + points + "\n"
                + "Reason: " + reason + "\n\n"
                + "Issued by " + TicketInteractions.nameOf(m.getFrom()));
        // Members who never opened a chat with the bot cannot be messaged; the notice above stands either way
        replies.send(memberId, null, "You have received an infraction in " + chatTitle(m) + ".\n"
                + "Points: " + points + "\nReason: " + reason);
    }

    public void onUpdate(Message m, String args) {
        List<String> parts = segments(args, 2 + MAX_IMAGES);
        if (parts.size() < 2) {
            replies.reply(m, UPDATE_USAGE);
            return;
        }
        if (config.announcementChatId == 0) {
            replies.reply(m, "Announcement channel not found.");
            return;
        }
        StringBuilder text = new StringBuilder("Update #").append(parts.get(0)).append("\n\n").append(parts.get(1));
        List<String> images = parts.subList(2, parts.size());
        for (int i = 0; i < images.size(); i++) {
            text.append(i == 0 ? "\n\n" : "\n").append(i == 0 ? "Image: " : "Additional Image: ").append(images.get(i));
        }

        SendMessage msg = new SendMessage();
        msg.setChatId(String.valueOf(config.announcementChatId));
        msg.setText(text.toString());
        try {
            sender.execute(msg);
        } catch (TelegramApiException e) {
            log.warn("Could not post update #{} to chat {}: {}", parts.get(0), config.announcementChatId, e.getMessage());
            replies.reply(m, "Could not post the update announcement.");
            return;
        }
        replies.reply(m, "Update announcement sent successfully!");
    }

    /**
     * Feedback is private: the command message is removed from group chats, the feedback goes to the
     * feedback chat if one is configured, and the author is thanked in a private chat.
     */
    public void onStaffFeedback(Message m, String args) {
        List<String> parts = segments(args, 3);
        if (parts.size() != 3) {
            replies.reply(m, FEEDBACK_USAGE);
            return;
        }
        String staff = resolve(parts.get(0)).map(members::displayNameOf).orElse(parts.get(0));
        if (!m.isUserMessage()) {
            deleteCommand(m);
        }
        if (config.feedbackChatId != 0) {
            replies.send(config.feedbackChatId, null, "Staff Feedback\n\n"
                    + "Staff Member: " + staff + "\n"
                    + "Rating: " + parts.get(2) + "\n"
                    + "Review: " + parts.get(1) + "\n\n"
                    + "Feedback submitted by " + TicketInteractions.nameOf(m.getFrom()));
        }
        replies.send(m.getFrom().getId(), null, "Thank you for your feedback!");
    }

    private Optional<Long> resolve(String who) {
        if (who.startsWith("@")) {
            return members.findIdByUsername(who);
        }
        try {
            return Optional.of(Long.parseLong(who));
        } catch (NumberFormatException e) {
            return members.findIdByUsername(who);
        }
    }

    private void deleteCommand(Message m) {
        DeleteMessage delete = DeleteMessage.builder()
                .chatId(String.valueOf(m.getChatId()))
                .messageId(m.getMessageId())
                .build();
        try {
            sender.execute(delete);
        } catch (TelegramApiException e) {
            log.warn("Could not remove feedback command {} in chat {}: {}", m.getMessageId(), m.getChatId(), e.getMessage());
        }
    }

    private static String chatTitle(Message m) {
        return m.getChat() != null && m.getChat().getTitle() != null ? m.getChat().getTitle() : "the community";
    }

    // At most limit segments, the last keeping any further '|'. An empty segment makes the list invalid.
    static List<String> segments(String args, int limit) {
        List<String> out = new ArrayList<>();
        if (args == null || args.isBlank()) {
            return out;
        }
        for (String raw : args.split("\\|", limit)) {
            String segment = raw.trim();
            if (segment.isEmpty()) {
                return new ArrayList<>();
            }
            out.add(segment);
        }
        return out;
    }
}
