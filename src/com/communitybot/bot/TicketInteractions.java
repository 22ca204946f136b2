package com.communitybot.bot;

import com.communitybot.model.Ticket;
import com.communitybot.model.TicketCategory;
import com.communitybot.model.TranscriptLine;
import com.communitybot.service.Failure;
import com.communitybot.service.MemberService;
import com.communitybot.service.Outcome;
import com.communitybot.service.PlatformException;
import com.communitybot.service.TicketCloseReport;
import com.communitybot.service.TicketService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.DeleteMessage;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ForceReplyKeyboard;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ticket panel and ticket topic buttons. Callback data:
 * - {@code ticket:open:<categoryKey>} from the panel
 * - {@code ticket:claim:<ticketId>}, {@code ticket:close:<ticketId>}, {@code ticket:reason:<ticketId>} from the greeting
 *
 * "Close with reason" asks for the reason with a force-reply prompt; the reply closes the ticket.
 */
public class TicketInteractions {
    private static final Logger log = LoggerFactory.getLogger(TicketInteractions.class);

    public static final String CALLBACK_PREFIX = "ticket:";
    private static final String OPEN = "open";
    private static final String CLAIM = "claim";
    private static final String CLOSE = "close";
    private static final String REASON = "reason";

    private final AbsSender sender;
    private final TelegramReplies replies;
    private final TicketService tickets;
    private final TelegramSurfaces surfaces;
    private final MemberService members;
    // "chatId:promptMessageId" -> ticket awaiting a close reason from one member
    private final Map<String, PendingReason> pendingReasons = new ConcurrentHashMap<>();

    private static final class PendingReason {
        final String ticketId;
        final long closerId;

        PendingReason(String ticketId, long closerId) {
            this.ticketId = ticketId;
            this.closerId = closerId;
        }
    }

    public TicketInteractions(AbsSender sender, TicketService tickets, TelegramSurfaces surfaces, MemberService members) {
        this.sender = sender;
        this.replies = new TelegramReplies(sender);
        this.tickets = tickets;
        this.surfaces = surfaces;
        this.members = members;
    }

    /**
     * Posts the ticket creation panel: one button per configured category.
     */
    public void postPanel(long chatId, Integer threadId) {
        InlineKeyboardMarkup markup = new InlineKeyboardMarkup();
        List<List<InlineKeyboardButton>> keyboard = new ArrayList<>();
        for (TicketCategory category : tickets.getCategories()) {
            InlineKeyboardButton button = new InlineKeyboardButton();
            button.setText(category.label);
            button.setCallbackData(CALLBACK_PREFIX + OPEN + ":" + category.key);
            List<InlineKeyboardButton> row = new ArrayList<>();
            row.add(button);
            keyboard.add(row);
        }
        markup.setKeyboard(keyboard);

        StringBuilder text = new StringBuilder("🎫 Create a Support Ticket\nSelect the reason for your ticket below.\n");
        for (TicketCategory category : tickets.getCategories()) {
            text.append("\n• ").append(category.label);
            if (!category.description.isEmpty()) {
                text.append(" — ").append(category.description);
            }
        }

        SendMessage msg = new SendMessage();
        msg.setChatId(String.valueOf(chatId));
        msg.setMessageThreadId(threadId);
        msg.setText(text.toString());
        msg.setReplyMarkup(markup);
        try {
            sender.execute(msg);
        } catch (TelegramApiException e) {
            log.warn("Failed to post ticket panel in chat {}: {}", chatId, e.getMessage());
        }
    }

    public void onCallback(CallbackQuery cb) {
        String[] parts = cb.getData().split(":", 3);
        if (parts.length != 3) {
            replies.answer(cb.getId(), null);
            return;
        }
        switch (parts[1]) {
            case OPEN:
                open(cb, parts[2]);
                break;
            case CLAIM:
                claim(cb, parts[2]);
                break;
            case CLOSE:
                close(cb, parts[2]);
                break;
            case REASON:
                askReason(cb, parts[2]);
                break;
            default:
                replies.answer(cb.getId(), null);
        }
    }

    /**
     * Handles a message seen anywhere. Messages inside a ticket topic are recorded for the
     * transcript, or deleted if their author has no access to the ticket.
     * @return true if the message was used up here (deleted, or taken as a close reason)
     */
    public boolean onMessage(Message message) {
        Optional<Ticket> found = tickets.findBySurface(message.getChatId(), message.getMessageThreadId());
        if (found.isEmpty()) {
            return false;
        }
        Ticket ticket = found.get();
        User from = message.getFrom();

        if (!surfaces.isAllowed(ticket.surface, from.getId())) {
            deleteMessage(message);
            return true;
        }
        surfaces.record(ticket.surface, new TranscriptLine(
                Instant.ofEpochSecond(message.getDate()), from.getId(), nameOf(from),
                message.hasText() ? message.getText() : "[non-text message]"));

        Message replyTo = message.getReplyToMessage();
        if (replyTo != null && message.hasText()) {
            String key = promptKey(replyTo.getChatId(), replyTo.getMessageId());
            PendingReason pending = pendingReasons.get(key);
            // Only the member who pressed "Close with Reason" answers the prompt
            if (pending != null && pending.closerId == from.getId()) {
                pendingReasons.remove(key);
                finishClose(pending.ticketId, from, message.getText());
                return true;
            }
        }
        return false;
    }

    private void open(CallbackQuery cb, String key) {
        User from = cb.getFrom();
        String name = nameOf(from);
        Outcome<Ticket> outcome = tickets.openTicket(from.getId(), name, key);
        if (!outcome.isOk()) {
            replies.answer(cb.getId(), outcome.getFailure().getUserMessage());
            return;
        }
        Ticket ticket = outcome.getValue();
        String label = tickets.category(key).map(c -> c.label).orElse(key);
        String greet = "Thank you " + name + " for opening a " + label + "! Our Staff Representatives will be here "
                + "to assist you when they are free! Please refrain from pinging any staff unless they have requested.";
        try {
            surfaces.post(ticket.surface, greet, controls(ticket.id));
        } catch (PlatformException e) {
            log.warn("Ticket {} opened but greeting failed: {}", ticket.id, e.getMessage());
        }
        replies.answer(cb.getId(), "Your ticket has been opened: " + ticket.surface.name);
    }

    private void claim(CallbackQuery cb, String ticketId) {
        User from = cb.getFrom();
        Outcome<Ticket> outcome = tickets.claimTicket(ticketId, from.getId(), members.rolesOf(from.getId()));
        if (outcome.is(Failure.ALREADY_CLAIMED)) {
            String holder = tickets.findTicket(ticketId)
                    .map(t -> members.displayNameOf(t.claimedBy))
                    .orElse("someone else");
            replies.answer(cb.getId(), "Already claimed by " + holder + ".");
            return;
        }
        if (!outcome.isOk()) {
            replies.answer(cb.getId(), outcome.getFailure().getUserMessage());
            return;
        }
        replies.answer(cb.getId(), null);
        try {
            surfaces.post(outcome.getValue().surface, "Ticket claimed by " + nameOf(from) + ".", null);
        } catch (PlatformException e) {
            log.warn("Ticket {} claimed but announcement failed: {}", ticketId, e.getMessage());
        }
    }

    private void close(CallbackQuery cb, String ticketId) {
        if (!checkAccess(cb, ticketId)) {
            return;
        }
        replies.answer(cb.getId(), "Closing ticket…");
        finishClose(ticketId, cb.getFrom(), null);
    }

    private void askReason(CallbackQuery cb, String ticketId) {
        if (!checkAccess(cb, ticketId)) {
            return;
        }
        Ticket ticket = tickets.findTicket(ticketId).orElse(null);
        if (ticket == null) {
            replies.answer(cb.getId(), Failure.TICKET_NOT_FOUND.getUserMessage());
            return;
        }
        // Selective force-reply reaches the members @mentioned in the prompt; without a username
        // the prompt is shown to everyone and only the closer's reply is taken.
        User closer = cb.getFrom();
        boolean mentionable = closer.getUserName() != null && !closer.getUserName().isBlank();
        ForceReplyKeyboard forceReply = new ForceReplyKeyboard();
        forceReply.setForceReply(true);
        forceReply.setSelective(mentionable);
        String who = mentionable ? "@" + closer.getUserName() : nameOf(closer);
        Integer buttonMessageId = cb.getMessage() == null ? null : cb.getMessage().getMessageId();
        try {
            Message prompt = surfaces.post(ticket.surface,
                    who + ", reply to this message with the reason for closing this ticket.", forceReply, buttonMessageId);
            pendingReasons.put(promptKey(prompt.getChatId(), prompt.getMessageId()),
                    new PendingReason(ticketId, closer.getId()));
            replies.answer(cb.getId(), null);
        } catch (PlatformException e) {
            log.warn("Could not ask for close reason on ticket {}: {}", ticketId, e.getMessage());
            replies.answer(cb.getId(), "Could not ask for a reason; use Close instead.");
        }
    }

    private void finishClose(String ticketId, User closer, String reason) {
        Outcome<TicketCloseReport> outcome = tickets.closeTicket(ticketId, closer.getId(), nameOf(closer), reason);
        if (!outcome.isOk()) {
            log.info("Close of ticket {} by {} refused: {}", ticketId, closer.getId(), outcome.getFailure());
            return;
        }
        TicketCloseReport report = outcome.getValue();
        if (!report.isClean()) {
            log.warn("Ticket {} closed with failed steps {}; recover manually", ticketId, report.getFailures().keySet());
        }
        pendingReasons.values().removeIf(p -> p.ticketId.equals(ticketId));
    }

    private boolean checkAccess(CallbackQuery cb, String ticketId) {
        Optional<Ticket> ticket = tickets.findTicket(ticketId);
        if (ticket.isEmpty()) {
            replies.answer(cb.getId(), Failure.TICKET_NOT_FOUND.getUserMessage());
            return false;
        }
        long userId = cb.getFrom().getId();
        if (!tickets.hasSurfaceAccess(ticket.get(), userId, members.rolesOf(userId))) {
            replies.answer(cb.getId(), Failure.NO_SURFACE_ACCESS.getUserMessage());
            return false;
        }
        return true;
    }

    private static InlineKeyboardMarkup controls(String ticketId) {
        List<InlineKeyboardButton> row = new ArrayList<>();
        row.add(button("✅ Claim", CALLBACK_PREFIX + CLAIM + ":" + ticketId));
        row.add(button("🔒 Close", CALLBACK_PREFIX + CLOSE + ":" + ticketId));
        row.add(button("📝 Close with Reason", CALLBACK_PREFIX + REASON + ":" + ticketId));
        List<List<InlineKeyboardButton>> keyboard = new ArrayList<>();
        keyboard.add(row);
        InlineKeyboardMarkup markup = new InlineKeyboardMarkup();
        markup.setKeyboard(keyboard);
        return markup;
    }

    private static InlineKeyboardButton button(String text, String data) {
        InlineKeyboardButton button = new InlineKeyboardButton();
        button.setText(text);
        button.setCallbackData(data);
        return button;
    }

    private void deleteMessage(Message message) {
        DeleteMessage delete = DeleteMessage.builder()
                .chatId(String.valueOf(message.getChatId()))
                .messageId(message.getMessageId())
                .build();
        try {
            sender.execute(delete);
        } catch (TelegramApiException e) {
            log.warn("Could not remove message {} from ticket topic: {}", message.getMessageId(), e.getMessage());
        }
    }

    private static String promptKey(long chatId, int messageId) {
        return chatId + ":" + messageId;
    }

    static String nameOf(User user) {
        String name = user.getFirstName();
        if (user.getLastName() != null) {
            name = name + " " + user.getLastName();
        }
        return name;
    }
}
