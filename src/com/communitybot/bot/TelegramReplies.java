package com.communitybot.bot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

/**
 * Fire-and-forget answers to members. A reply that cannot be delivered is logged and dropped;
 * it never affects state the engines already committed.
 */
public class TelegramReplies {
    private static final Logger log = LoggerFactory.getLogger(TelegramReplies.class);

    private final AbsSender sender;

    public TelegramReplies(AbsSender sender) {
        this.sender = sender;
    }

    public void send(long chatId, Integer threadId, String text) {
        SendMessage msg = new SendMessage();
        msg.setChatId(String.valueOf(chatId));
        msg.setMessageThreadId(threadId);
        msg.setText(text);
        try {
            sender.execute(msg);
        } catch (TelegramApiException e) {
            log.warn("Failed to send message to chat {}: {}", chatId, e.getMessage());
        }
    }

    public void reply(Message to, String text) {
        SendMessage msg = new SendMessage();
        msg.setChatId(String.valueOf(to.getChatId()));
        msg.setMessageThreadId(to.getMessageThreadId());
        msg.setReplyToMessageId(to.getMessageId());
        msg.setText(text);
        try {
            sender.execute(msg);
        } catch (TelegramApiException e) {
            log.warn("Failed to reply in chat {}: {}", to.getChatId(), e.getMessage());
        }
    }

    /**
     * Answers a button press with a private toast. {@code text} may be null to just stop the spinner.
     */
    public void answer(String callbackQueryId, String text) {
        AnswerCallbackQuery ack = new AnswerCallbackQuery();
        ack.setCallbackQueryId(callbackQueryId);
        ack.setText(text);
        try {
            sender.execute(ack);
        } catch (TelegramApiException e) {
            log.warn("Failed to answer callback {}: {}", callbackQueryId, e.getMessage());
        }
    }
}
