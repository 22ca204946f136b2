package com.communitybot.bot;

import com.communitybot.model.PollHandle;
import com.communitybot.model.PollSnapshot;
import com.communitybot.service.PlatformException;
import com.communitybot.service.PollPresenter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageReplyMarkup;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;

import java.time.Clock;

/**
 * Polls as Telegram messages with an inline keyboard. Closing removes the keyboard,
 * since Telegram buttons cannot be disabled.
 *
 * An edit Telegram refuses as "message is not modified" already shows what was asked for,
 * so it counts as done.
 */
public class TelegramPollPresenter implements PollPresenter {
    private static final Logger log = LoggerFactory.getLogger(TelegramPollPresenter.class);
    private static final String NOT_MODIFIED = "message is not modified";

    private final AbsSender sender;
    private final Clock clock;

    public TelegramPollPresenter(AbsSender sender, Clock clock) {
        this.sender = sender;
        this.clock = clock;
    }

    @Override
    public PollHandle renderPoll(PollSnapshot poll) throws PlatformException {
        SendMessage msg = new SendMessage();
        msg.setChatId(String.valueOf(poll.getChatId()));
        msg.setMessageThreadId(poll.getThreadId());
        msg.setText(PollRenderer.render(poll, clock.instant()));
        msg.setReplyMarkup(PollRenderer.keyboard(poll));
        try {
            Message sent = sender.execute(msg);
            return new PollHandle(poll.getChatId(), sent.getMessageId());
        } catch (TelegramApiException e) {
            throw new PlatformException("Could not post poll " + poll.getId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void updatePoll(PollHandle handle, PollSnapshot poll) throws PlatformException {
        EditMessageText edit = EditMessageText.builder()
                .chatId(String.valueOf(handle.chatId))
                .messageId(handle.messageId)
                .text(PollRenderer.render(poll, clock.instant()))
                .build();
        // An ended poll is drawn without buttons
        if (!poll.isEnded()) {
            edit.setReplyMarkup(PollRenderer.keyboard(poll));
        }
        try {
            sender.execute(edit);
        } catch (TelegramApiException e) {
            if (isNotModified(e)) {
                log.debug("Poll message {} already up to date", handle);
                return;
            }
            throw new PlatformException("Could not update poll message " + handle + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void disableInteraction(PollHandle handle) throws PlatformException {
        EditMessageReplyMarkup edit = EditMessageReplyMarkup.builder()
                .chatId(String.valueOf(handle.chatId))
                .messageId(handle.messageId)
                .build();
        try {
            sender.execute(edit);
        } catch (TelegramApiException e) {
            if (isNotModified(e)) {
                log.debug("Poll message {} has no buttons left", handle);
                return;
            }
            throw new PlatformException("Could not remove buttons from " + handle + ": " + e.getMessage(), e);
        }
    }

    static boolean isNotModified(TelegramApiException e) {
        String text = e instanceof TelegramApiRequestException
                ? ((TelegramApiRequestException) e).getApiResponse()
                : null;
        if (text == null) {
            text = e.getMessage();
        }
        return text != null && text.contains(NOT_MODIFIED);
    }
}
