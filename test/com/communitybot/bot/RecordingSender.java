package com.communitybot.bot;

import org.telegram.telegrambots.bots.DefaultAbsSender;
import org.telegram.telegrambots.bots.DefaultBotOptions;
import org.telegram.telegrambots.meta.api.methods.BotApiMethod;
import org.telegram.telegrambots.meta.api.methods.send.SendDocument;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Sender that records Bot API calls instead of making them. Calls of a given method class can be made to fail,
 * and calls whose result the caller reads can be given an answer. Unanswered calls return null.
 */
public class RecordingSender extends DefaultAbsSender {
    public final List<BotApiMethod<?>> sent = new ArrayList<>();
    public final List<SendDocument> documents = new ArrayList<>();
    public Class<?> failing;
    public String failure = "Bad Request: not enough rights";

    private final Map<Class<?>, Function<Object, Object>> answers = new HashMap<>();
    private int nextMessageId = 500;

    public RecordingSender() {
        super(new DefaultBotOptions(), "0:test");
    }

    @SuppressWarnings("unchecked")
    public <M> void answer(Class<M> type, Function<M, ?> answer) {
        answers.put(type, m -> answer.apply((M) m));
    }

    /**
     * Answers every SendMessage with a message carrying a fresh id, the target chat and the sent text.
     */
    public void answerSentMessages() {
        answer(SendMessage.class, msg -> {
            Message m = new Message();
            m.setMessageId(nextMessageId++);
            m.setText(msg.getText());
            Chat chat = new Chat();
            chat.setId(Long.parseLong(msg.getChatId()));
            m.setChat(chat);
            return m;
        });
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T extends Serializable, Method extends BotApiMethod<T>> T execute(Method method)
            throws TelegramApiException {
        if (failing != null && failing.isInstance(method)) {
            throw new TelegramApiException(failure);
        }
        sent.add(method);
        Function<Object, Object> answer = answers.get(method.getClass());
        return answer == null ? null : (T) answer.apply(method);
    }

    @Override
    public Message execute(SendDocument sendDocument) throws TelegramApiException {
        if (failing != null && failing.isInstance(sendDocument)) {
            throw new TelegramApiException(failure);
        }
        documents.add(sendDocument);
        return null;
    }

    public <M> List<M> sentOf(Class<M> type) {
        return sent.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }

    public List<String> texts() {
        return sentOf(SendMessage.class).stream().map(SendMessage::getText).collect(Collectors.toList());
    }

    public SendMessage lastMessage() {
        List<SendMessage> messages = sentOf(SendMessage.class);
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }
}
