package com.communitybot.bot;

import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;

/**
 * Builders for the Telegram objects handlers receive.
 */
final class UpdateFixtures {
    private static int nextMessageId = 1;
    private static int nextCallbackId = 1;

    private UpdateFixtures() {}

    static User user(long id, String username, String firstName) {
        User u = new User();
        u.setId(id);
        u.setUserName(username);
        u.setFirstName(firstName);
        u.setIsBot(false);
        return u;
    }

    static Chat chat(long id, String type, String title) {
        Chat c = new Chat();
        c.setId(id);
        c.setType(type);
        c.setTitle(title);
        return c;
    }

    static Message message(User from, Chat chat, String text) {
        Message m = new Message();
        m.setMessageId(nextMessageId++);
        m.setFrom(from);
        m.setChat(chat);
        m.setText(text);
        m.setDate(0);
        return m;
    }

    static Message inTopic(Message m, int threadId) {
        m.setMessageThreadId(threadId);
        return m;
    }

    static CallbackQuery callback(User from, String data, Message carrier) {
        CallbackQuery cb = new CallbackQuery();
        cb.setId("cb-" + nextCallbackId++);
        cb.setFrom(from);
        cb.setData(data);
        cb.setMessage(carrier);
        return cb;
    }

    static Update update(Message m) {
        Update u = new Update();
        u.setMessage(m);
        return u;
    }

    static Update update(CallbackQuery cb) {
        Update u = new Update();
        u.setCallbackQuery(cb);
        return u;
    }
}
