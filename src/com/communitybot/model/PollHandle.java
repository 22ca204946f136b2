package com.communitybot.model;

/**
 * Where a poll is rendered: the chat and the message carrying its buttons.
 */
public class PollHandle {
    public final long chatId;
    public final int messageId;

    public PollHandle(long chatId, int messageId) {
        this.chatId = chatId;
        this.messageId = messageId;
    }

    @Override
    public String toString() {
        return chatId + "/" + messageId;
    }
}
