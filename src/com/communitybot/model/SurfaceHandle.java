package com.communitybot.model;

import java.util.Objects;

/**
 * A ticket's conversation surface: a forum topic inside a supergroup.
 */
public final class SurfaceHandle {
    public final long chatId;
    public final int threadId;
    public final String name;

    public SurfaceHandle(long chatId, int threadId, String name) {
        this.chatId = chatId;
        this.threadId = threadId;
        this.name = name;
    }

    public boolean isAt(long chatId, Integer threadId) {
        return this.chatId == chatId && threadId != null && this.threadId == threadId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SurfaceHandle)) return false;
        SurfaceHandle that = (SurfaceHandle) o;
        return chatId == that.chatId && threadId == that.threadId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(chatId, threadId);
    }

    @Override
    public String toString() {
        return name + " (" + chatId + "#" + threadId + ")";
    }
}
