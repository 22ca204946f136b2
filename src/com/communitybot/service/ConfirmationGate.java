package com.communitybot.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Bounded wait for a confirmation phrase. Whichever comes first, the matching answer or
 * the timer, resolves the wait; the other one finds it already resolved and does nothing.
 */
public class ConfirmationGate {
    private static final Logger log = LoggerFactory.getLogger(ConfirmationGate.class);

    public enum Result { CONFIRMED, TIMED_OUT }

    private static final class Pending {
        final String phrase;
        final Consumer<Result> onResult;
        boolean resolved;

        Pending(String phrase, Consumer<Result> onResult) {
            this.phrase = phrase;
            this.onResult = onResult;
        }
    }

    private final Scheduler scheduler;
    // "chatId:userId" -> pending wait
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();

    public ConfirmationGate(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Starts waiting for {@code userId} to type {@code phrase} in {@code chatId}. A wait already
     * running for the same user and chat is dropped without a result; its timer still fires but is ignored.
     */
    public void await(long chatId, long userId, String phrase, Duration timeout, Consumer<Result> onResult) {
        String key = key(chatId, userId);
        Pending wait = new Pending(phrase, onResult);
        Pending replaced = pending.put(key, wait);
        if (replaced != null) {
            synchronized (replaced) {
                replaced.resolved = true;
            }
        }
        scheduler.after(timeout, () -> resolve(key, wait, Result.TIMED_OUT));
    }

    /**
     * Offers a message to the gate.
     * @return true if the message answered a pending wait
     */
    public boolean offer(long chatId, long userId, String text) {
        String key = key(chatId, userId);
        Pending wait = pending.get(key);
        if (wait == null || text == null || !wait.phrase.equals(text.trim())) {
            return false;
        }
        return resolve(key, wait, Result.CONFIRMED);
    }

    public boolean isWaiting(long chatId, long userId) {
        return pending.containsKey(key(chatId, userId));
    }

    private boolean resolve(String key, Pending wait, Result result) {
        synchronized (wait) {
            if (wait.resolved) {
                return false;
            }
            wait.resolved = true;
        }
        pending.remove(key, wait);
        log.debug("Confirmation {} resolved: {}", key, result);
        wait.onResult.accept(result);
        return true;
    }

    private static String key(long chatId, long userId) {
        return chatId + ":" + userId;
    }
}
