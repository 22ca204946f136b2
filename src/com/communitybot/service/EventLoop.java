package com.communitybot.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded event loop:
 * - every inbound platform update is executed here, in arrival order
 * - scheduler callbacks (poll auto-close, confirmation timeouts) run on the same thread
 * - a task that throws is logged and the loop keeps running
 */
public class EventLoop implements Scheduler, Executor {
    private static final Logger log = LoggerFactory.getLogger(EventLoop.class);

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "community-bot-loop");
        t.setDaemon(false);
        return t;
    });
    private final Clock clock;

    public EventLoop(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void execute(Runnable task) {
        executor.execute(guarded(task));
    }

    @Override
    public void after(Duration delay, Runnable callback) {
        long millis = Math.max(0, delay.toMillis());
        executor.schedule(guarded(callback), millis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void at(Instant when, Runnable callback) {
        after(Duration.between(clock.instant(), when), callback);
    }

    /**
     * Periodic task, first run after one period.
     */
    public void every(Duration period, Runnable task) {
        long millis = period.toMillis();
        executor.scheduleAtFixedRate(guarded(task), millis, millis, TimeUnit.MILLISECONDS);
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException ex) {
                log.error("Event loop task failed: {}", ex.getMessage(), ex);
            }
        };
    }
}
