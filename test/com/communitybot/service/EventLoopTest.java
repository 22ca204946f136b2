package com.communitybot.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventLoopTest {
    private EventLoop loop;

    @BeforeEach
    void setUp() {
        loop = new EventLoop(Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        loop.shutdown();
    }

    @Test
    void failing_task_is_logged_and_the_loop_keeps_running() throws InterruptedException {
        CountDownLatch done = new CountDownLatch(1);

        loop.execute(() -> {
            throw new IllegalStateException("boom");
        });
        loop.execute(done::countDown);

        assertTrue(done.await(5, TimeUnit.SECONDS));
    }

    @Test
    void tasks_run_one_at_a_time_in_arrival_order() throws InterruptedException {
        List<String> seen = new CopyOnWriteArrayList<>();
        List<String> threads = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(3);
        for (String name : List.of("a", "b", "c")) {
            loop.execute(() -> {
                seen.add(name);
                threads.add(Thread.currentThread().getName());
                done.countDown();
            });
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("a", "b", "c"), seen);
        assertEquals(1, threads.stream().distinct().count());
        assertEquals("community-bot-loop", threads.get(0));
    }

    @Test
    void failing_timer_does_not_stop_later_timers() throws InterruptedException {
        CountDownLatch done = new CountDownLatch(1);

        loop.after(Duration.ofMillis(10), () -> {
            throw new IllegalStateException("timer boom");
        });
        loop.after(Duration.ofMillis(50), done::countDown);

        assertTrue(done.await(5, TimeUnit.SECONDS));
    }

    @Test
    void periodic_task_survives_its_own_failure() throws InterruptedException {
        CountDownLatch runs = new CountDownLatch(3);

        loop.every(Duration.ofMillis(20), () -> {
            runs.countDown();
            throw new IllegalStateException("periodic boom");
        });

        assertTrue(runs.await(5, TimeUnit.SECONDS));
    }
}
