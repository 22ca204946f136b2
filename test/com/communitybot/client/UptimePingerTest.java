package com.communitybot.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UptimePingerTest {

    @Test
    void requires_a_url() {
        assertThrows(IllegalArgumentException.class, () -> new UptimePinger(null));
        assertThrows(IllegalArgumentException.class, () -> new UptimePinger("  "));
    }

    @Test
    void pings_every_five_minutes() {
        assertEquals(5, UptimePinger.INTERVAL.toMinutes());
    }
}
