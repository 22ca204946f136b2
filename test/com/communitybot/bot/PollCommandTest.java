package com.communitybot.bot;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PollCommandTest {

    @Test
    void parses_question_options_and_settings() {
        PollCommand cmd = PollCommand.parseCreate("Pizza or Tacos? | Pizza | Tacos | duration=3 | title=Lunch | role=members");

        assertEquals("Pizza or Tacos?", cmd.question);
        assertEquals(List.of("Pizza", "Tacos"), cmd.options);
        assertEquals(3, cmd.durationHours);
        assertEquals("Lunch", cmd.title);
        assertNull(cmd.footer);
        assertEquals("members", cmd.voterRole);
    }

    @Test
    void defaults_to_one_hour_and_skips_blank_segments() {
        PollCommand cmd = PollCommand.parseCreate("Q |  | a | b |");
        assertEquals(1, cmd.durationHours);
        assertEquals(List.of("a", "b"), cmd.options);
    }

    @Test
    void settings_are_case_insensitive() {
        PollCommand cmd = PollCommand.parseCreate("Q | a | b | Footer = See you there");
        assertEquals("See you there", cmd.footer);
    }

    @Test
    void option_count_is_left_to_the_service() {
        PollCommand cmd = PollCommand.parseCreate("Q | only");
        assertEquals(List.of("only"), cmd.options);
    }

    @Test
    void rejects_missing_question_and_bad_duration() {
        IllegalArgumentException empty = assertThrows(IllegalArgumentException.class, () -> PollCommand.parseCreate(""));
        assertEquals(PollCommand.CREATE_USAGE, empty.getMessage());

        IllegalArgumentException bad = assertThrows(IllegalArgumentException.class,
                () -> PollCommand.parseCreate("Q | a | b | duration=two"));
        assertEquals("Duration must be a whole number of hours.", bad.getMessage());
    }

    @Test
    void parses_close_with_overrides() {
        PollCommand cmd = PollCommand.parseClose("k3x9a1 | footer=Tacos it is | role=staff");
        assertEquals("k3x9a1", cmd.pollId);
        assertEquals("Tacos it is", cmd.footer);
        assertEquals("staff", cmd.voterRole);
        assertNull(cmd.title);
    }

    @Test
    void close_requires_exactly_one_id_and_no_duration() {
        assertThrows(IllegalArgumentException.class, () -> PollCommand.parseClose(""));
        assertThrows(IllegalArgumentException.class, () -> PollCommand.parseClose("a | b"));
        assertThrows(IllegalArgumentException.class, () -> PollCommand.parseClose("a | duration=2"));
    }
}
