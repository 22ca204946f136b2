package com.communitybot.bot;

import com.communitybot.service.EscalationTracker;
import com.communitybot.service.MemberService;
import com.communitybot.service.MutableClock;
import com.communitybot.service.RecordingDeliveryListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.meta.api.methods.groupadministration.RestrictChatMember;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.MessageEntity;
import org.telegram.telegrambots.meta.api.objects.User;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AntiPingHandlerTest {
    private static final long CHAT = -100123L;
    private static final long LEAD = 1L;
    private static final long DEPUTY = 2L;
    private static final long AUTHOR = 50L;

    private MutableClock clock;
    private RecordingSender sender;
    private RecordingDeliveryListener deliveries;
    private AntiPingHandler handler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        sender = new RecordingSender();
        deliveries = new RecordingDeliveryListener();
        MemberService members = new MemberService(Map.of("slt", Set.of(LEAD), "alt", Set.of(DEPUTY)), clock);
        members.remember(LEAD, "lead", "Lead");
        members.remember(DEPUTY, "deputy", "Deputy");
        handler = new AntiPingHandler(sender, new EscalationTracker(), members, Set.of("slt", "alt"), clock, deliveries);
    }

    private static MessageEntity mention(int offset, int length) {
        MessageEntity e = new MessageEntity();
        e.setType("mention");
        e.setOffset(offset);
        e.setLength(length);
        return e;
    }

    private static Message message(String text, MessageEntity... entities) {
        User from = new User();
        from.setId(AUTHOR);
        from.setFirstName("Rex");
        from.setUserName("rex");
        from.setIsBot(false);
        Chat chat = new Chat();
        chat.setId(CHAT);
        chat.setType("supergroup");
        Message m = new Message();
        m.setMessageId(7);
        m.setFrom(from);
        m.setChat(chat);
        m.setText(text);
        m.setEntities(List.of(entities));
        return m;
    }

    @Test
    void first_offense_warns() {
        assertTrue(handler.onMessage(message("@lead help", mention(0, 5))));

        assertEquals(List.of("Heya @rex, please avoid pinging the SLT and ALT.. If you do so one more time, "
                + "you will be timed out. Thanks!"), sender.texts());
        assertTrue(sender.sentOf(RestrictChatMember.class).isEmpty());
    }

    @Test
    void second_offense_times_out_for_base_minutes() {
        handler.onMessage(message("@lead help", mention(0, 5)));
        clock.advance(Duration.ofHours(1));

        handler.onMessage(message("@deputy again", mention(0, 7)));

        List<RestrictChatMember> restricts = sender.sentOf(RestrictChatMember.class);
        assertEquals(1, restricts.size());
        assertEquals(AUTHOR, restricts.get(0).getUserId());
        assertEquals((int) clock.instant().plus(Duration.ofMinutes(5)).getEpochSecond(), restricts.get(0).getUntilDate());
        assertFalse(restricts.get(0).getPermissions().getCanSendMessages());
        assertEquals("@rex has been timed out for 5 minute(s) for pinging SLT/ALT again.",
                sender.texts().get(1));
    }

    @Test
    void mentioning_several_protected_members_is_one_offense() {
        handler.onMessage(message("@lead @deputy", mention(0, 5), mention(6, 7)));
        assertTrue(sender.sentOf(RestrictChatMember.class).isEmpty());
        assertEquals(1, sender.texts().size());
    }

    @Test
    void caption_mentions_on_media_count_as_an_offense() {
        Message photo = message(null);
        photo.setEntities(null);
        photo.setCaption("@lead look at this");
        photo.setCaptionEntities(List.of(mention(0, 5)));

        assertTrue(handler.onMessage(photo));
        assertEquals(1, sender.texts().size());
        assertTrue(sender.texts().get(0).startsWith("Heya @rex"));
    }

    @Test
    void unprotected_mentions_are_ignored() {
        assertFalse(handler.onMessage(message("@someone hi", mention(0, 8))));
        assertFalse(handler.onMessage(message("no mentions")));
        assertTrue(sender.sent.isEmpty());
    }

    @Test
    void missing_rights_still_counts_the_strike() {
        sender.failing = RestrictChatMember.class;
        handler.onMessage(message("@lead", mention(0, 5)));
        handler.onMessage(message("@lead", mention(0, 5)));
        handler.onMessage(message("@lead", mention(0, 5)));

        assertEquals("Timeout escalation would be 10 minute(s), but I lack permission.", sender.texts().get(2));
        assertEquals(2, deliveries.failures.size());
        assertEquals("antiping.timeout", deliveries.failures.get(0).getOperation());
    }
}
