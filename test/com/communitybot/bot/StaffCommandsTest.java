package com.communitybot.bot;

import com.communitybot.config.BotConfig;
import com.communitybot.service.MemberService;
import com.communitybot.service.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.DeleteMessage;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.User;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static com.communitybot.bot.UpdateFixtures.chat;
import static com.communitybot.bot.UpdateFixtures.message;
import static com.communitybot.bot.UpdateFixtures.user;
import static org.junit.jupiter.api.Assertions.*;

class StaffCommandsTest {
    private static final long GROUP = -100900L;

    private final User manager = user(1004L, "mgr", "Manager");
    private final User deputy = user(1003L, "deputy", "Deputy");
    private final User member = user(60L, "rex", "Rex");
    private final Chat group = chat(GROUP, "supergroup", "Central");

    private BotConfig config;
    private MemberService members;
    private RecordingSender sender;
    private StaffCommands commands;

    @BeforeEach
    void setUp() {
        config = ConfigFixtures.load();
        members = new MemberService(config.roles, new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
        for (User u : List.of(manager, deputy, member)) {
            members.remember(u.getId(), u.getUserName(), u.getFirstName());
        }
        sender = new RecordingSender();
        commands = new StaffCommands(sender, config, members);
    }

    private Message from(User user, String text) {
        return message(user, group, text);
    }

    @Test
    void promotion_moves_the_member_and_announces_it() {
        commands.onPromote(from(manager, "/promote"), "@deputy | alt | slt | Outstanding patrol reports");

        assertTrue(members.hasRole(deputy.getId(), "slt"));
        assertFalse(members.hasRole(deputy.getId(), "alt"));
        assertEquals("STAFF PROMOTION\n"
                + "The Community Standards team has decided to award you a promotion. Congratulations!\n\n"
                + "Staff Member: Deputy\n\nOld Rank: alt\n\nNew Rank: slt\n\n"
                + "Reason: Outstanding patrol reports\n\nIssued by Manager", sender.lastMessage().getText());
    }

    @Test
    void promotion_is_refused_without_permission_or_old_role() {
        commands.onPromote(from(member, "/promote"), "@deputy | alt | slt | because");
        assertEquals(StaffCommands.NO_PERMISSION, sender.lastMessage().getText());

        commands.onPromote(from(manager, "/promote"), "@rex | alt | slt | because");
        assertEquals("The user does not have the old role alt.", sender.lastMessage().getText());

        commands.onPromote(from(manager, "/promote"), "@deputy | alt | owner | because");
        assertEquals("Unknown role: owner", sender.lastMessage().getText());

        commands.onPromote(from(manager, "/promote"), "@deputy | alt");
        assertEquals(StaffCommands.PROMOTE_USAGE, sender.lastMessage().getText());

        assertEquals(Set.of("alt"), members.rolesOf(deputy.getId()));
    }

    @Test
    void infraction_is_posted_and_sent_to_the_member() {
        commands.onInfraction(from(manager, "/infractions"), "@rex | 3 | Fail RP in the city centre");

        List<SendMessage> sent = sender.sentOf(SendMessage.class);
        assertEquals("Infraction Issued\n\nUser: Rex\nPoints: 3\nReason: Fail RP in the city centre\n\n"
                + "Issued by Manager", sent.get(0).getText());
        assertEquals(String.valueOf(GROUP), sent.get(0).getChatId());
        assertEquals("60", sent.get(1).getChatId());
        assertEquals("You have received an infraction in Central.\nPoints: 3\nReason: Fail RP in the city centre",
                sent.get(1).getText());
    }

    @Test
    void infraction_notice_stands_when_the_member_cannot_be_messaged() {
        sender.failing = SendMessage.class;

        commands.onInfraction(from(manager, "/infractions"), "@rex | 1 | Spam");

        assertTrue(sender.sent.isEmpty());
        sender.failing = null;
        commands.onInfraction(from(manager, "/infractions"), "@rex | many | Spam");
        assertEquals("Points must be a whole number.", sender.lastMessage().getText());
    }

    @Test
    void infraction_needs_the_infraction_role() {
        commands.onInfraction(from(deputy, "/infractions"), "@rex | 1 | Spam");

        assertEquals(List.of(StaffCommands.NO_PERMISSION), sender.texts());
    }

    @Test
    void update_goes_to_the_announcement_chat() {
        commands.onUpdate(from(member, "/update"), "1.4 | New livery pack | https://img.example/a.png | https://img.example/b.png");

        List<SendMessage> sent = sender.sentOf(SendMessage.class);
        assertEquals("-100600", sent.get(0).getChatId());
        assertEquals("Update #1.4\n\nNew livery pack\n\nImage: https://img.example/a.png\n"
                + "Additional Image: https://img.example/b.png", sent.get(0).getText());
        assertEquals("Update announcement sent successfully!", sent.get(1).getText());
    }

    @Test
    void update_without_announcement_chat_is_refused() {
        config.announcementChatId = 0;

        commands.onUpdate(from(member, "/update"), "1.4 | New livery pack");

        assertEquals(List.of("Announcement channel not found."), sender.texts());
    }

    @Test
    void staff_feedback_is_kept_out_of_the_group() {
        Message command = from(member, "/stafffeedback @deputy | Very helpful | 5");

        commands.onStaffFeedback(command, "@deputy | Very helpful | 5");

        assertEquals(command.getMessageId(), sender.sentOf(DeleteMessage.class).get(0).getMessageId());
        List<SendMessage> sent = sender.sentOf(SendMessage.class);
        assertEquals("-100700", sent.get(0).getChatId());
        assertEquals("Staff Feedback\n\nStaff Member: Deputy\nRating: 5\nReview: Very helpful\n\n"
                + "Feedback submitted by Rex", sent.get(0).getText());
        assertEquals("60", sent.get(1).getChatId());
        assertEquals("Thank you for your feedback!", sent.get(1).getText());
    }

    @Test
    void segments_reject_blank_parts_and_keep_the_tail() {
        assertEquals(List.of("a", "b | c"), StaffCommands.segments("a | b | c", 2));
        assertTrue(StaffCommands.segments("a | | c", 3).isEmpty());
        assertTrue(StaffCommands.segments("  ", 3).isEmpty());
    }
}
