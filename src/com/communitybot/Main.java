package com.communitybot;

import com.communitybot.bot.AntiPingHandler;
import com.communitybot.bot.CommunityBot;
import com.communitybot.bot.PollInteractions;
import com.communitybot.bot.StaffCommands;
import com.communitybot.bot.TelegramPollPresenter;
import com.communitybot.bot.TelegramReplies;
import com.communitybot.bot.TelegramSurfaces;
import com.communitybot.bot.TicketInteractions;
import com.communitybot.bot.TranscriptRecorder;
import com.communitybot.client.UptimePinger;
import com.communitybot.config.BotConfig;
import com.communitybot.service.ClaimEligibility;
import com.communitybot.service.CommandCooldowns;
import com.communitybot.service.ConfirmationGate;
import com.communitybot.service.DeliveryListener;
import com.communitybot.service.EscalationTracker;
import com.communitybot.service.EventLoop;
import com.communitybot.service.LoggingDeliveryListener;
import com.communitybot.service.MemberService;
import com.communitybot.service.PollService;
import com.communitybot.service.TicketService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.api.methods.GetMe;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

import java.time.Clock;

/**
 * Application entry point.
 * - Loads the configuration and wires services, handlers and the Telegram bot.
 * - Starts the uptime pinger when UPTIME_URL is set.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        log.info("Community bot starting...");

        BotConfig config = BotConfig.load();
        Clock clock = Clock.systemUTC();
        EventLoop loop = new EventLoop(clock);
        DeliveryListener deliveries = new LoggingDeliveryListener();

        // === Services (in-memory) ===
        MemberService members = new MemberService(config.roles, clock);
        ConfirmationGate confirmations = new ConfirmationGate(loop);
        EscalationTracker escalation = new EscalationTracker(
                config.strikeWindow, config.timeoutBaseMinutes, config.timeoutMaxMinutes);

        CommandCooldowns cooldowns = new CommandCooldowns(config.testCooldown, clock);

        CommunityBot bot = new CommunityBot(config, loop, clock, members, confirmations, cooldowns);
        User me = bot.execute(new GetMe());

        PollService polls = new PollService(new TelegramPollPresenter(bot, clock), loop, clock, deliveries);
        TelegramSurfaces surfaces = new TelegramSurfaces(bot, new TranscriptRecorder(), members, clock,
                me.getId(), me.getFirstName());
        TicketService tickets = new TicketService(config.ticketCategories,
                new ClaimEligibility(config.claimAllRoles), surfaces, config.archiveChatId, clock, deliveries);
        log.info("Services initialized ({} ticket categories, {} roles).",
                config.ticketCategories.size(), config.roles.size());

        // === Handlers ===
        bot.setPolls(new PollInteractions(new TelegramReplies(bot), polls, members));
        bot.setTickets(new TicketInteractions(bot, tickets, surfaces, members));
        bot.setAntiPing(new AntiPingHandler(bot, escalation, members, config.protectedRoles, clock, deliveries));
        bot.setStaffCommands(new StaffCommands(bot, config, members));
        bot.setShutdownAction(() -> new Thread(() -> System.exit(0), "shutdown").start());

        // === Start Telegram Bot ===
        TelegramBotsApi botsApi = new TelegramBotsApi(DefaultBotSession.class);
        botsApi.registerBot(bot);
        log.info("Telegram bot @{} registered.", config.botUsername);

        UptimePinger pinger = null;
        if (config.uptimeUrl != null) {
            pinger = new UptimePinger(config.uptimeUrl);
            loop.every(UptimePinger.INTERVAL, pinger::ping);
            log.info("Uptime pinger scheduled every {} minutes.", UptimePinger.INTERVAL.toMinutes());
        }

        UptimePinger pingerToStop = pinger;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            loop.shutdown();
            if (pingerToStop != null) {
                pingerToStop.shutdown();
            }
            log.info("Shutdown complete.");
        }));
    }
}
