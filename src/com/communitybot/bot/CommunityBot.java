package com.communitybot.bot;

import com.communitybot.config.BotConfig;
import com.communitybot.service.CommandCooldowns;
import com.communitybot.service.ConfirmationGate;
import com.communitybot.service.MemberService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.groupadministration.GetChat;
import org.telegram.telegrambots.meta.api.methods.groupadministration.GetChatMemberCount;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Executor;

/**
 * Telegram bot implementation:
 * - welcomes new members and answers the trigger phrase
 * - enforces the anti-ping rule on group messages, captions included
 * - routes /poll, /closepoll and vote buttons to {@link PollInteractions}
 * - routes /ticketpanel, ticket buttons and ticket topic traffic to {@link TicketInteractions}
 * - routes /promote, /infractions, /update and /stafffeedback to {@link StaffCommands}
 * - /test and /welcometest post a sample welcome, under a per-member cooldown
 * - master-only controls: /pause, /resume, /shutdown
 *
 * Every update is handed to the event loop, so handlers never run concurrently.
 */
public class CommunityBot extends TelegramLongPollingBot {
    private static final Logger log = LoggerFactory.getLogger(CommunityBot.class);

    static final String SHUTDOWN_PHRASE = "CONFIRM DELETE";
    static final Duration SHUTDOWN_CONFIRM_WINDOW = Duration.ofSeconds(15);
    static final String PAUSED_ANSWER = "Bot is currently paused and not accepting votes.";

    private final BotConfig config;
    private final Executor loop;
    private final Clock clock;
    private final MemberService members;
    private final ConfirmationGate confirmations;
    private final CommandCooldowns cooldowns;
    private final TelegramReplies replies;

    private PollInteractions polls;
    private TicketInteractions tickets;
    private AntiPingHandler antiPing;
    private StaffCommands staff;
    private Runnable shutdownAction = () -> log.warn("No shutdown action configured");

    private volatile boolean paused;

    public CommunityBot(BotConfig config, Executor loop, Clock clock, MemberService members,
                        ConfirmationGate confirmations, CommandCooldowns cooldowns) {
        super(config.botToken);
        this.config = config;
        this.loop = loop;
        this.clock = clock;
        this.members = members;
        this.confirmations = confirmations;
        this.cooldowns = cooldowns;
        this.replies = new TelegramReplies(this);
    }

    public void setPolls(PollInteractions polls) {
        this.polls = polls;
    }

    public void setTickets(TicketInteractions tickets) {
        this.tickets = tickets;
    }

    public void setAntiPing(AntiPingHandler antiPing) {
        this.antiPing = antiPing;
    }

    public void setStaffCommands(StaffCommands staff) {
        this.staff = staff;
    }

    public void setShutdownAction(Runnable shutdownAction) {
        this.shutdownAction = shutdownAction;
    }

    @Override
    public String getBotUsername() {
        return config.botUsername;
    }

    @Override
    public void onUpdateReceived(Update update) {
        loop.execute(() -> handle(update));
    }

    private void handle(Update update) {
        try {
            if (update.hasMessage()) {
                onMessage(update.getMessage());
            } else if (update.hasCallbackQuery()) {
                onCallback(update.getCallbackQuery());
            }
        } catch (RuntimeException ex) {
            log.error("Failed to handle update {}", update.getUpdateId(), ex);
        }
    }

    private void onMessage(Message m) {
        if (m.getNewChatMembers() != null && !m.getNewChatMembers().isEmpty()) {
            welcome(m);
            return;
        }
        User from = m.getFrom();
        if (from == null || Boolean.TRUE.equals(from.getIsBot())) {
            return;
        }
        members.remember(from.getId(), from.getUserName(), TicketInteractions.nameOf(from));
        boolean master = isMaster(from.getId());
        String text = m.hasText() ? m.getText() : null;

        // Answered even while paused
        if (text != null && isTriggerPhrase(text)) {
            replies.reply(m, master ? "thank you master"
                    : "you are not my master, " + members.displayNameOf(config.masterUserId));
            return;
        }
        if (paused && !master) {
            return;
        }
        if (tickets.onMessage(m)) {
            return;
        }
        if (text != null && confirmations.offer(m.getChatId(), from.getId(), text)) {
            return;
        }
        if (m.isGroupMessage() || m.isSuperGroupMessage()) {
            antiPing.onMessage(m);
        }
        if (text == null) {
            return;
        }

        CommandLine cmd = CommandLine.parse(text, config.botUsername);
        if (cmd != null) {
            onCommand(m, cmd, master);
        }
    }

    private void onCommand(Message m, CommandLine cmd, boolean master) {
        long userId = m.getFrom().getId();
        switch (cmd.name) {
            case "ping":
                long latency = Math.max(0, clock.millis() - m.getDate() * 1000L);
                replies.reply(m, "Pong: " + latency + " ms");
                break;
            case "poll":
                polls.onCreateCommand(m, cmd.args);
                break;
            case "closepoll":
                polls.onCloseCommand(m, cmd.args);
                break;
            case "ticketpanel":
                tickets.postPanel(m.getChatId(), m.getMessageThreadId());
                break;
            case "promote":
                staff.onPromote(m, cmd.args);
                break;
            case "infractions":
                staff.onInfraction(m, cmd.args);
                break;
            case "update":
                staff.onUpdate(m, cmd.args);
                break;
            case "stafffeedback":
                staff.onStaffFeedback(m, cmd.args);
                break;
            case "test":
                sendTestWelcome(m, "Test welcome message sent successfully!");
                break;
            case "welcometest":
                sendTestWelcome(m, "Welcome test message sent successfully!");
                break;
            case "pause":
                if (requireMaster(m, master)) {
                    paused = true;
                    log.info("Bot paused by {}", userId);
                    replies.reply(m, "Bot is now paused. Only the master can interact.");
                }
                break;
            case "resume":
                if (requireMaster(m, master)) {
                    paused = false;
                    log.info("Bot resumed by {}", userId);
                    replies.reply(m, "Bot has resumed normal operation.");
                }
                break;
            case "shutdown":
                if (requireMaster(m, master)) {
                    askShutdown(m);
                }
                break;
            default:
                log.debug("Ignoring unknown command /{}", cmd.name);
        }
    }

    private void askShutdown(Message m) {
        long chatId = m.getChatId();
        replies.reply(m, "Type " + SHUTDOWN_PHRASE + " within "
                + SHUTDOWN_CONFIRM_WINDOW.getSeconds() + " seconds to shut the bot down.");
        confirmations.await(chatId, m.getFrom().getId(), SHUTDOWN_PHRASE, SHUTDOWN_CONFIRM_WINDOW, result -> {
            if (result == ConfirmationGate.Result.CONFIRMED) {
                replies.send(chatId, m.getMessageThreadId(), "Confirmed. Shutting down now.");
                log.info("Shutdown confirmed by {}", m.getFrom().getId());
                shutdownAction.run();
            } else {
                replies.send(chatId, m.getMessageThreadId(), "Confirmation not received. Aborted.");
            }
        });
    }

    private void onCallback(CallbackQuery cb) {
        User from = cb.getFrom();
        members.remember(from.getId(), from.getUserName(), TicketInteractions.nameOf(from));
        if (paused && !isMaster(from.getId())) {
            replies.answer(cb.getId(), PAUSED_ANSWER);
            return;
        }
        String data = cb.getData() == null ? "" : cb.getData();
        if (data.startsWith(PollRenderer.CALLBACK_PREFIX)) {
            polls.onVote(cb);
        } else if (data.startsWith(TicketInteractions.CALLBACK_PREFIX)) {
            tickets.onCallback(cb);
        } else {
            replies.answer(cb.getId(), null);
        }
    }

    private void welcome(Message m) {
        for (User joined : m.getNewChatMembers()) {
            if (!Boolean.TRUE.equals(joined.getIsBot())) {
                members.remember(joined.getId(), joined.getUserName(), TicketInteractions.nameOf(joined));
            }
        }
        if (config.welcomeChatId == 0 || m.getChatId() != config.welcomeChatId) {
            return;
        }
        String chatTitle = m.getChat().getTitle() == null ? "the community" : m.getChat().getTitle();
        Integer count = memberCount(m.getChatId());
        for (User joined : m.getNewChatMembers()) {
            if (Boolean.TRUE.equals(joined.getIsBot())) {
                continue;
            }
            replies.send(m.getChatId(), m.getMessageThreadId(), welcomeText(joined, chatTitle, count));
        }
    }

    // /test and /welcometest: the caller's own welcome, posted to the welcome chat
    private void sendTestWelcome(Message m, String done) {
        long wait = cooldowns.tryStart(m.getFrom().getId());
        if (wait > 0) {
            replies.reply(m, "Please wait " + wait + " more seconds before using this command again.");
            return;
        }
        if (config.welcomeChatId == 0) {
            replies.reply(m, "Welcome channel not found.");
            return;
        }
        long chatId = config.welcomeChatId;
        String title = chatId == m.getChatId() ? m.getChat().getTitle() : chatTitle(chatId);
        String text = welcomeText(m.getFrom(), title == null ? "the community" : title, memberCount(chatId));
        replies.send(chatId, null, text);
        replies.reply(m, done);
    }

    static String welcomeText(User joined, String chatTitle, Integer memberCount) {
        String text = "WELCOME!\nWelcome " + TicketInteractions.nameOf(joined) + " to " + chatTitle
                + "! We hope you enjoy your stay here!";
        if (memberCount != null) {
            text += "\n\nMember Count: " + memberCount;
        }
        return text;
    }

    private String chatTitle(long chatId) {
        try {
            Chat chat = execute(GetChat.builder().chatId(String.valueOf(chatId)).build());
            return chat == null ? null : chat.getTitle();
        } catch (TelegramApiException e) {
            log.warn("Could not read chat {}: {}", chatId, e.getMessage());
            return null;
        }
    }

    private Integer memberCount(long chatId) {
        try {
            return execute(GetChatMemberCount.builder().chatId(String.valueOf(chatId)).build());
        } catch (TelegramApiException e) {
            log.warn("Could not read member count of chat {}: {}", chatId, e.getMessage());
            return null;
        }
    }

    private boolean requireMaster(Message m, boolean master) {
        if (!master) {
            replies.reply(m, "Only the bot master can use this command.");
        }
        return master;
    }

    private boolean isMaster(long userId) {
        return config.masterUserId != 0 && config.masterUserId == userId;
    }

    private boolean isTriggerPhrase(String text) {
        return config.triggerPhrase != null && !config.triggerPhrase.isBlank()
                && text.toLowerCase(Locale.ROOT).contains(config.triggerPhrase.trim().toLowerCase(Locale.ROOT));
    }
}
