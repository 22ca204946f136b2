package com.communitybot.bot;

import com.communitybot.model.SurfaceHandle;
import com.communitybot.model.TicketCategory;
import com.communitybot.model.TranscriptLine;
import com.communitybot.service.ConversationSurfaces;
import com.communitybot.service.MemberService;
import com.communitybot.service.PlatformException;
import org.telegram.telegrambots.meta.api.methods.forum.CreateForumTopic;
import org.telegram.telegrambots.meta.api.methods.forum.DeleteForumTopic;
import org.telegram.telegrambots.meta.api.methods.send.SendDocument;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.forum.ForumTopic;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ticket surfaces as forum topics. A forum topic is visible to the whole supergroup, so the
 * restriction to opener and staff is enforced here: {@link #isAllowed} decides whose messages
 * the bot keeps in the topic.
 */
public class TelegramSurfaces implements ConversationSurfaces {
    private static final int MAX_CAPTION = 1024;

    private static final class Access {
        final Set<Long> participants;
        final Set<String> roles;

        Access(Set<Long> participants, Set<String> roles) {
            this.participants = Collections.unmodifiableSet(new LinkedHashSet<>(participants));
            this.roles = Collections.unmodifiableSet(new LinkedHashSet<>(roles));
        }
    }

    private final AbsSender sender;
    private final TranscriptRecorder recorder;
    private final MemberService members;
    private final Clock clock;
    private final long botId;
    private final String botName;
    private final Map<SurfaceHandle, Access> access = new ConcurrentHashMap<>();

    public TelegramSurfaces(AbsSender sender, TranscriptRecorder recorder, MemberService members, Clock clock,
                            long botId, String botName) {
        this.sender = sender;
        this.recorder = recorder;
        this.members = members;
        this.clock = clock;
        this.botId = botId;
        this.botName = botName;
    }

    @Override
    public SurfaceHandle createRestrictedSurface(TicketCategory category, String name, Set<Long> participants,
                                                 Set<String> roleAllowList) throws PlatformException {
        if (category.chatId == 0) {
            throw new PlatformException("Ticket category '" + category.key + "' has no chatId configured");
        }
        CreateForumTopic create = CreateForumTopic.builder()
                .chatId(String.valueOf(category.chatId))
                .name(name)
                .build();
        try {
            ForumTopic topic = sender.execute(create);
            SurfaceHandle surface = new SurfaceHandle(category.chatId, topic.getMessageThreadId(), name);
            access.put(surface, new Access(participants, roleAllowList));
            recorder.open(surface);
            return surface;
        } catch (TelegramApiException e) {
            throw new PlatformException("Could not create topic '" + name + "': " + e.getMessage(), e);
        }
    }

    @Override
    public List<TranscriptLine> fetchHistory(SurfaceHandle surface) throws PlatformException {
        return recorder.lines(surface)
                .orElseThrow(() -> new PlatformException("No history recorded for " + surface));
    }

    @Override
    public void postArchive(long destinationChatId, String fileName, String transcript, String caption)
            throws PlatformException {
        if (destinationChatId == 0) {
            throw new PlatformException("archiveChatId is not configured");
        }
        byte[] bytes = transcript.getBytes(StandardCharsets.UTF_8);
        SendDocument doc = SendDocument.builder()
                .chatId(String.valueOf(destinationChatId))
                .document(new InputFile(new ByteArrayInputStream(bytes), fileName))
                .caption(caption.length() > MAX_CAPTION ? caption.substring(0, MAX_CAPTION - 3) + "..." : caption)
                .build();
        try {
            sender.execute(doc);
        } catch (TelegramApiException e) {
            throw new PlatformException("Could not archive " + fileName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void notifyMember(long memberId, String text) throws PlatformException {
        SendMessage msg = new SendMessage();
        msg.setChatId(String.valueOf(memberId));
        msg.setText(text);
        try {
            sender.execute(msg);
        } catch (TelegramApiException e) {
            throw new PlatformException("Could not message member " + memberId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void destroy(SurfaceHandle surface) throws PlatformException {
        DeleteForumTopic delete = DeleteForumTopic.builder()
                .chatId(String.valueOf(surface.chatId))
                .messageThreadId(surface.threadId)
                .build();
        try {
            sender.execute(delete);
        } catch (TelegramApiException e) {
            throw new PlatformException("Could not delete topic " + surface + ": " + e.getMessage(), e);
        } finally {
            access.remove(surface);
            recorder.discard(surface);
        }
    }

    /**
     * Posts into a ticket topic and records the bot's own message in the transcript.
     */
    public Message post(SurfaceHandle surface, String text, ReplyKeyboard markup) throws PlatformException {
        return post(surface, text, markup, null);
    }

    /**
     * @param replyToMessageId message in the topic the post answers, or null
     */
    public Message post(SurfaceHandle surface, String text, ReplyKeyboard markup, Integer replyToMessageId)
            throws PlatformException {
        SendMessage msg = new SendMessage();
        msg.setChatId(String.valueOf(surface.chatId));
        msg.setMessageThreadId(surface.threadId);
        msg.setText(text);
        msg.setReplyMarkup(markup);
        msg.setReplyToMessageId(replyToMessageId);
        try {
            Message sent = sender.execute(msg);
            recorder.record(surface, new TranscriptLine(clock.instant(), botId, botName, text));
            return sent;
        } catch (TelegramApiException e) {
            throw new PlatformException("Could not post in " + surface + ": " + e.getMessage(), e);
        }
    }

    public boolean isAllowed(SurfaceHandle surface, long userId) {
        Access entry = access.get(surface);
        if (entry == null) {
            return false;
        }
        return entry.participants.contains(userId) || members.hasAnyRole(userId, entry.roles);
    }

    public void record(SurfaceHandle surface, TranscriptLine line) {
        recorder.record(surface, line);
    }
}
