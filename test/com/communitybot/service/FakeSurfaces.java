package com.communitybot.service;

import com.communitybot.model.SurfaceHandle;
import com.communitybot.model.TicketCategory;
import com.communitybot.model.TranscriptLine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory conversation surfaces with call counters and per-step failure switches.
 */
public class FakeSurfaces implements ConversationSurfaces {
    public static class Archive {
        public final long chatId;
        public final String fileName;
        public final String transcript;
        public final String caption;

        Archive(long chatId, String fileName, String transcript, String caption) {
            this.chatId = chatId;
            this.fileName = fileName;
            this.transcript = transcript;
            this.caption = caption;
        }
    }

    public final Map<SurfaceHandle, List<TranscriptLine>> open = new LinkedHashMap<>();
    public final List<Set<Long>> participants = new ArrayList<>();
    public final List<Set<String>> allowedRoles = new ArrayList<>();
    public final List<Archive> archives = new ArrayList<>();
    public final List<String> notices = new ArrayList<>();
    public final List<Long> noticeRecipients = new ArrayList<>();
    public final List<SurfaceHandle> destroyed = new ArrayList<>();
    public int historyFetches;

    public boolean failCreate;
    public boolean failHistory;
    public boolean failArchive;
    public boolean failNotify;
    public boolean failDestroy;

    private int nextThreadId = 1;

    @Override
    public SurfaceHandle createRestrictedSurface(TicketCategory category, String name, Set<Long> participants,
                                                 Set<String> roleAllowList) throws PlatformException {
        if (failCreate) {
            throw new PlatformException("not enough rights to create a topic");
        }
        SurfaceHandle handle = new SurfaceHandle(category.chatId, nextThreadId++, name);
        open.put(handle, new ArrayList<>());
        this.participants.add(participants);
        this.allowedRoles.add(roleAllowList);
        return handle;
    }

    @Override
    public List<TranscriptLine> fetchHistory(SurfaceHandle surface) throws PlatformException {
        historyFetches++;
        if (failHistory) {
            throw new PlatformException("history unavailable");
        }
        List<TranscriptLine> lines = open.get(surface);
        if (lines == null) {
            throw new PlatformException("unknown surface " + surface);
        }
        return new ArrayList<>(lines);
    }

    @Override
    public void postArchive(long destinationChatId, String fileName, String transcript, String caption)
            throws PlatformException {
        if (failArchive) {
            throw new PlatformException("archive chat not found");
        }
        archives.add(new Archive(destinationChatId, fileName, transcript, caption));
    }

    @Override
    public void notifyMember(long memberId, String text) throws PlatformException {
        if (failNotify) {
            throw new PlatformException("bot was blocked by the user");
        }
        noticeRecipients.add(memberId);
        notices.add(text);
    }

    @Override
    public void destroy(SurfaceHandle surface) throws PlatformException {
        if (failDestroy) {
            throw new PlatformException("topic not found");
        }
        open.remove(surface);
        destroyed.add(surface);
    }

    public void say(SurfaceHandle surface, TranscriptLine line) {
        open.get(surface).add(line);
    }
}
