package com.communitybot.service;

import com.communitybot.model.SurfaceHandle;
import com.communitybot.model.TicketCategory;
import com.communitybot.model.TranscriptLine;

import java.util.List;
import java.util.Set;

/**
 * Platform operations the ticket workflow needs.
 */
public interface ConversationSurfaces {

    /**
     * Creates a conversation visible only to {@code participants} and members holding a role in {@code roleAllowList}.
     */
    SurfaceHandle createRestrictedSurface(TicketCategory category, String name, Set<Long> participants,
                                          Set<String> roleAllowList) throws PlatformException;

    /** Messages of the surface, oldest first. */
    List<TranscriptLine> fetchHistory(SurfaceHandle surface) throws PlatformException;

    void postArchive(long destinationChatId, String fileName, String transcript, String caption) throws PlatformException;

    void notifyMember(long memberId, String text) throws PlatformException;

    void destroy(SurfaceHandle surface) throws PlatformException;
}
