package com.communitybot.service;

import com.communitybot.model.PollHandle;
import com.communitybot.model.PollSnapshot;

/**
 * Draws polls on the chat platform. Implementations hold no poll state; every call
 * receives the full snapshot to project.
 */
public interface PollPresenter {
    PollHandle renderPoll(PollSnapshot poll) throws PlatformException;

    void updatePoll(PollHandle handle, PollSnapshot poll) throws PlatformException;

    void disableInteraction(PollHandle handle) throws PlatformException;
}
