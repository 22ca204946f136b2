package com.communitybot.service;

import com.communitybot.model.PollHandle;
import com.communitybot.model.PollSnapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * Presenter that keeps every call. Each kind of call can be made to fail.
 */
public class RecordingPresenter implements PollPresenter {
    public final List<PollSnapshot> rendered = new ArrayList<>();
    public final List<PollSnapshot> updates = new ArrayList<>();
    public final List<PollHandle> disabled = new ArrayList<>();

    public boolean failRender;
    public boolean failUpdate;
    public boolean failDisable;

    private int nextMessageId = 100;

    @Override
    public PollHandle renderPoll(PollSnapshot poll) throws PlatformException {
        if (failRender) {
            throw new PlatformException("chat not found");
        }
        rendered.add(poll);
        return new PollHandle(poll.getChatId(), nextMessageId++);
    }

    @Override
    public void updatePoll(PollHandle handle, PollSnapshot poll) throws PlatformException {
        if (failUpdate) {
            throw new PlatformException("message to edit not found");
        }
        updates.add(poll);
    }

    @Override
    public void disableInteraction(PollHandle handle) throws PlatformException {
        if (failDisable) {
            throw new PlatformException("message can't be edited");
        }
        disabled.add(handle);
    }

    public PollSnapshot lastUpdate() {
        return updates.isEmpty() ? null : updates.get(updates.size() - 1);
    }
}
