package com.communitybot.bot;

import com.communitybot.model.SurfaceHandle;
import com.communitybot.model.TranscriptLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the message history of open ticket topics. The Bot API has no way to read a chat's
 * history, so every message seen in a topic is appended here as it arrives. Only the first
 * {@value #MAX_LINES} messages of a topic are kept.
 */
public class TranscriptRecorder {
    static final int MAX_LINES = 1000;

    private final Map<SurfaceHandle, List<TranscriptLine>> transcripts = new ConcurrentHashMap<>();

    public void open(SurfaceHandle surface) {
        transcripts.putIfAbsent(surface, new ArrayList<>());
    }

    /**
     * @return false if the surface is not being recorded
     */
    public boolean record(SurfaceHandle surface, TranscriptLine line) {
        List<TranscriptLine> lines = transcripts.get(surface);
        if (lines == null) {
            return false;
        }
        synchronized (lines) {
            if (lines.size() < MAX_LINES) {
                lines.add(line);
            }
        }
        return true;
    }

    /** Oldest first; empty if the surface is not being recorded. */
    public Optional<List<TranscriptLine>> lines(SurfaceHandle surface) {
        List<TranscriptLine> lines = transcripts.get(surface);
        if (lines == null) {
            return Optional.empty();
        }
        synchronized (lines) {
            return Optional.of(new ArrayList<>(lines));
        }
    }

    public void discard(SurfaceHandle surface) {
        transcripts.remove(surface);
    }

    public boolean isRecording(SurfaceHandle surface) {
        return transcripts.containsKey(surface);
    }
}
