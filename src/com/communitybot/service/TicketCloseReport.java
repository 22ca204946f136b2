package com.communitybot.service;

import com.communitybot.model.Ticket;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * What happened while closing a ticket. The ticket is closed whatever the step results are.
 */
public final class TicketCloseReport {
    public enum Step { CAPTURE_TRANSCRIPT, ARCHIVE, NOTIFY_OPENER, DESTROY_SURFACE }

    private final Ticket ticket;
    private final int transcriptLines;
    private final Map<Step, DeliveryFailure> failures;

    TicketCloseReport(Ticket ticket, int transcriptLines, EnumMap<Step, DeliveryFailure> failures) {
        this.ticket = ticket;
        this.transcriptLines = transcriptLines;
        this.failures = Collections.unmodifiableMap(failures);
    }

    public Ticket getTicket() { return ticket; }
    public int getTranscriptLines() { return transcriptLines; }
    public Map<Step, DeliveryFailure> getFailures() { return failures; }

    public boolean isClean() {
        return failures.isEmpty();
    }

    public boolean failed(Step step) {
        return failures.containsKey(step);
    }
}
