package com.communitybot.service;

import java.time.Instant;

/**
 * A side effect that failed after the engine had already committed its state change.
 * The state change stands; this value only records what did not reach the platform.
 */
public final class DeliveryFailure {
    private final String operation;
    private final String subjectId;
    private final String reason;
    private final Throwable cause;
    private final Instant at;

    public DeliveryFailure(String operation, String subjectId, Throwable cause, Instant at) {
        this.operation = operation;
        this.subjectId = subjectId;
        this.reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        this.cause = cause;
        this.at = at;
    }

    /** e.g. "poll.update", "ticket.archive". */
    public String getOperation() { return operation; }
    public String getSubjectId() { return subjectId; }
    public String getReason() { return reason; }
    public Throwable getCause() { return cause; }
    public Instant getAt() { return at; }

    @Override
    public String toString() {
        return operation + "[" + subjectId + "]: " + reason;
    }
}
