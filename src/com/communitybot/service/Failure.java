package com.communitybot.service;

/**
 * Every way an engine operation can be refused. Each failure belongs to one {@link Kind}
 * and carries the sentence shown privately to the member who triggered it.
 */
public enum Failure {
    INVALID_OPTION_COUNT(Kind.VALIDATION, "A poll needs between 2 and 10 options."),
    INVALID_OPTION(Kind.VALIDATION, "That option does not exist."),
    INVALID_CATEGORY(Kind.VALIDATION, "Invalid selection."),

    POLL_NOT_FOUND(Kind.NOT_FOUND, "Poll with that ID was not found or is already closed."),
    TICKET_NOT_FOUND(Kind.NOT_FOUND, "This ticket no longer exists."),

    POLL_ENDED(Kind.CONFLICT, "This poll has ended or does not exist."),
    ALREADY_CLOSED(Kind.CONFLICT, "That poll is already closed."),
    ALREADY_VOTED_SAME_OPTION(Kind.CONFLICT, "You have already voted for that option."),
    ALREADY_CLAIMED(Kind.CONFLICT, "This ticket is already claimed."),

    NOT_ELIGIBLE_TO_VOTE(Kind.ELIGIBILITY, "You are not allowed to vote in this poll."),
    NOT_ELIGIBLE(Kind.ELIGIBILITY, "You cannot claim this ticket."),
    NO_SURFACE_ACCESS(Kind.ELIGIBILITY, "You do not have access to this ticket."),

    SURFACE_CREATION_FAILED(Kind.DELIVERY, "Failed to create ticket. Please contact a staff member."),
    POLL_NOT_PUBLISHED(Kind.DELIVERY, "Could not post the poll in this chat.");

    public enum Kind {
        /** Bad input shape. */
        VALIDATION,
        /** Unknown id. */
        NOT_FOUND,
        /** Already satisfied: claimed, closed, same vote. */
        CONFLICT,
        /** Role or permission gate. */
        ELIGIBILITY,
        /** External I/O failed. */
        DELIVERY
    }

    private final Kind kind;
    private final String userMessage;

    Failure(Kind kind, String userMessage) {
        this.kind = kind;
        this.userMessage = userMessage;
    }

    public Kind getKind() {
        return kind;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
