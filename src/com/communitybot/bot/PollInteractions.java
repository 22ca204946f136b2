package com.communitybot.bot;

import com.communitybot.model.PollSnapshot;
import com.communitybot.service.Failure;
import com.communitybot.service.MemberService;
import com.communitybot.service.Outcome;
import com.communitybot.service.PollService;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;

/**
 * {@code /poll}, {@code /closepoll} and vote button presses.
 */
public class PollInteractions {
    private final TelegramReplies replies;
    private final PollService polls;
    private final MemberService members;

    public PollInteractions(TelegramReplies replies, PollService polls, MemberService members) {
        this.replies = replies;
        this.polls = polls;
        this.members = members;
    }

    public void onCreateCommand(Message message, String args) {
        PollCommand cmd;
        try {
            cmd = PollCommand.parseCreate(args);
        } catch (IllegalArgumentException e) {
            replies.reply(message, e.getMessage());
            return;
        }
        if (cmd.voterRole != null && !members.isKnownRole(cmd.voterRole)) {
            replies.reply(message, "Unknown role: " + cmd.voterRole);
            return;
        }

        Outcome<PollSnapshot> outcome = polls.createPoll(message.getChatId(), message.getMessageThreadId(), message.getFrom().getId(),
                cmd.question, cmd.options, cmd.durationHours, cmd.title, cmd.footer, cmd.voterRole);
        if (!outcome.isOk()) {
            replies.reply(message, outcome.getFailure() == Failure.INVALID_OPTION_COUNT
                    ? (cmd.options.size() < PollService.MIN_OPTIONS
                        ? "You must provide at least 2 options."
                        : "Maximum 10 options allowed.")
                    : outcome.getFailure().getUserMessage());
            return;
        }
        int hours = Math.max(1, cmd.durationHours);
        replies.reply(message, "Poll created — live results will update as people vote. Poll length: "
                + hours + " hour(s). Poll ID: " + outcome.getValue().getId());
    }

    public void onCloseCommand(Message message, String args) {
        PollCommand cmd;
        try {
            cmd = PollCommand.parseClose(args);
        } catch (IllegalArgumentException e) {
            replies.reply(message, e.getMessage());
            return;
        }
        if (cmd.voterRole != null && !members.isKnownRole(cmd.voterRole)) {
            replies.reply(message, "Unknown role: " + cmd.voterRole);
            return;
        }

        Outcome<PollSnapshot> outcome = polls.closePoll(cmd.pollId, cmd.title, cmd.footer, cmd.voterRole);
        if (!outcome.isOk()) {
            replies.reply(message, outcome.is(Failure.POLL_NOT_FOUND) || outcome.is(Failure.ALREADY_CLOSED)
                    ? "Poll with ID " + cmd.pollId + " not found or already closed."
                    : outcome.getFailure().getUserMessage());
            return;
        }
        replies.reply(message, "Poll " + cmd.pollId + " closed successfully.");
    }

    public void onVote(CallbackQuery cb) {
        PollRenderer.VoteClick click = PollRenderer.parseCallback(cb.getData());
        if (click == null) {
            // Malformed button data is dropped silently
            replies.answer(cb.getId(), null);
            return;
        }
        long userId = cb.getFrom().getId();
        Outcome<PollSnapshot> outcome = polls.applyVote(click.pollId, userId, click.optionIndex, members.rolesOf(userId));
        if (outcome.is(Failure.INVALID_OPTION)) {
            replies.answer(cb.getId(), null);
            return;
        }
        if (outcome.is(Failure.POLL_NOT_FOUND)) {
            replies.answer(cb.getId(), Failure.POLL_ENDED.getUserMessage());
            return;
        }
        if (!outcome.isOk()) {
            replies.answer(cb.getId(), outcome.getFailure().getUserMessage());
            return;
        }
        replies.answer(cb.getId(), "You voted for option " + (click.optionIndex + 1) + ".");
    }
}
