package com.communitybot.service;

import com.communitybot.model.Poll;
import com.communitybot.model.PollHandle;
import com.communitybot.model.PollSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * PollService:
 * - create button polls (2-10 options) and schedule their auto-close
 * - apply votes; a member holds exactly one live vote and may switch it
 * - close polls manually or on timer, exactly once
 * - re-render the poll after every change through the {@link PollPresenter}
 *
 * State lives in memory only. Mutations happen inside {@code synchronized} sections;
 * presentation calls are made after the section ends, so a racing caller always sees
 * the committed state before any outbound I/O starts.
 */
public class PollService {
    private static final Logger log = LoggerFactory.getLogger(PollService.class);

    public static final int MIN_OPTIONS = 2;
    public static final int MAX_OPTIONS = 10;
    private static final int CLOSED_IDS_RETAINED = 1000;

    private final PollPresenter presenter;
    private final Scheduler scheduler;
    private final Clock clock;
    private final Deliveries deliveries;

    // In-memory storage
    private final Map<String, Poll> polls = new ConcurrentHashMap<>();
    // Ids of closed polls, so late clicks and repeated closes can be told apart from unknown ids
    private final Set<String> closedIds = Collections.newSetFromMap(new LinkedHashMap<String, Boolean>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > CLOSED_IDS_RETAINED;
        }
    });
    private final AtomicLong nextPollId;

    public PollService(PollPresenter presenter, Scheduler scheduler, Clock clock, DeliveryListener deliveryListener) {
        this.presenter = presenter;
        this.scheduler = scheduler;
        this.clock = clock;
        this.deliveries = new Deliveries(deliveryListener, clock);
        // Seeded from the clock so ids do not repeat across restarts while old poll messages still carry buttons
        this.nextPollId = new AtomicLong(clock.millis());
    }

    /**
     * Creates and publishes a poll. Durations below one hour are treated as one hour.
     * @param threadId forum topic the poll is posted in, null for the chat itself
     */
    public Outcome<PollSnapshot> createPoll(long chatId, Integer threadId, long issuerId, String question, List<String> options,
                                            int durationHours, String title, String footer, String voterRoleId) {
        // Validation: 2-10 options
        if (options == null || options.size() < MIN_OPTIONS || options.size() > MAX_OPTIONS) {
            return Outcome.failed(Failure.INVALID_OPTION_COUNT);
        }

        int hours = Math.max(1, durationHours);
        Instant now = clock.instant();

        Poll poll = new Poll();
        poll.id = Long.toString(nextPollId.getAndIncrement(), 36);
        poll.question = question;
        poll.title = title;
        poll.footer = footer;
        poll.options = new ArrayList<>(options);
        poll.tally = new int[options.size()];
        poll.createdAt = now;
        poll.endAt = now.plus(Duration.ofHours(hours));
        poll.ended = false;
        poll.voterRoleId = voterRoleId;
        poll.issuerId = issuerId;
        poll.chatId = chatId;
        poll.threadId = threadId;

        PollSnapshot snapshot = PollSnapshot.of(poll);
        try {
            poll.handle = presenter.renderPoll(snapshot);
        } catch (PlatformException | RuntimeException ex) {
            deliveries.report("poll.render", poll.id, ex);
            return Outcome.failed(Failure.POLL_NOT_PUBLISHED);
        }

        polls.put(poll.id, poll);
        scheduler.at(poll.endAt, () -> autoClose(poll.id));

        log.info("Poll {} created in chat {} with {} options, closes at {}", poll.id, chatId, options.size(), poll.endAt);
        return Outcome.ok(snapshot);
    }

    /**
     * Records {@code userId}'s choice. A previous choice of the same user is moved, not added to.
     */
    public Outcome<PollSnapshot> applyVote(String pollId, long userId, int optionIndex, Set<String> actorRoles) {
        PollSnapshot updated;
        PollHandle handle;
        synchronized (this) {
            Poll poll = polls.get(pollId);
            if (poll == null) {
                return Outcome.failed(closedIds.contains(pollId) ? Failure.POLL_ENDED : Failure.POLL_NOT_FOUND);
            }
            if (poll.ended) {
                return Outcome.failed(Failure.POLL_ENDED);
            }
            if (poll.voterRoleId != null && (actorRoles == null || !actorRoles.contains(poll.voterRoleId))) {
                return Outcome.failed(Failure.NOT_ELIGIBLE_TO_VOTE);
            }
            if (optionIndex < 0 || optionIndex >= poll.options.size()) {
                return Outcome.failed(Failure.INVALID_OPTION);
            }

            Integer previous = poll.voters.get(userId);
            if (previous != null && previous == optionIndex) {
                return Outcome.failed(Failure.ALREADY_VOTED_SAME_OPTION);
            }
            if (previous != null) {
                poll.tally[previous] = Math.max(0, poll.tally[previous] - 1);
            }
            poll.tally[optionIndex]++;
            poll.voters.put(userId, optionIndex);

            updated = PollSnapshot.of(poll);
            handle = poll.handle;
        }

        deliveries.attempt("poll.update", pollId, () -> presenter.updatePoll(handle, updated));
        return Outcome.ok(updated);
    }

    /**
     * Closes a poll exactly once. Overrides may be null. The returned snapshot is the final view.
     */
    public Outcome<PollSnapshot> closePoll(String pollId, String titleOverride, String footerOverride, String voterRoleOverride) {
        Poll poll;
        PollSnapshot finalView;
        synchronized (this) {
            poll = polls.get(pollId);
            if (poll == null) {
                return Outcome.failed(closedIds.contains(pollId) ? Failure.ALREADY_CLOSED : Failure.POLL_NOT_FOUND);
            }
            if (poll.ended) {
                return Outcome.failed(Failure.ALREADY_CLOSED);
            }
            if (voterRoleOverride != null) {
                poll.voterRoleId = voterRoleOverride;
            }
            poll.ended = true;
            closedIds.add(pollId);
            finalView = PollSnapshot.closing(poll, titleOverride, footerOverride);
        }

        // Final render; failures are logged and the poll stays closed and evicted
        PollHandle handle = poll.handle;
        deliveries.attempt("poll.render-final", pollId, () -> presenter.updatePoll(handle, finalView));
        deliveries.attempt("poll.disable", pollId, () -> presenter.disableInteraction(handle));
        polls.remove(pollId);

        log.info("Poll {} closed with {} vote(s)", pollId, finalView.totalVotes());
        return Outcome.ok(finalView);
    }

    // Timer callback. Not cancelled on manual close: the ended flag makes a late firing a no-op.
    private void autoClose(String pollId) {
        Poll poll = polls.get(pollId);
        if (poll == null || poll.ended) {
            log.debug("Auto-close of poll {} skipped, already closed", pollId);
            return;
        }
        Outcome<PollSnapshot> outcome = closePoll(pollId, null, null, null);
        if (!outcome.isOk()) {
            log.debug("Auto-close of poll {} lost the race: {}", pollId, outcome.getFailure());
        }
    }

    public Optional<PollSnapshot> findPoll(String pollId) {
        synchronized (this) {
            Poll poll = polls.get(pollId);
            return poll == null ? Optional.empty() : Optional.of(PollSnapshot.of(poll));
        }
    }

    public int activePollCount() {
        return polls.size();
    }
}
