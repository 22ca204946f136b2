package com.communitybot.service;

import com.communitybot.model.SurfaceHandle;
import com.communitybot.model.Ticket;
import com.communitybot.model.TicketCategory;
import com.communitybot.model.TranscriptLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TicketService:
 * - open a ticket in a configured category, on its own restricted conversation surface
 * - claim: first eligible claimer wins, no unclaim
 * - close: the ticket becomes terminal first, then transcript, archive, opener notice and
 *   surface removal run as independent best-effort steps
 */
public class TicketService {
    private static final Logger log = LoggerFactory.getLogger(TicketService.class);

    private static final DateTimeFormatter TRANSCRIPT_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final Map<String, TicketCategory> categories = new LinkedHashMap<>();
    private final ClaimEligibility eligibility;
    private final Set<String> staffRoles;
    private final ConversationSurfaces surfaces;
    private final long archiveChatId;
    private final Clock clock;
    private final Deliveries deliveries;

    // In-memory storage
    private final Map<String, Ticket> tickets = new ConcurrentHashMap<>();
    private final AtomicLong nextTicketId;

    public TicketService(List<TicketCategory> categories, ClaimEligibility eligibility, ConversationSurfaces surfaces,
                         long archiveChatId, Clock clock, DeliveryListener deliveryListener) {
        for (TicketCategory category : categories) {
            this.categories.put(category.key, category);
        }
        this.eligibility = eligibility;
        this.surfaces = surfaces;
        this.archiveChatId = archiveChatId;
        this.clock = clock;
        this.deliveries = new Deliveries(deliveryListener, clock);
        this.nextTicketId = new AtomicLong(clock.millis());

        // Staff who can see every ticket surface: claim-all roles plus every category's extra roles
        Set<String> staff = new LinkedHashSet<>(eligibility.getClaimAllRoles());
        for (TicketCategory category : categories) {
            staff.addAll(category.extraClaimRoles);
        }
        this.staffRoles = Collections.unmodifiableSet(staff);
    }

    /**
     * Opens a ticket. Nothing is stored unless the conversation surface was created.
     */
    public Outcome<Ticket> openTicket(long openerId, String openerName, String key) {
        TicketCategory category = key == null ? null : categories.get(key);
        if (category == null) {
            return Outcome.failed(Failure.INVALID_CATEGORY);
        }

        String name = surfaceName(openerName, key);
        SurfaceHandle surface;
        try {
            surface = surfaces.createRestrictedSurface(category, name, Set.of(openerId), staffRoles);
        } catch (PlatformException | RuntimeException ex) {
            deliveries.report("ticket.create-surface", key, ex);
            return Outcome.failed(Failure.SURFACE_CREATION_FAILED);
        }

        Ticket ticket = new Ticket();
        ticket.id = Long.toString(nextTicketId.getAndIncrement(), 36);
        ticket.key = key;
        ticket.openerId = openerId;
        ticket.openerName = openerName;
        ticket.surface = surface;
        ticket.openedAt = clock.instant();
        tickets.put(ticket.id, ticket);

        log.info("Ticket {} ({}) opened by {} in {}", ticket.id, key, openerId, surface);
        return Outcome.ok(copyOf(ticket));
    }

    public Outcome<Ticket> claimTicket(String ticketId, long actorId, Set<String> actorRoles) {
        synchronized (this) {
            Ticket ticket = tickets.get(ticketId);
            if (ticket == null) {
                return Outcome.failed(Failure.TICKET_NOT_FOUND);
            }
            if (ticket.isClaimed()) {
                return Outcome.failed(Failure.ALREADY_CLAIMED);
            }
            if (!eligibility.canClaim(categories.get(ticket.key), actorRoles)) {
                return Outcome.failed(Failure.NOT_ELIGIBLE);
            }
            ticket.claimedBy = actorId;
            log.info("Ticket {} claimed by {}", ticketId, actorId);
            return Outcome.ok(copyOf(ticket));
        }
    }

    /**
     * Closes a ticket. Any member with access to the surface may close; access is checked by the caller.
     * A second close of the same ticket fails with {@link Failure#TICKET_NOT_FOUND} and has no side effects.
     */
    public Outcome<TicketCloseReport> closeTicket(String ticketId, long closedById, String closedByName, String reason) {
        // Terminal from here on, whatever the steps below do
        Ticket ticket = tickets.remove(ticketId);
        if (ticket == null) {
            return Outcome.failed(Failure.TICKET_NOT_FOUND);
        }
        String cleanReason = reason == null || reason.isBlank() ? null : reason.trim();
        EnumMap<TicketCloseReport.Step, DeliveryFailure> failures = new EnumMap<>(TicketCloseReport.Step.class);

        // 1. Capture transcript
        List<TranscriptLine> history = Collections.emptyList();
        try {
            history = surfaces.fetchHistory(ticket.surface);
        } catch (PlatformException | RuntimeException ex) {
            failures.put(TicketCloseReport.Step.CAPTURE_TRANSCRIPT, deliveries.report("ticket.transcript", ticketId, ex));
        }
        String transcript = formatTranscript(history);

        // 2. Archive
        String caption = "Transcript for " + ticket.surface.name + " — Closed by " + closedByName
                + (cleanReason != null ? "\nReason: " + cleanReason : "");
        String fileName = ticket.surface.name + "-transcript.txt";
        record(failures, TicketCloseReport.Step.ARCHIVE, deliveries.attempt("ticket.archive", ticketId,
                () -> surfaces.postArchive(archiveChatId, fileName, transcript, caption)));

        // 3. Notify opener
        String notice = "Your ticket '" + ticket.surface.name + "' has been closed by " + closedByName + "."
                + (cleanReason != null ? " Reason: " + cleanReason : "");
        record(failures, TicketCloseReport.Step.NOTIFY_OPENER, deliveries.attempt("ticket.notify-opener", ticketId,
                () -> surfaces.notifyMember(ticket.openerId, notice)));

        // 4. Destroy surface
        record(failures, TicketCloseReport.Step.DESTROY_SURFACE, deliveries.attempt("ticket.destroy", ticketId,
                () -> surfaces.destroy(ticket.surface)));

        log.info("Ticket {} closed by {} ({} transcript lines, {} failed step(s))",
                ticketId, closedById, history.size(), failures.size());
        return Outcome.ok(new TicketCloseReport(ticket, history.size(), failures));
    }

    public Optional<Ticket> findTicket(String ticketId) {
        Ticket ticket = tickets.get(ticketId);
        return ticket == null ? Optional.empty() : Optional.of(copyOf(ticket));
    }

    public Optional<Ticket> findBySurface(long chatId, Integer threadId) {
        return tickets.values().stream()
                .filter(t -> t.surface.isAt(chatId, threadId))
                .findFirst()
                .map(TicketService::copyOf);
    }

    /**
     * The opener and every member holding a staff role may use a ticket's surface.
     */
    public boolean hasSurfaceAccess(Ticket ticket, long actorId, Set<String> actorRoles) {
        if (ticket.openerId == actorId) {
            return true;
        }
        return actorRoles != null && actorRoles.stream().anyMatch(staffRoles::contains);
    }

    public Optional<TicketCategory> category(String key) {
        return Optional.ofNullable(categories.get(key));
    }

    public List<TicketCategory> getCategories() {
        return new ArrayList<>(categories.values());
    }

    public Set<String> getStaffRoles() {
        return staffRoles;
    }

    public int openTicketCount() {
        return tickets.size();
    }

    static String surfaceName(String openerName, String key) {
        String name = openerName == null || openerName.isBlank() ? "member" : openerName.trim();
        if (name.length() > 20) {
            name = name.substring(0, 20);
        }
        String shortKey = key.length() > 6 ? key.substring(0, 6) : key;
        return "ticket-" + name + "-" + shortKey;
    }

    static String formatTranscript(List<TranscriptLine> lines) {
        StringBuilder sb = new StringBuilder();
        for (TranscriptLine line : lines) {
            sb.append('[').append(TRANSCRIPT_TIME.format(line.timestamp)).append("] ")
                    .append(line.authorName).append(" (").append(line.authorId).append("): ")
                    .append(line.text == null ? "" : line.text.replace("\n", "\\n"))
                    .append('\n');
        }
        return sb.toString();
    }

    private static void record(EnumMap<TicketCloseReport.Step, DeliveryFailure> failures,
                               TicketCloseReport.Step step, DeliveryFailure failure) {
        if (failure != null) {
            failures.put(step, failure);
        }
    }

    private static Ticket copyOf(Ticket source) {
        Ticket t = new Ticket();
        t.id = source.id;
        t.key = source.key;
        t.openerId = source.openerId;
        t.openerName = source.openerName;
        t.claimedBy = source.claimedBy;
        t.surface = source.surface;
        t.openedAt = source.openedAt;
        return t;
    }
}
