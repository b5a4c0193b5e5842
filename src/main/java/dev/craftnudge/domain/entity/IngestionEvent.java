package dev.craftnudge.domain.entity;

import dev.craftnudge.domain.enums.EventSource;
import dev.craftnudge.domain.enums.EventState;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.Arrays;
import java.util.UUID;

/**
 * One unit of ingestion work: a webhook delivery or a poll-discovered commit.
 *
 * <p>Design: UUID PK assigned at creation, unique delivery id as the
 * idempotency key, optimistic locking (@Version). Rows are never deleted and
 * never leave a terminal state; a replay is a new row whose {@code replayOf}
 * names the original.
 */
@Entity
@Table(name = "ingestion_events", indexes = {
        @Index(name = "idx_events_state", columnList = "state"),
        @Index(name = "idx_events_next_attempt", columnList = "next_attempt_at"),
        @Index(name = "idx_events_received", columnList = "received_at")
})
public class IngestionEvent {

    private static final int MAX_ERROR_LENGTH = 2000;

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private EventSource source;

    @Column(name = "delivery_id", unique = true, length = 200)
    private String deliveryId;

    @Column(name = "event_type", nullable = false, length = 50)
    private String eventType;

    @Column(nullable = false, columnDefinition = "text")
    private String payload;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EventState state;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount = 0;

    @Column(name = "last_error", length = MAX_ERROR_LENGTH)
    private String lastError;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "replay_of", columnDefinition = "uuid", updatable = false)
    private UUID replayOf;

    @Version
    private Long version;

    protected IngestionEvent() {
    }

    public static IngestionEvent create(EventSource source, String deliveryId, String eventType,
                                        String payload, Instant receivedAt) {
        if (source == null) throw new IllegalArgumentException("source required");
        if (payload == null) throw new IllegalArgumentException("payload required");
        IngestionEvent e = new IngestionEvent();
        e.id = UUID.randomUUID();
        e.source = source;
        e.deliveryId = deliveryId;
        e.eventType = eventType == null ? "unknown" : eventType;
        e.payload = payload;
        e.receivedAt = receivedAt;
        e.state = EventState.PENDING;
        return e;
    }

    /**
     * A PENDING copy of a terminal event: same type and payload, no delivery
     * id, fresh attempt count.
     */
    public static IngestionEvent replayOf(IngestionEvent original, Instant now) {
        if (!original.isTerminal())
            throw new IllegalStateException("Event %s is %s; only DONE or FAILED_PERMANENT events can be replayed"
                    .formatted(original.id, original.state));
        IngestionEvent e = create(EventSource.REPLAY, null, original.eventType, original.payload, now);
        e.replayOf = original.id;
        return e;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public boolean isClaimable(Instant now) {
        return state == EventState.PENDING
                || (state == EventState.FAILED_TRANSIENT && nextAttemptAt != null && !nextAttemptAt.isAfter(now));
    }

    public void claim(Instant now) {
        if (!isClaimable(now))
            throw new IllegalStateException("Event %s is not claimable in state %s".formatted(id, state));
        this.state = EventState.IN_PROGRESS;
        this.attemptCount++;
        this.claimedAt = now;
        this.nextAttemptAt = null;
    }

    /** Keeps a long-running attempt from looking abandoned. */
    public void touchClaim(Instant now) {
        transitionFrom(EventState.IN_PROGRESS);
        this.claimedAt = now;
    }

    public void markDone(Instant now) {
        transitionFrom(EventState.IN_PROGRESS);
        this.state = EventState.DONE;
        this.processedAt = now;
        this.claimedAt = null;
    }

    public void markTransientFailure(String error, Instant nextAttemptAt) {
        transitionFrom(EventState.IN_PROGRESS);
        this.state = EventState.FAILED_TRANSIENT;
        this.lastError = truncate(error);
        this.nextAttemptAt = nextAttemptAt;
        this.claimedAt = null;
    }

    public void markPermanentFailure(String error, Instant now) {
        transitionFrom(EventState.IN_PROGRESS);
        this.state = EventState.FAILED_PERMANENT;
        this.lastError = truncate(error);
        this.processedAt = now;
        this.claimedAt = null;
    }

    /** Returns an abandoned claim to the queue. The attempt it consumed still counts. */
    public void reclaim() {
        transitionFrom(EventState.IN_PROGRESS);
        this.state = EventState.PENDING;
        this.claimedAt = null;
    }

    private void transitionFrom(EventState... allowedPredecessors) {
        for (EventState allowed : allowedPredecessors) {
            if (this.state == allowed) return;
        }
        throw new IllegalStateException(
                "Expected one of %s but was %s".formatted(Arrays.toString(allowedPredecessors), state));
    }

    private static String truncate(String error) {
        if (error == null) return null;
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }

    public UUID getId() {
        return id;
    }

    public EventSource getSource() {
        return source;
    }

    public String getDeliveryId() {
        return deliveryId;
    }

    public String getEventType() {
        return eventType;
    }

    public String getPayload() {
        return payload;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    public EventState getState() {
        return state;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public String getLastError() {
        return lastError;
    }

    public Instant getClaimedAt() {
        return claimedAt;
    }

    public Instant getNextAttemptAt() {
        return nextAttemptAt;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    public UUID getReplayOf() {
        return replayOf;
    }
}
