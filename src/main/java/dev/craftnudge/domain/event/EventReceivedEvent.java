package dev.craftnudge.domain.event;

import dev.craftnudge.domain.enums.EventSource;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a new ingestion event has been persisted.
 * Consumed after commit to wake the dispatcher early.
 */
public record EventReceivedEvent(UUID eventId, EventSource source, String eventType, Instant occurredAt) {
    public EventReceivedEvent {
        if (eventId == null) throw new IllegalArgumentException("eventId required");
        if (occurredAt == null) occurredAt = Instant.now();
    }
}
