package dev.craftnudge.domain.enums;

/**
 * Where an ingestion event came from. REPLAY events are operator copies of a
 * terminal event.
 */
public enum EventSource {
    WEBHOOK, POLL, REPLAY
}
