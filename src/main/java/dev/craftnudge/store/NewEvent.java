package dev.craftnudge.store;

import dev.craftnudge.domain.enums.EventSource;

/**
 * An event about to be queued. deliveryId may be null, in which case no deduplication applies.
 */
public record NewEvent(EventSource source, String deliveryId, String eventType, String payload) {
    public NewEvent {
        if (source == null) throw new IllegalArgumentException("source required");
        if (payload == null) throw new IllegalArgumentException("payload required");
        if (deliveryId != null && deliveryId.isBlank()) deliveryId = null;
    }
}
