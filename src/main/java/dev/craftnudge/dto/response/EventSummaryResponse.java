package dev.craftnudge.dto.response;

import dev.craftnudge.domain.enums.EventSource;
import dev.craftnudge.domain.enums.EventState;

import java.time.Instant;
import java.util.UUID;

public record EventSummaryResponse(
        UUID id, EventSource source, String deliveryId, String eventType,
        EventState state, int attemptCount, String lastError,
        Instant receivedAt, Instant nextAttemptAt, Instant processedAt, UUID replayOf
) {}
