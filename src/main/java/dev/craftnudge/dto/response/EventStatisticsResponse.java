package dev.craftnudge.dto.response;

import dev.craftnudge.domain.enums.EventState;

import java.time.Instant;
import java.util.Map;

/**
 * Ingestion activity: events by type and state, events received in the last
 * 24 hours and what they produced.
 */
public record EventStatisticsResponse(
        long totalEvents,
        Map<String, Long> eventsByType,
        Map<EventState, Long> eventsByState,
        long eventsLast24h,
        long repositories,
        long commits,
        Instant generatedAt
) {}
