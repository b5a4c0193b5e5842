package dev.craftnudge.service;

import dev.craftnudge.domain.entity.IngestionEvent;
import dev.craftnudge.domain.enums.EventState;
import dev.craftnudge.dto.response.EventStatisticsResponse;
import dev.craftnudge.dto.response.EventSummaryResponse;
import dev.craftnudge.store.EntityStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read side for the operator surface: which events need attention and how
 * much has been ingested.
 */
@Service
public class EventQueryService {

    static final int MAX_LIMIT = 500;
    static final Duration RECENT_WINDOW = Duration.ofHours(24);

    private final EntityStore store;
    private final Clock clock;

    public EventQueryService(EntityStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public List<EventSummaryResponse> findByState(EventState state, int limit) {
        if (state == null) throw new IllegalArgumentException("state required");
        if (limit < 1 || limit > MAX_LIMIT)
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        return store.findEventsByState(state, limit).stream().map(EventQueryService::toSummary).toList();
    }

    public EventStatisticsResponse statistics() {
        Instant now = clock.instant();
        Map<EventState, Long> byState = new EnumMap<>(EventState.class);
        long total = 0;
        for (EventState state : EventState.values()) {
            long count = store.countEvents(state);
            byState.put(state, count);
            total += count;
        }
        return new EventStatisticsResponse(total, store.countEventsByType(), byState,
                store.countEventsReceivedSince(now.minus(RECENT_WINDOW)),
                store.countRepositories(), store.countCommits(), now);
    }

    private static EventSummaryResponse toSummary(IngestionEvent e) {
        return new EventSummaryResponse(e.getId(), e.getSource(), e.getDeliveryId(), e.getEventType(),
                e.getState(), e.getAttemptCount(), e.getLastError(),
                e.getReceivedAt(), e.getNextAttemptAt(), e.getProcessedAt(), e.getReplayOf());
    }
}
