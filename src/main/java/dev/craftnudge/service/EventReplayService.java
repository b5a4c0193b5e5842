package dev.craftnudge.service;

import dev.craftnudge.domain.entity.IngestionEvent;
import dev.craftnudge.domain.event.EventReceivedEvent;
import dev.craftnudge.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Operator replay: queues a fresh copy of a DONE or FAILED_PERMANENT event.
 *
 * <p>The original row stays terminal. The copy goes through the dispatcher
 * like any other event, so commits and analyses that are already terminal are
 * skipped and replaying a DONE event changes nothing.
 */
@Service
public class EventReplayService {
    private static final Logger log = LoggerFactory.getLogger(EventReplayService.class);

    private final EntityStore store;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public EventReplayService(EntityStore store, ApplicationEventPublisher eventPublisher, Clock clock) {
        this.store = store;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Returns the queued copy, or empty when no event has that id.
     *
     * @throws IllegalStateException when the event is still PENDING, IN_PROGRESS or FAILED_TRANSIENT
     */
    public Optional<IngestionEvent> replay(UUID eventId) {
        Optional<IngestionEvent> replay = store.replayEvent(eventId);
        replay.ifPresent(copy -> {
            log.info("Replaying event {} as {}", eventId, copy.getId());
            eventPublisher.publishEvent(new EventReceivedEvent(
                    copy.getId(), copy.getSource(), copy.getEventType(), clock.instant()));
        });
        return replay;
    }
}
