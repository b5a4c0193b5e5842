package dev.craftnudge.pipeline;

import dev.craftnudge.domain.event.EventReceivedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Wakes the orchestrator when an event is queued, so it does not sit until
 * the next timer cycle.
 *
 * <p>Runs after the surrounding transaction commits (or immediately when
 * there is none). A lost nudge only delays the event to the next cycle.
 */
@Component
public class PendingEventNudger {

    private static final Logger log = LoggerFactory.getLogger(PendingEventNudger.class);

    private final PipelineOrchestrator orchestrator;

    public PendingEventNudger(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onEventReceived(EventReceivedEvent event) {
        log.debug("Nudging dispatcher for {} event {}", event.source(), event.eventId());
        orchestrator.nudge();
    }
}
