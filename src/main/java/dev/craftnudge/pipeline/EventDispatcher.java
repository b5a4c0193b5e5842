package dev.craftnudge.pipeline;

import dev.craftnudge.config.AgentProperties;
import dev.craftnudge.config.PipelineProperties;
import dev.craftnudge.domain.entity.IngestionEvent;
import dev.craftnudge.domain.enums.AgentKind;
import dev.craftnudge.domain.valueobject.AnalysisOutcome;
import dev.craftnudge.domain.valueobject.CommitSnapshot;
import dev.craftnudge.domain.valueobject.NormalizedCommit;
import dev.craftnudge.exception.MalformedPayloadException;
import dev.craftnudge.exception.StoreRejectedException;
import dev.craftnudge.exception.StoreUnavailableException;
import dev.craftnudge.service.EventNormalizer;
import dev.craftnudge.store.CommitUpsert;
import dev.craftnudge.store.EntityStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Moves ingestion events through their state machine.
 *
 * <pre>
 *  PENDING ──claim──▶ IN_PROGRESS ──▶ DONE
 *                       │   ▲    └──▶ FAILED_PERMANENT
 *                       ▼   │claim
 *                  FAILED_TRANSIENT
 * </pre>
 *
 * <p>Per event: claim (compare-and-set), normalize, then for each commit in
 * payload order upsert the repository and the commit and run every enabled
 * agent that has no terminal result yet. The event is DONE when all its
 * commits are terminal. Otherwise it is retried with exponential backoff
 * until the attempt cap.
 *
 * <p>The claim is the only mutual exclusion; everything after it is an
 * idempotent upsert, so a reclaimed event repeats no completed work. The
 * claim time is refreshed after every analysis call, so an attempt stays
 * fresh for as long as it keeps making progress.
 */
@Component
public class EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);
    static final String MDC_EVENT_ID = "eventId";

    private final EntityStore store;
    private final EventNormalizer normalizer;
    private final AnalysisGateway analysisGateway;
    private final RetryPolicy retryPolicy;
    private final AgentProperties agentProperties;
    private final PipelineProperties pipelineProperties;
    private final ExecutorService workers;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Timer dispatchTimer;
    private final AtomicBoolean halted = new AtomicBoolean(false);

    public EventDispatcher(EntityStore store,
                           EventNormalizer normalizer,
                           AnalysisGateway analysisGateway,
                           RetryPolicy retryPolicy,
                           AgentProperties agentProperties,
                           PipelineProperties pipelineProperties,
                           @Qualifier("workerExecutorService") ExecutorService workers,
                           Clock clock,
                           MeterRegistry meterRegistry) {
        this.store = store;
        this.normalizer = normalizer;
        this.analysisGateway = analysisGateway;
        this.retryPolicy = retryPolicy;
        this.agentProperties = agentProperties;
        this.pipelineProperties = pipelineProperties;
        this.workers = workers;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.dispatchTimer = Timer.builder("craftnudge.dispatch.duration")
                .description("Time to process one ingestion event attempt")
                .register(meterRegistry);
    }

    /**
     * Claims and processes one batch of claimable events on the worker pool
     * and waits for all of them.
     */
    public DrainReport drain() {
        if (halted.get()) return DrainReport.empty();
        List<UUID> candidates = store.findClaimableEventIds(clock.instant(), pipelineProperties.claimBatchSize());
        if (candidates.isEmpty()) return DrainReport.empty();
        log.debug("Draining {} claimable events", candidates.size());

        List<Future<DispatchOutcome>> futures = new ArrayList<>(candidates.size());
        for (UUID id : candidates) {
            try {
                futures.add(workers.submit(() -> process(id)));
            } catch (RejectedExecutionException e) {
                log.warn("Worker pool rejected event {}, leaving it for the next cycle", id);
                break;
            }
        }

        List<DispatchOutcome> outcomes = new ArrayList<>(futures.size());
        for (Future<DispatchOutcome> future : futures) {
            try {
                outcomes.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for workers; {} results collected", outcomes.size());
                break;
            } catch (ExecutionException e) {
                log.error("Worker failed outside event handling", e.getCause());
                outcomes.add(DispatchOutcome.ABANDONED);
            }
        }
        DrainReport report = DrainReport.of(candidates.size(), outcomes);
        log.info("Drain finished: {}", report);
        return report;
    }

    /**
     * Processes one event attempt on the calling thread.
     */
    public DispatchOutcome process(UUID eventId) {
        if (halted.get()) return record(DispatchOutcome.NOT_CLAIMED);
        MDC.put(MDC_EVENT_ID, eventId.toString());
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Optional<IngestionEvent> claimed;
            try {
                claimed = store.claim(eventId, clock.instant());
            } catch (StoreUnavailableException e) {
                log.warn("Could not claim event {}: {}", eventId, e.getMessage());
                return record(DispatchOutcome.NOT_CLAIMED);
            }
            if (claimed.isEmpty()) {
                log.debug("Event {} already claimed elsewhere", eventId);
                return record(DispatchOutcome.NOT_CLAIMED);
            }
            IngestionEvent event = claimed.get();
            log.info("Event {} claimed → IN_PROGRESS (attempt {}, {} {})",
                    eventId, event.getAttemptCount(), event.getSource(), event.getEventType());
            return record(handle(event));
        } finally {
            sample.stop(dispatchTimer);
            MDC.remove(MDC_EVENT_ID);
        }
    }

    private DispatchOutcome handle(IngestionEvent event) {
        UUID eventId = event.getId();
        try {
            List<NormalizedCommit> commits;
            try {
                commits = normalizer.normalize(event);
            } catch (MalformedPayloadException e) {
                log.error("Event {} IN_PROGRESS → FAILED_PERMANENT: {}", eventId, e.getMessage());
                store.markPermanentFailure(eventId, "Malformed payload: " + e.getMessage());
                return DispatchOutcome.FAILED_PERMANENT;
            }

            String pendingError = null;
            for (NormalizedCommit commit : commits) {
                String error = processCommit(eventId, commit);
                if (error != null) pendingError = error;
            }

            if (pendingError == null) {
                store.markDone(eventId);
                log.info("Event {} IN_PROGRESS → DONE ({} commits)", eventId, commits.size());
                return DispatchOutcome.DONE;
            }
            return retryOrGiveUp(event, pendingError);
        } catch (StoreRejectedException e) {
            log.error("Event {} IN_PROGRESS → FAILED_PERMANENT, store refused its data: {}", eventId, e.getMessage());
            return giveUp(eventId, "Rejected by store: " + e.getMessage());
        } catch (StoreUnavailableException e) {
            log.warn("Entity store unavailable while processing event {}: {}", eventId, e.getMessage());
            return retryOrGiveUp(event, "Store unavailable: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure processing event {}", eventId, e);
            return retryOrGiveUp(event, "Unexpected error: " + e);
        }
    }

    /**
     * Upserts one commit and runs the agents it still needs. Returns the last
     * transient error, or null when every agent result is terminal.
     */
    private String processCommit(UUID eventId, NormalizedCommit commit) {
        UUID repositoryId = store.upsertRepository(commit.repository());
        CommitUpsert upsert = store.upsertCommit(repositoryId, commit.commit());
        CommitSnapshot snapshot = CommitSnapshot.of(upsert.commitId(), commit.repository(), commit.commit());
        if (upsert.wasNew())
            log.info("Stored commit {} of {}", snapshot.shortHash(), snapshot.repositoryFullName());

        String error = null;
        for (AgentKind kind : agentProperties.enabledKinds()) {
            if (store.hasTerminalAnalysis(upsert.commitId(), kind)) {
                log.debug("{} of commit {} already terminal", kind, snapshot.shortHash());
                continue;
            }
            AnalysisOutcome outcome = analysisGateway.analyze(snapshot, kind);
            store.recordAnalysis(upsert.commitId(), kind, outcome);
            refreshClaim(eventId);
            if (!outcome.isTerminal())
                error = "%s of commit %s: %s".formatted(kind, snapshot.shortHash(), outcome.errorMessage());
        }
        return error;
    }

    private void refreshClaim(UUID eventId) {
        if (!store.touchClaim(eventId, clock.instant()))
            log.warn("Event {} is no longer IN_PROGRESS under this claim", eventId);
    }

    private DispatchOutcome retryOrGiveUp(IngestionEvent event, String error) {
        UUID eventId = event.getId();
        int attempts = event.getAttemptCount();
        try {
            if (retryPolicy.exhausted(attempts)) {
                store.markPermanentFailure(eventId, error);
                log.error("Event {} IN_PROGRESS → FAILED_PERMANENT after {} attempts: {}", eventId, attempts, error);
                return DispatchOutcome.FAILED_PERMANENT;
            }
            Duration backoff = retryPolicy.backoffFor(attempts);
            Instant nextAttemptAt = clock.instant().plus(backoff);
            store.markTransientFailure(eventId, error, nextAttemptAt);
            log.warn("Event {} IN_PROGRESS → FAILED_TRANSIENT (attempt {}/{}), retry in {}: {}",
                    eventId, attempts, retryPolicy.maxAttempts(), backoff, error);
            return DispatchOutcome.FAILED_TRANSIENT;
        } catch (StoreUnavailableException | IllegalStateException e) {
            log.error("Could not record outcome of event {}; left IN_PROGRESS until reclaimed: {}",
                    eventId, e.getMessage());
            return DispatchOutcome.ABANDONED;
        }
    }

    private DispatchOutcome giveUp(UUID eventId, String error) {
        try {
            store.markPermanentFailure(eventId, error);
            return DispatchOutcome.FAILED_PERMANENT;
        } catch (StoreUnavailableException | IllegalStateException e) {
            log.error("Could not record outcome of event {}; left IN_PROGRESS until reclaimed: {}",
                    eventId, e.getMessage());
            return DispatchOutcome.ABANDONED;
        }
    }

    private DispatchOutcome record(DispatchOutcome outcome) {
        Counter.builder("craftnudge.dispatch.outcome")
                .description("Event attempts by outcome")
                .tag("outcome", outcome.name().toLowerCase())
                .register(meterRegistry)
                .increment();
        return outcome;
    }

    /** Stops claiming; attempts already claimed run to completion. */
    public void halt() {
        if (halted.compareAndSet(false, true)) log.info("Dispatcher halted");
    }

    public void resume() {
        if (halted.compareAndSet(true, false)) log.info("Dispatcher resumed");
    }

    public boolean isHalted() {
        return halted.get();
    }
}
