package dev.craftnudge.store;

import dev.craftnudge.domain.entity.AnalysisResult;
import dev.craftnudge.domain.entity.Commit;
import dev.craftnudge.domain.entity.IngestionEvent;
import dev.craftnudge.domain.entity.TrackedRepository;
import dev.craftnudge.domain.enums.AgentKind;
import dev.craftnudge.domain.enums.EventState;
import dev.craftnudge.domain.valueobject.AnalysisOutcome;
import dev.craftnudge.domain.valueobject.CommitAttributes;
import dev.craftnudge.domain.valueobject.RepositoryAttributes;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable persistence for repositories, commits, ingestion events and
 * analysis results.
 *
 * <p>Every operation runs in its own transaction. Failures to reach the
 * backing store surface as {@link dev.craftnudge.exception.StoreUnavailableException}.
 * Entities returned here are detached snapshots.
 */
public interface EntityStore {

    // ── Repositories and commits ──────────────────────────────────

    /** Inserts the repository or refreshes its descriptive fields. Returns its id. */
    UUID upsertRepository(RepositoryAttributes attrs);

    /**
     * Inserts the commit unless (repository, hash) already exists. Concurrent
     * callers with the same identity observe exactly one {@code wasNew=true}.
     */
    CommitUpsert upsertCommit(UUID repositoryId, CommitAttributes attrs);

    /** Stores an analysis outcome. Overwrites a failed result, never an OK one. */
    void recordAnalysis(UUID commitId, AgentKind kind, AnalysisOutcome outcome);

    boolean hasTerminalAnalysis(UUID commitId, AgentKind kind);

    Optional<Commit> findCommit(UUID commitId);

    List<AnalysisResult> findAnalysisResults(UUID commitId);

    boolean commitExists(String owner, String name, String hash);

    List<TrackedRepository> listRepositories();

    long countRepositories();

    long countCommits();

    // ── Event queue ───────────────────────────────────────────────

    /** Queues an event, or returns the existing one for an already seen delivery id. */
    EventReceipt recordEvent(NewEvent event);

    /** Ids of PENDING events and FAILED_TRANSIENT events whose retry time has come, oldest first. */
    List<UUID> findClaimableEventIds(Instant now, int limit);

    /**
     * Compare-and-set claim: moves a claimable event to IN_PROGRESS and counts
     * the attempt. Empty when another worker got there first or the event is
     * no longer claimable.
     */
    Optional<IngestionEvent> claim(UUID eventId, Instant now);

    void markDone(UUID eventId);

    void markTransientFailure(UUID eventId, String error, Instant nextAttemptAt);

    void markPermanentFailure(UUID eventId, String error);

    /**
     * Moves the claim time of an IN_PROGRESS event to {@code now}, keeping a
     * long attempt from looking abandoned. False when the event is no longer
     * IN_PROGRESS.
     */
    boolean touchClaim(UUID eventId, Instant now);

    /** Returns IN_PROGRESS events claimed before the given instant to PENDING. */
    int reclaimStale(Instant claimedBefore);

    /**
     * Queues a PENDING copy of a DONE or FAILED_PERMANENT event and returns it.
     * Empty when the event does not exist; {@link IllegalStateException} when
     * it is not terminal.
     */
    Optional<IngestionEvent> replayEvent(UUID eventId);

    long countEvents(EventState state);

    /** Event counts keyed by event type, in type order. */
    Map<String, Long> countEventsByType();

    long countEventsReceivedSince(Instant since);

    Optional<IngestionEvent> findEvent(UUID eventId);

    /** Most recently received first. */
    List<IngestionEvent> findEventsByState(EventState state, int limit);
}
