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
import dev.craftnudge.exception.StoreRejectedException;
import dev.craftnudge.exception.StoreUnavailableException;
import dev.craftnudge.repository.AnalysisResultRepository;
import dev.craftnudge.repository.CommitRepository;
import dev.craftnudge.repository.IngestionEventRepository;
import dev.craftnudge.repository.TrackedRepositoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * {@link EntityStore} over Spring Data JPA and PostgreSQL.
 *
 * <p>Inserts that race on a unique key run in their own transaction
 * ({@code REQUIRES_NEW}); the loser's constraint violation is turned into a
 * re-read of the winner's row. A violation with no winner to re-read is a
 * {@link StoreRejectedException}. Event claims are a conditional UPDATE, so the
 * database decides which worker owns an event.
 */
@Component
public class JpaEntityStore implements EntityStore {

    private static final Logger log = LoggerFactory.getLogger(JpaEntityStore.class);

    private final TrackedRepositoryRepository repositoryRepository;
    private final CommitRepository commitRepository;
    private final IngestionEventRepository eventRepository;
    private final AnalysisResultRepository analysisRepository;
    private final TransactionTemplate tx;
    private final TransactionTemplate newTx;
    private final Clock clock;

    public JpaEntityStore(TrackedRepositoryRepository repositoryRepository,
                          CommitRepository commitRepository,
                          IngestionEventRepository eventRepository,
                          AnalysisResultRepository analysisRepository,
                          PlatformTransactionManager transactionManager,
                          Clock clock) {
        this.repositoryRepository = repositoryRepository;
        this.commitRepository = commitRepository;
        this.eventRepository = eventRepository;
        this.analysisRepository = analysisRepository;
        this.tx = new TransactionTemplate(transactionManager);
        this.newTx = new TransactionTemplate(transactionManager);
        this.newTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    // ── Repositories and commits ──────────────────────────────────

    @Override
    public UUID upsertRepository(RepositoryAttributes attrs) {
        return inStore("upsertRepository", () -> {
            Optional<UUID> refreshed = tx.execute(s -> repositoryRepository
                    .findByOwnerAndName(attrs.owner(), attrs.name())
                    .map(existing -> {
                        if (existing.refresh(attrs, clock.instant()))
                            log.debug("Refreshed repository {}", attrs.fullName());
                        return existing.getId();
                    }));
            if (refreshed.isPresent()) return refreshed.get();
            try {
                TrackedRepository created = newTx.execute(s ->
                        repositoryRepository.saveAndFlush(TrackedRepository.create(attrs, clock.instant())));
                log.info("Tracking new repository {}", attrs.fullName());
                return created.getId();
            } catch (DataIntegrityViolationException e) {
                log.debug("Concurrent insert of repository {}, re-reading", attrs.fullName());
                return tx.execute(s -> repositoryRepository.findByOwnerAndName(attrs.owner(), attrs.name()))
                        .map(TrackedRepository::getId)
                        .orElseThrow(() -> new StoreRejectedException(
                                "Repository insert rejected: " + attrs.fullName(), e));
            }
        });
    }

    @Override
    public CommitUpsert upsertCommit(UUID repositoryId, CommitAttributes attrs) {
        return inStore("upsertCommit", () -> {
            Optional<Commit> existing = tx.execute(s ->
                    commitRepository.findByRepositoryIdAndCommitHash(repositoryId, attrs.hash()));
            if (existing.isPresent()) return new CommitUpsert(existing.get().getId(), false);
            try {
                Commit created = newTx.execute(s ->
                        commitRepository.saveAndFlush(Commit.create(repositoryId, attrs, clock.instant())));
                return new CommitUpsert(created.getId(), true);
            } catch (DataIntegrityViolationException e) {
                log.debug("Concurrent insert of commit {} lost, re-reading", attrs.hash());
                return tx.execute(s -> commitRepository.findByRepositoryIdAndCommitHash(repositoryId, attrs.hash()))
                        .map(c -> new CommitUpsert(c.getId(), false))
                        .orElseThrow(() -> new StoreRejectedException(
                                "Commit insert rejected: " + attrs.hash(), e));
            }
        });
    }

    @Override
    public void recordAnalysis(UUID commitId, AgentKind kind, AnalysisOutcome outcome) {
        inStore("recordAnalysis", () -> {
            try {
                newTx.executeWithoutResult(s -> writeAnalysis(commitId, kind, outcome));
            } catch (DataIntegrityViolationException e) {
                log.debug("Concurrent {} result for commit {}, applying over it", kind, commitId);
                try {
                    newTx.executeWithoutResult(s -> writeAnalysis(commitId, kind, outcome));
                } catch (DataIntegrityViolationException again) {
                    throw new StoreRejectedException("%s result for commit %s rejected".formatted(kind, commitId), again);
                }
            }
            return null;
        });
    }

    private void writeAnalysis(UUID commitId, AgentKind kind, AnalysisOutcome outcome) {
        Instant now = clock.instant();
        Optional<AnalysisResult> existing = analysisRepository.findByCommitIdAndAgentKind(commitId, kind);
        if (existing.isEmpty()) {
            analysisRepository.saveAndFlush(AnalysisResult.create(commitId, kind, outcome, now));
            return;
        }
        AnalysisResult result = existing.get();
        if (result.isSuccess()) {
            log.debug("{} result for commit {} already OK, keeping it", kind, commitId);
            return;
        }
        result.overwrite(outcome, now);
    }

    @Override
    public boolean hasTerminalAnalysis(UUID commitId, AgentKind kind) {
        return inStore("hasTerminalAnalysis", () -> tx.execute(s -> analysisRepository
                .findByCommitIdAndAgentKind(commitId, kind)
                .map(AnalysisResult::isTerminal)
                .orElse(false)));
    }

    @Override
    public Optional<Commit> findCommit(UUID commitId) {
        return inStore("findCommit", () -> tx.execute(s -> commitRepository.findById(commitId)));
    }

    @Override
    public List<AnalysisResult> findAnalysisResults(UUID commitId) {
        return inStore("findAnalysisResults", () ->
                tx.execute(s -> analysisRepository.findByCommitIdOrderByAgentKindAsc(commitId)));
    }

    @Override
    public boolean commitExists(String owner, String name, String hash) {
        return inStore("commitExists", () -> tx.execute(s -> repositoryRepository
                .findByOwnerAndName(owner, name)
                .map(r -> commitRepository.existsByRepositoryIdAndCommitHash(r.getId(), hash))
                .orElse(false)));
    }

    @Override
    public List<TrackedRepository> listRepositories() {
        return inStore("listRepositories", () ->
                tx.execute(s -> repositoryRepository.findAllByOrderByOwnerAscNameAsc()));
    }

    @Override
    public long countRepositories() {
        return inStore("countRepositories", () -> tx.execute(s -> repositoryRepository.count()));
    }

    @Override
    public long countCommits() {
        return inStore("countCommits", () -> tx.execute(s -> commitRepository.count()));
    }

    // ── Event queue ───────────────────────────────────────────────

    @Override
    public EventReceipt recordEvent(NewEvent event) {
        return inStore("recordEvent", () -> {
            if (event.deliveryId() != null) {
                Optional<IngestionEvent> existing = tx.execute(s -> eventRepository.findByDeliveryId(event.deliveryId()));
                if (existing.isPresent()) return new EventReceipt(existing.get().getId(), true);
            }
            try {
                IngestionEvent saved = newTx.execute(s -> eventRepository.saveAndFlush(IngestionEvent.create(
                        event.source(), event.deliveryId(), event.eventType(), event.payload(), clock.instant())));
                return new EventReceipt(saved.getId(), false);
            } catch (DataIntegrityViolationException e) {
                if (event.deliveryId() == null) throw new StoreRejectedException("Event insert rejected", e);
                log.debug("Concurrent delivery {} already recorded", event.deliveryId());
                return tx.execute(s -> eventRepository.findByDeliveryId(event.deliveryId()))
                        .map(existing -> new EventReceipt(existing.getId(), true))
                        .orElseThrow(() -> new StoreRejectedException(
                                "Event insert rejected for delivery " + event.deliveryId(), e));
            }
        });
    }

    @Override
    public List<UUID> findClaimableEventIds(Instant now, int limit) {
        return inStore("findClaimableEventIds", () ->
                tx.execute(s -> eventRepository.findClaimableIds(now, PageRequest.of(0, limit))));
    }

    @Override
    public Optional<IngestionEvent> claim(UUID eventId, Instant now) {
        return inStore("claim", () -> tx.execute(s -> {
            if (eventRepository.claim(eventId, now) == 0) return Optional.<IngestionEvent>empty();
            return eventRepository.findById(eventId);
        }));
    }

    @Override
    public void markDone(UUID eventId) {
        updateEvent("markDone", eventId, e -> e.markDone(clock.instant()));
    }

    @Override
    public void markTransientFailure(UUID eventId, String error, Instant nextAttemptAt) {
        updateEvent("markTransientFailure", eventId, e -> e.markTransientFailure(error, nextAttemptAt));
    }

    @Override
    public void markPermanentFailure(UUID eventId, String error) {
        updateEvent("markPermanentFailure", eventId, e -> e.markPermanentFailure(error, clock.instant()));
    }

    private void updateEvent(String operation, UUID eventId, Consumer<IngestionEvent> change) {
        inStore(operation, () -> {
            tx.executeWithoutResult(s -> {
                IngestionEvent event = eventRepository.findById(eventId)
                        .orElseThrow(() -> new IllegalArgumentException("Event not found: " + eventId));
                change.accept(event);
            });
            return null;
        });
    }

    @Override
    public boolean touchClaim(UUID eventId, Instant now) {
        Integer touched = inStore("touchClaim", () -> tx.execute(s -> eventRepository.touchClaim(eventId, now)));
        return touched != null && touched > 0;
    }

    @Override
    public int reclaimStale(Instant claimedBefore) {
        Integer reclaimed = inStore("reclaimStale", () -> tx.execute(s -> eventRepository.reclaimStale(claimedBefore)));
        return reclaimed == null ? 0 : reclaimed;
    }

    @Override
    public Optional<IngestionEvent> replayEvent(UUID eventId) {
        return inStore("replayEvent", () -> tx.execute(s -> eventRepository.findById(eventId)
                .map(original -> eventRepository.save(IngestionEvent.replayOf(original, clock.instant())))));
    }

    @Override
    public long countEvents(EventState state) {
        return inStore("countEvents", () -> tx.execute(s -> eventRepository.countByState(state)));
    }

    @Override
    public Map<String, Long> countEventsByType() {
        return inStore("countEventsByType", () -> tx.execute(s -> {
            Map<String, Long> counts = new LinkedHashMap<>();
            for (Object[] row : eventRepository.countGroupedByEventType())
                counts.put((String) row[0], ((Number) row[1]).longValue());
            return counts;
        }));
    }

    @Override
    public long countEventsReceivedSince(Instant since) {
        return inStore("countEventsReceivedSince", () ->
                tx.execute(s -> eventRepository.countByReceivedAtGreaterThanEqual(since)));
    }

    @Override
    public Optional<IngestionEvent> findEvent(UUID eventId) {
        return inStore("findEvent", () -> tx.execute(s -> eventRepository.findById(eventId)));
    }

    @Override
    public List<IngestionEvent> findEventsByState(EventState state, int limit) {
        return inStore("findEventsByState", () ->
                tx.execute(s -> eventRepository.findByStateOrderByReceivedAtDesc(state, PageRequest.of(0, limit))));
    }

    private static <T> T inStore(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException
                 | CannotCreateTransactionException e) {
            throw new StoreUnavailableException("Entity store unavailable during " + operation, e);
        }
    }
}
