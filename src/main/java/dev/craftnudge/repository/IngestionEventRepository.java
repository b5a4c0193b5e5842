package dev.craftnudge.repository;

import dev.craftnudge.domain.entity.IngestionEvent;
import dev.craftnudge.domain.enums.EventState;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface IngestionEventRepository extends JpaRepository<IngestionEvent, UUID> {

    Optional<IngestionEvent> findByDeliveryId(String deliveryId);

    long countByState(EventState state);

    long countByReceivedAtGreaterThanEqual(Instant since);

    @Query("SELECT e.eventType, COUNT(e) FROM IngestionEvent e GROUP BY e.eventType ORDER BY e.eventType")
    List<Object[]> countGroupedByEventType();

    List<IngestionEvent> findByStateOrderByReceivedAtDesc(EventState state, Pageable pageable);

    @Query("SELECT e.id FROM IngestionEvent e " +
            "WHERE e.state = dev.craftnudge.domain.enums.EventState.PENDING " +
            "OR (e.state = dev.craftnudge.domain.enums.EventState.FAILED_TRANSIENT AND e.nextAttemptAt <= :now) " +
            "ORDER BY e.receivedAt ASC")
    List<UUID> findClaimableIds(@Param("now") Instant now, Pageable pageable);

    /**
     * Compare-and-set claim. Returns 1 for the single caller that won the row.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE IngestionEvent e SET e.state = dev.craftnudge.domain.enums.EventState.IN_PROGRESS, " +
            "e.attemptCount = e.attemptCount + 1, e.claimedAt = :now, e.nextAttemptAt = NULL, " +
            "e.version = e.version + 1 " +
            "WHERE e.id = :id AND (e.state = dev.craftnudge.domain.enums.EventState.PENDING " +
            "OR (e.state = dev.craftnudge.domain.enums.EventState.FAILED_TRANSIENT AND e.nextAttemptAt <= :now))")
    int claim(@Param("id") UUID id, @Param("now") Instant now);

    /**
     * Moves the claim time of an IN_PROGRESS event to now. Returns 0 when the
     * event is no longer IN_PROGRESS.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE IngestionEvent e SET e.claimedAt = :now, e.version = e.version + 1 " +
            "WHERE e.id = :id AND e.state = dev.craftnudge.domain.enums.EventState.IN_PROGRESS")
    int touchClaim(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE IngestionEvent e SET e.state = dev.craftnudge.domain.enums.EventState.PENDING, " +
            "e.claimedAt = NULL, e.version = e.version + 1 " +
            "WHERE e.state = dev.craftnudge.domain.enums.EventState.IN_PROGRESS AND e.claimedAt < :threshold")
    int reclaimStale(@Param("threshold") Instant threshold);
}
