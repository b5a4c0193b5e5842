package dev.craftnudge.pipeline;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of the orchestrator and the event queue. interval is
 * null while stopped; lastCycleAt is null before the first cycle.
 */
public record PipelineStatus(
        boolean running,
        Instant lastCycleAt,
        Duration interval,
        long pendingCount,
        long inProgressCount,
        long failedTransientCount,
        long failedPermanentCount,
        long doneCount
) {
}
