package dev.craftnudge.dto.response;

import dev.craftnudge.pipeline.PipelineStatus;

import java.time.Instant;

public record PipelineStatusResponse(
        boolean running, Instant lastCycleAt, Long intervalSeconds,
        long pending, long inProgress, long failedTransient, long failedPermanent, long done
) {
    public static PipelineStatusResponse from(PipelineStatus status) {
        return new PipelineStatusResponse(status.running(), status.lastCycleAt(),
                status.interval() != null ? status.interval().toSeconds() : null,
                status.pendingCount(), status.inProgressCount(), status.failedTransientCount(),
                status.failedPermanentCount(), status.doneCount());
    }
}
