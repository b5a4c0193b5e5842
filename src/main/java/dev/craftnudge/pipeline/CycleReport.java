package dev.craftnudge.pipeline;

import dev.craftnudge.service.PollReport;

import java.time.Instant;

/**
 * One orchestrator cycle: stale claims reclaimed, reconciliation pass, drain.
 */
public record CycleReport(Instant startedAt, Instant finishedAt, int reclaimed, PollReport poll, DrainReport drain) {
}
