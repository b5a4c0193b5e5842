package dev.craftnudge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Dispatcher and orchestrator tuning. maxAttempts counts every claim of an
 * event, the first one included.
 */
@ConfigurationProperties(prefix = "craftnudge.pipeline")
public record PipelineProperties(
        int workerPoolSize,
        int maxAttempts,
        Duration baseBackoff,
        Duration maxBackoff,
        Duration staleClaimThreshold,
        Duration cycleInterval,
        int claimBatchSize,
        boolean autoStart,
        Duration drainTimeout
) {
    public PipelineProperties {
        if (workerPoolSize <= 0) workerPoolSize = 4;
        if (maxAttempts <= 0) maxAttempts = 5;
        if (baseBackoff == null) baseBackoff = Duration.ofSeconds(30);
        if (maxBackoff == null) maxBackoff = Duration.ofMinutes(30);
        if (staleClaimThreshold == null) staleClaimThreshold = Duration.ofMinutes(15);
        if (cycleInterval == null) cycleInterval = Duration.ofSeconds(30);
        if (claimBatchSize <= 0) claimBatchSize = 50;
        if (drainTimeout == null) drainTimeout = Duration.ofMinutes(2);
    }
}
