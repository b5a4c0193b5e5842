package dev.craftnudge.pipeline;

import dev.craftnudge.exception.StoreUnavailableException;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health contributor {@code pipeline}: queue counts, DOWN when the store is unreachable.
 */
@Component
public class PipelineHealthIndicator implements HealthIndicator {

    private final PipelineOrchestrator orchestrator;

    public PipelineHealthIndicator(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Health health() {
        try {
            PipelineStatus status = orchestrator.status();
            Health.Builder builder = Health.up()
                    .withDetail("running", status.running())
                    .withDetail("pending", status.pendingCount())
                    .withDetail("inProgress", status.inProgressCount())
                    .withDetail("failedTransient", status.failedTransientCount())
                    .withDetail("failedPermanent", status.failedPermanentCount());
            if (status.lastCycleAt() != null) builder.withDetail("lastCycleAt", status.lastCycleAt().toString());
            return builder.build();
        } catch (StoreUnavailableException e) {
            return Health.down(e).build();
        }
    }
}
