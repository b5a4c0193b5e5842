package dev.craftnudge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * CraftNudge commit pipeline: ingests push notifications and polled commits
 * and analyzes each commit once per agent.
 *
 * <p>Flow:
 * <pre>
 * GitHub Webhook → WebhookController → ingestion_events (PENDING)
 * ReconciliationPoller ───────────────↗
 *   → PipelineOrchestrator cycle → EventDispatcher (claim) → EventNormalizer
 *   → EntityStore (repository, commit upserts) → AnalysisEngine per agent kind
 *   → analysis_results → event DONE / FAILED_TRANSIENT / FAILED_PERMANENT
 * </pre>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CraftNudgeApplication {
    public static void main(String[] args) {
        SpringApplication.run(CraftNudgeApplication.class, args);
    }
}
