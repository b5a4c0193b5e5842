package dev.craftnudge.domain.entity;

import dev.craftnudge.domain.enums.AgentKind;
import dev.craftnudge.domain.enums.AnalysisStatus;
import dev.craftnudge.domain.valueobject.AnalysisOutcome;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One agent's analysis of one commit. Unique per (commit, agent kind): a
 * failed row is overwritten by the next attempt, an OK row is final.
 */
@Entity
@Table(name = "analysis_results", uniqueConstraints = {
        @UniqueConstraint(name = "uk_analysis_commit_agent", columnNames = {"commit_id", "agent_kind"})
}, indexes = {
        @Index(name = "idx_analysis_status", columnList = "status")
})
public class AnalysisResult {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "commit_id", nullable = false, columnDefinition = "uuid")
    private UUID commitId;

    @Enumerated(EnumType.STRING)
    @Column(name = "agent_kind", nullable = false, length = 30)
    private AgentKind agentKind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private AnalysisStatus status;

    @Column(name = "analysis_text", columnDefinition = "text")
    private String analysisText;

    @Column(nullable = false)
    private boolean retryable;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(length = 100)
    private String model;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "analyzed_at", nullable = false)
    private Instant analyzedAt;

    protected AnalysisResult() {
    }

    public static AnalysisResult create(UUID commitId, AgentKind kind, AnalysisOutcome outcome, Instant now) {
        AnalysisResult r = new AnalysisResult();
        r.id = UUID.randomUUID();
        r.commitId = commitId;
        r.agentKind = kind;
        r.apply(outcome, now);
        return r;
    }

    /**
     * Replaces a failed result with a newer outcome.
     */
    public void overwrite(AnalysisOutcome outcome, Instant now) {
        if (status == AnalysisStatus.OK)
            throw new IllegalStateException("Successful analysis %s for commit %s is final".formatted(agentKind, commitId));
        apply(outcome, now);
    }

    private void apply(AnalysisOutcome outcome, Instant now) {
        this.status = outcome.status();
        this.analysisText = outcome.text();
        this.retryable = !outcome.isSuccess() && outcome.retryable();
        this.errorMessage = outcome.errorMessage() == null || outcome.errorMessage().length() <= 2000
                ? outcome.errorMessage() : outcome.errorMessage().substring(0, 2000);
        this.model = outcome.model() == null || outcome.model().length() <= 100
                ? outcome.model() : outcome.model().substring(0, 100);
        this.durationMs = outcome.duration() != null ? outcome.duration().toMillis() : null;
        this.analyzedAt = now;
    }

    public boolean isTerminal() {
        return status == AnalysisStatus.OK || !retryable;
    }

    public boolean isSuccess() {
        return status == AnalysisStatus.OK;
    }

    public UUID getId() {
        return id;
    }

    public UUID getCommitId() {
        return commitId;
    }

    public AgentKind getAgentKind() {
        return agentKind;
    }

    public AnalysisStatus getStatus() {
        return status;
    }

    public String getAnalysisText() {
        return analysisText;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getModel() {
        return model;
    }

    public Long getDurationMs() {
        return durationMs;
    }

    public Instant getAnalyzedAt() {
        return analyzedAt;
    }
}
