package dev.craftnudge.infrastructure.ai;

import dev.craftnudge.domain.enums.AgentKind;
import dev.craftnudge.domain.valueobject.CommitSnapshot;
import dev.craftnudge.exception.AnalysisPermanentException;
import dev.craftnudge.exception.AnalysisTransientException;

/**
 * Produces a textual analysis of one commit from the point of view of one
 * agent kind. Implementations may block for a long time; callers bound the
 * call with their own timeout.
 */
public interface AnalysisEngine {

    /**
     * @throws AnalysisTransientException when a later attempt may succeed
     * @throws AnalysisPermanentException when the input will never be analyzable
     */
    AnalysisText analyze(CommitSnapshot commit, String diffSummary, AgentKind kind);
}
