package dev.craftnudge.domain.enums;

/**
 * Kinds of analysis run per commit. Each kind yields at most one successful
 * {@link dev.craftnudge.domain.entity.AnalysisResult} per commit.
 */
public enum AgentKind {
    /** Code quality, likely bugs, security and performance of the changed files. */
    CODE_ANALYSIS,
    /** Commit message quality, change impact and development patterns. */
    COMMIT_ANALYSIS
}
