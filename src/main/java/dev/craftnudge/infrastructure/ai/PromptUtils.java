package dev.craftnudge.infrastructure.ai;

import dev.craftnudge.domain.enums.AgentKind;
import dev.craftnudge.domain.valueobject.CommitSnapshot;

/**
 * Prompt construction for the analysis agents.
 */
public final class PromptUtils {

    private static final String CODE_ANALYSIS_SYSTEM = """
            You are a code analysis agent. Analyze the provided code changes and provide insights about:
            1. Code quality and best practices
            2. Potential bugs or issues
            3. Security concerns
            4. Performance implications
            5. Suggestions for improvement

            Provide clear, actionable feedback.""";

    private static final String COMMIT_ANALYSIS_SYSTEM = """
            You are a commit analysis agent. Analyze commit messages and changes to provide insights about:
            1. Commit message quality
            2. Change impact assessment
            3. Development patterns
            4. Team collaboration insights
            5. Project health indicators

            Provide concise, valuable feedback.""";

    private PromptUtils() {}

    public static String systemPrompt(AgentKind kind) {
        return switch (kind) {
            case CODE_ANALYSIS -> CODE_ANALYSIS_SYSTEM;
            case COMMIT_ANALYSIS -> COMMIT_ANALYSIS_SYSTEM;
        };
    }

    /**
     * Commit header + agent-specific focus + the diff summary.
     */
    public static String userPrompt(AgentKind kind, CommitSnapshot commit, String diffSummary) {
        var sb = new StringBuilder();
        sb.append("Analyze the following commit:\n\n");
        sb.append("Repository: ").append(commit.repositoryFullName()).append('\n');
        sb.append("Hash: ").append(commit.hash()).append('\n');
        sb.append("Author: ").append(orUnknown(commit.author())).append('\n');
        sb.append("Branch: ").append(orUnknown(commit.branch())).append('\n');
        sb.append("Timestamp: ").append(commit.committedAt() != null ? commit.committedAt() : "unknown").append('\n');
        sb.append("Message: ").append(orUnknown(commit.message())).append('\n');
        sb.append("Changed Files: ").append(commit.changedFiles().size()).append(" files\n");

        sb.append(switch (kind) {
            case CODE_ANALYSIS -> """

                    Please provide a comprehensive code analysis including code quality, potential \
                    issues or bugs, security considerations, performance implications and suggestions \
                    for improvement. Focus on the technical aspects.
                    """;
            case COMMIT_ANALYSIS -> """

                    Please provide insights about commit message quality and clarity, change impact \
                    and scope, and development patterns.
                    """;
        });

        sb.append("\n--- CHANGES ---\n")
          .append(diffSummary == null || diffSummary.isBlank() ? "(no file changes reported)" : diffSummary)
          .append("\n--- END CHANGES ---");
        return sb.toString();
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }
}
