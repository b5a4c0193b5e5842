package dev.craftnudge.infrastructure.github;

/**
 * Repository metadata as reported by {@code GET /repos/{owner}/{repo}}.
 */
public record UpstreamRepository(String owner, String name, String description, String language,
                                 boolean isPrivate, String defaultBranch) {
}
