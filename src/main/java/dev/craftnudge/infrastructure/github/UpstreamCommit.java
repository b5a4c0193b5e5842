package dev.craftnudge.infrastructure.github;

import java.time.Instant;
import java.util.List;

/**
 * One commit as reported by {@code GET /repos/{owner}/{repo}/commits/{sha}}.
 */
public record UpstreamCommit(String sha, String message, String author, Instant committedAt,
                             String htmlUrl, List<File> files) {
    public UpstreamCommit {
        files = files == null ? List.of() : List.copyOf(files);
    }

    /** status is the upstream value: added, modified, removed, renamed, ... */
    public record File(String filename, String status) {}
}
