package dev.craftnudge.domain.valueobject;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Detached view of a stored commit handed to the analysis engine.
 * Never a managed entity, since analysis runs on its own threads.
 */
public record CommitSnapshot(
        UUID commitId,
        String repositoryFullName,
        String hash,
        String author,
        String message,
        Instant committedAt,
        String branch,
        List<ChangedFile> changedFiles
) {
    public static CommitSnapshot of(UUID commitId, RepositoryAttributes repository, CommitAttributes commit) {
        return new CommitSnapshot(commitId, repository.fullName(), commit.hash(), commit.author(),
                commit.message(), commit.committedAt(), commit.branch(), commit.changedFiles());
    }

    /** One line per changed file, e.g. {@code M src/App.java}. */
    public String diffSummary() {
        if (changedFiles.isEmpty()) return "(no file changes reported)";
        return changedFiles.stream()
                .map(f -> f.changeKind().shortCode() + " " + f.path())
                .collect(Collectors.joining("\n"));
    }

    public String shortHash() {
        return hash.length() > 7 ? hash.substring(0, 7) : hash;
    }
}
