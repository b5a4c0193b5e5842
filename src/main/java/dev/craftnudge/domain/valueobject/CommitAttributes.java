package dev.craftnudge.domain.valueobject;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Canonical attributes of one commit, independent of how it was delivered.
 */
public record CommitAttributes(
        String hash,
        String author,
        String message,
        Instant committedAt,
        String branch,
        List<ChangedFile> changedFiles,
        Map<String, Object> metadata
) {
    public CommitAttributes {
        if (hash == null || hash.isBlank()) throw new IllegalArgumentException("commit hash required");
        changedFiles = changedFiles == null ? List.of() : List.copyOf(changedFiles);
        metadata = metadata == null ? Map.of() : metadata.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }
}
