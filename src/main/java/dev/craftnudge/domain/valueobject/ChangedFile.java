package dev.craftnudge.domain.valueobject;

import dev.craftnudge.domain.enums.ChangeKind;

/**
 * One file touched by a commit.
 */
public record ChangedFile(String path, ChangeKind changeKind) {
    public ChangedFile {
        if (path == null || path.isBlank()) throw new IllegalArgumentException("path required");
        if (changeKind == null) changeKind = ChangeKind.MODIFIED;
    }
}
