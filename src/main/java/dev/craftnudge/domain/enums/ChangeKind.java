package dev.craftnudge.domain.enums;

/**
 * How a file was touched by a commit. Upstream statuses that have no
 * dedicated constant fold into MODIFIED.
 */
public enum ChangeKind {
    ADDED, MODIFIED, DELETED, RENAMED;

    public static ChangeKind fromUpstreamStatus(String status) {
        if (status == null) return MODIFIED;
        return switch (status) {
            case "added" -> ADDED;
            case "removed", "deleted" -> DELETED;
            case "renamed" -> RENAMED;
            default -> MODIFIED;
        };
    }

    public char shortCode() {
        return name().charAt(0);
    }
}
