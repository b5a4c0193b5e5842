package dev.craftnudge.domain.valueobject;

import dev.craftnudge.domain.enums.Visibility;

/**
 * Identity plus descriptive fields of a repository as seen in a payload.
 * Only owner and name are required; the rest may be absent from poll payloads.
 */
public record RepositoryAttributes(String owner, String name, String description,
                                   String language, Visibility visibility) {
    public RepositoryAttributes {
        if (owner == null || owner.isBlank()) throw new IllegalArgumentException("owner required");
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name required");
    }

    public static RepositoryAttributes of(String owner, String name) {
        return new RepositoryAttributes(owner, name, null, null, null);
    }

    public String fullName() {
        return owner + "/" + name;
    }
}
