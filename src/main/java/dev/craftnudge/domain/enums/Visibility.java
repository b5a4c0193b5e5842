package dev.craftnudge.domain.enums;

public enum Visibility {
    PUBLIC, PRIVATE;

    public static Visibility ofPrivateFlag(Boolean isPrivate) {
        return Boolean.TRUE.equals(isPrivate) ? PRIVATE : PUBLIC;
    }
}
