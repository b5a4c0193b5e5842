package dev.craftnudge.store;

import java.util.UUID;

/**
 * Result of an idempotent commit write. wasNew is true for exactly one caller per identity.
 */
public record CommitUpsert(UUID commitId, boolean wasNew) {
}
