package dev.craftnudge.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle: PENDING → IN_PROGRESS → DONE | FAILED_TRANSIENT | FAILED_PERMANENT.
 * FAILED_TRANSIENT goes back to IN_PROGRESS once its backoff has expired.
 */
public enum EventState {
    PENDING, IN_PROGRESS, DONE, FAILED_TRANSIENT, FAILED_PERMANENT;

    private static final Set<EventState> TERMINAL = EnumSet.of(DONE, FAILED_PERMANENT);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
