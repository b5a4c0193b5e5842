package dev.craftnudge.pipeline;

/**
 * What one worker did with one claimable event id.
 */
public enum DispatchOutcome {
    DONE,
    FAILED_TRANSIENT,
    FAILED_PERMANENT,
    /** Another worker claimed it first, it was no longer claimable, or the dispatcher was halted. */
    NOT_CLAIMED,
    /** The outcome could not be recorded; the claim goes stale and is reclaimed later. */
    ABANDONED
}
