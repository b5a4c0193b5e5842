package dev.craftnudge.pipeline;

import java.util.List;

/**
 * Summary of one dispatcher drain.
 */
public record DrainReport(int candidates, int done, int failedTransient, int failedPermanent,
                          int notClaimed, int abandoned) {

    public static DrainReport empty() {
        return new DrainReport(0, 0, 0, 0, 0, 0);
    }

    public static DrainReport of(int candidates, List<DispatchOutcome> outcomes) {
        int done = 0, failedTransient = 0, failedPermanent = 0, notClaimed = 0, abandoned = 0;
        for (DispatchOutcome outcome : outcomes) {
            switch (outcome) {
                case DONE -> done++;
                case FAILED_TRANSIENT -> failedTransient++;
                case FAILED_PERMANENT -> failedPermanent++;
                case NOT_CLAIMED -> notClaimed++;
                case ABANDONED -> abandoned++;
            }
        }
        return new DrainReport(candidates, done, failedTransient, failedPermanent, notClaimed, abandoned);
    }

    /** Events this drain moved to a new state. */
    public int processed() {
        return done + failedTransient + failedPermanent;
    }
}
