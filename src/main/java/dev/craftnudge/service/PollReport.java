package dev.craftnudge.service;

/**
 * Summary of one reconciliation pass. discovered counts upstream commits
 * unknown to the store; queued those that became new events.
 */
public record PollReport(int repositories, int discovered, int queued, int duplicates, int failedRepositories) {

    public static PollReport skipped() {
        return new PollReport(0, 0, 0, 0, 0);
    }
}
