package dev.craftnudge.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Payload of a poll-discovered commit, written by the reconciliation poller
 * and read back by the normalizer. timestamp is ISO-8601.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PolledCommitPayload(Repository repository, CommitInfo commit) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Repository(String owner, String name, String description, String language,
                             @JsonProperty("private") Boolean isPrivate) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CommitInfo(String sha, String message, String author, String timestamp,
                             String url, String branch, List<FileChange> files) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FileChange(String filename, String status) {}
}
