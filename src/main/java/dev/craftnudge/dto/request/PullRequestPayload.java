package dev.craftnudge.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The parts of a GitHub {@code pull_request} delivery the pipeline reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PullRequestPayload(
        String action,
        Integer number,
        @JsonProperty("pull_request") PullRequest pullRequest,
        PushPayload.Repository repository
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PullRequest(Integer number, String title, String state,
                              @JsonProperty("html_url") String htmlUrl,
                              User user, Ref head, Ref base) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(String login) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Ref(String sha, String ref) {}
}
