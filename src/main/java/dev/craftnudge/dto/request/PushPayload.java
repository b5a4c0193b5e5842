package dev.craftnudge.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The parts of a GitHub {@code push} delivery the pipeline reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PushPayload(
        String ref,
        Repository repository,
        List<PushCommit> commits,
        Pusher pusher,
        @JsonProperty("head_commit") PushCommit headCommit
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Repository(String name, @JsonProperty("full_name") String fullName, Owner owner,
                             String description, String language,
                             @JsonProperty("private") Boolean isPrivate) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Owner(String login, String name) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PushCommit(String id, String message, String timestamp, String url, Author author,
                             List<String> added, List<String> modified, List<String> removed) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Author(String name, String username, String email) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Pusher(String name, String email) {}

    public String branch() {
        if (ref == null) return null;
        return ref.startsWith("refs/heads/") ? ref.substring("refs/heads/".length()) : ref;
    }
}
