package dev.craftnudge.infrastructure.github;

import com.fasterxml.jackson.databind.JsonNode;
import dev.craftnudge.config.GitHubProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * GitHub REST API client used by the reconciliation poller, with circuit
 * breaker and rate limiting. Calls block; they only ever run on the
 * pipeline's own threads.
 */
@Component
public class GitHubApiClient {
    private static final Logger log = LoggerFactory.getLogger(GitHubApiClient.class);
    private static final int MAX_PER_PAGE = 100;

    private final WebClient webClient;

    public GitHubApiClient(WebClient.Builder builder, GitHubProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(Duration.ofSeconds(30))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000);
        WebClient.Builder configured = builder.baseUrl(properties.apiBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github.v3+json");
        if (properties.apiToken() != null && !properties.apiToken().isBlank())
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiToken());
        else
            log.warn("No GitHub API token configured; polling uses unauthenticated rate limits");
        this.webClient = configured.build();
    }

    @CircuitBreaker(name = "github-api") @RateLimiter(name = "github-api")
    public UpstreamRepository getRepository(String owner, String name) {
        JsonNode repo = webClient.get()
                .uri("/repos/{owner}/{repo}", owner, name)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block();
        if (repo == null) throw new IllegalStateException("Empty repository response for " + owner + "/" + name);
        return new UpstreamRepository(owner, name,
                text(repo, "description"),
                text(repo, "language"),
                repo.path("private").asBoolean(false),
                text(repo, "default_branch"));
    }

    /** Hashes of the most recent commits on the default branch, newest first. */
    @CircuitBreaker(name = "github-api") @RateLimiter(name = "github-api")
    public List<String> listRecentCommitShas(String owner, String name, int limit) {
        int perPage = Math.max(1, Math.min(limit, MAX_PER_PAGE));
        JsonNode commits = webClient.get()
                .uri(b -> b.path("/repos/{owner}/{repo}/commits")
                        .queryParam("per_page", perPage)
                        .build(owner, name))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block();
        List<String> shas = new ArrayList<>();
        if (commits == null || !commits.isArray()) return shas;
        for (JsonNode commit : commits) {
            String sha = text(commit, "sha");
            if (sha != null) shas.add(sha);
        }
        log.debug("Listed {} recent commits for {}/{}", shas.size(), owner, name);
        return shas;
    }

    @CircuitBreaker(name = "github-api") @RateLimiter(name = "github-api")
    public UpstreamCommit getCommit(String owner, String name, String sha) {
        JsonNode commit = webClient.get()
                .uri("/repos/{owner}/{repo}/commits/{sha}", owner, name, sha)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block();
        if (commit == null) throw new IllegalStateException("Empty commit response for " + sha);

        JsonNode detail = commit.path("commit");
        List<UpstreamCommit.File> files = new ArrayList<>();
        for (JsonNode f : commit.path("files")) {
            String filename = text(f, "filename");
            if (filename != null) files.add(new UpstreamCommit.File(filename, text(f, "status")));
        }
        return new UpstreamCommit(
                text(commit, "sha"),
                text(detail, "message"),
                text(detail.path("author"), "name"),
                parseInstant(text(detail.path("author"), "date")),
                text(commit, "html_url"),
                files);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Instant parseInstant(String value) {
        if (value == null) return null;
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Unparsable commit date from upstream: {}", value);
            return null;
        }
    }
}
