package dev.craftnudge.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.craftnudge.config.PollerProperties;
import dev.craftnudge.domain.entity.TrackedRepository;
import dev.craftnudge.domain.enums.EventSource;
import dev.craftnudge.domain.event.EventReceivedEvent;
import dev.craftnudge.dto.request.PolledCommitPayload;
import dev.craftnudge.exception.StoreUnavailableException;
import dev.craftnudge.infrastructure.github.GitHubApiClient;
import dev.craftnudge.infrastructure.github.UpstreamCommit;
import dev.craftnudge.infrastructure.github.UpstreamRepository;
import dev.craftnudge.store.EntityStore;
import dev.craftnudge.store.EventReceipt;
import dev.craftnudge.store.NewEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Catches commits whose webhook delivery was lost. For every tracked
 * repository (stored ones plus configured seeds) it lists the most recent
 * upstream commits and queues a {@code POLL} event for each one the store
 * does not know yet.
 *
 * <p>Delivery ids are {@code poll:{owner}/{name}:{sha}}, so polling the same
 * commit again before it is processed queues nothing new.
 */
@Service
public class ReconciliationPoller {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationPoller.class);

    private final EntityStore store;
    private final GitHubApiClient gitHubClient;
    private final PollerProperties properties;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ReconciliationPoller(EntityStore store, GitHubApiClient gitHubClient, PollerProperties properties,
                                ObjectMapper objectMapper, ApplicationEventPublisher eventPublisher, Clock clock) {
        this.store = store;
        this.gitHubClient = gitHubClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return properties.enabled();
    }

    public PollReport poll() {
        Set<RepoRef> tracked = trackedRepositories();
        int discovered = 0, queued = 0, duplicates = 0, failed = 0;
        for (RepoRef repo : tracked) {
            try {
                RepoResult result = pollRepository(repo);
                discovered += result.discovered();
                queued += result.queued();
                duplicates += result.duplicates();
            } catch (StoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                failed++;
                log.warn("Polling {} failed, continuing with the next repository: {}", repo, e.getMessage());
            }
        }
        PollReport report = new PollReport(tracked.size(), discovered, queued, duplicates, failed);
        log.info("Reconciliation pass finished: {}", report);
        return report;
    }

    private RepoResult pollRepository(RepoRef repo) {
        List<String> unknown = new ArrayList<>();
        for (String sha : gitHubClient.listRecentCommitShas(repo.owner(), repo.name(), properties.commitsPerRepository())) {
            if (!store.commitExists(repo.owner(), repo.name(), sha)) unknown.add(sha);
        }
        if (unknown.isEmpty()) return new RepoResult(0, 0, 0);

        UpstreamRepository upstream = gitHubClient.getRepository(repo.owner(), repo.name());
        // Upstream lists newest first; queue oldest first
        Collections.reverse(unknown);
        int queued = 0, duplicates = 0;
        for (String sha : unknown) {
            UpstreamCommit commit = gitHubClient.getCommit(repo.owner(), repo.name(), sha);
            String deliveryId = "poll:%s:%s".formatted(repo, sha);
            EventReceipt receipt = store.recordEvent(new NewEvent(EventSource.POLL, deliveryId,
                    EventNormalizer.POLLED_COMMIT, toPayload(upstream, commit)));
            if (receipt.duplicate()) {
                duplicates++;
                continue;
            }
            queued++;
            eventPublisher.publishEvent(new EventReceivedEvent(
                    receipt.eventId(), EventSource.POLL, EventNormalizer.POLLED_COMMIT, clock.instant()));
            log.info("Queued poll event {} for {}@{}", receipt.eventId(), repo, sha);
        }
        return new RepoResult(unknown.size(), queued, duplicates);
    }

    private String toPayload(UpstreamRepository repo, UpstreamCommit commit) {
        List<PolledCommitPayload.FileChange> files = commit.files().stream()
                .map(f -> new PolledCommitPayload.FileChange(f.filename(), f.status()))
                .toList();
        PolledCommitPayload payload = new PolledCommitPayload(
                new PolledCommitPayload.Repository(repo.owner(), repo.name(), repo.description(),
                        repo.language(), repo.isPrivate()),
                new PolledCommitPayload.CommitInfo(commit.sha(), commit.message(), commit.author(),
                        commit.committedAt() != null ? commit.committedAt().toString() : null,
                        commit.htmlUrl(), repo.defaultBranch(), files));
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize polled commit " + commit.sha(), e);
        }
    }

    private Set<RepoRef> trackedRepositories() {
        Set<RepoRef> tracked = new LinkedHashSet<>();
        for (TrackedRepository repo : store.listRepositories())
            tracked.add(new RepoRef(repo.getOwner(), repo.getName()));
        for (String seed : properties.repositories()) {
            String[] parts = seed.trim().split("/");
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                log.warn("Ignoring malformed repository seed '{}', expected owner/name", seed);
                continue;
            }
            tracked.add(new RepoRef(parts[0], parts[1]));
        }
        return tracked;
    }

    private record RepoRef(String owner, String name) {
        @Override
        public String toString() {
            return owner + "/" + name;
        }
    }

    private record RepoResult(int discovered, int queued, int duplicates) {}
}
