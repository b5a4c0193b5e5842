package dev.craftnudge.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.craftnudge.domain.entity.IngestionEvent;
import dev.craftnudge.domain.enums.ChangeKind;
import dev.craftnudge.domain.enums.Visibility;
import dev.craftnudge.domain.valueobject.ChangedFile;
import dev.craftnudge.domain.valueobject.CommitAttributes;
import dev.craftnudge.domain.valueobject.NormalizedCommit;
import dev.craftnudge.domain.valueobject.RepositoryAttributes;
import dev.craftnudge.dto.request.PolledCommitPayload;
import dev.craftnudge.dto.request.PullRequestPayload;
import dev.craftnudge.dto.request.PushPayload;
import dev.craftnudge.exception.MalformedPayloadException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a stored event payload into canonical (repository, commit) pairs.
 *
 * <p>Pure: no I/O besides parsing, same output for the same event. Output
 * order equals payload order. Anything it cannot interpret is a
 * {@link MalformedPayloadException}, which the dispatcher never retries.
 * Identity fields longer than their column are malformed; descriptive fields
 * are cut to fit.
 */
@Component
public class EventNormalizer {

    public static final String PUSH = "push";
    public static final String PULL_REQUEST = "pull_request";
    public static final String POLLED_COMMIT = "commit";

    /** Webhook event types the receiver queues. */
    public static final Set<String> WEBHOOK_TYPES = Set.of(PUSH, PULL_REQUEST);

    // actions that put a new head commit on the pull request
    private static final Set<String> HEAD_CHANGING_ACTIONS = Set.of("opened", "reopened", "synchronize");

    // column sizes of the repositories and commits tables
    static final int MAX_HASH_LENGTH = 64;
    static final int MAX_IDENTITY_LENGTH = 255;
    static final int MAX_TEXT_LENGTH = 255;
    static final int MAX_LANGUAGE_LENGTH = 100;
    static final int MAX_DESCRIPTION_LENGTH = 2000;

    private final ObjectMapper objectMapper;

    public EventNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<NormalizedCommit> normalize(IngestionEvent event) {
        return switch (event.getEventType()) {
            case PUSH -> normalizePush(event);
            case PULL_REQUEST -> normalizePullRequest(event);
            case POLLED_COMMIT -> normalizePolled(event);
            default -> throw new MalformedPayloadException("Unsupported event type: " + event.getEventType());
        };
    }

    private List<NormalizedCommit> normalizePush(IngestionEvent event) {
        PushPayload push = read(event, PushPayload.class);
        RepositoryAttributes repository = webhookRepository(push.repository());
        if (push.commits() == null || push.commits().isEmpty()) return List.of();

        List<NormalizedCommit> result = new ArrayList<>(push.commits().size());
        for (PushPayload.PushCommit commit : push.commits()) {
            if (commit == null || isBlank(commit.id()))
                throw new MalformedPayloadException("Push commit without id in event " + event.getId());

            List<ChangedFile> files = new ArrayList<>();
            addFiles(files, commit.added(), ChangeKind.ADDED);
            addFiles(files, commit.modified(), ChangeKind.MODIFIED);
            addFiles(files, commit.removed(), ChangeKind.DELETED);

            Map<String, Object> metadata = baseMetadata(event);
            if (push.pusher() != null) metadata.put("pusher", push.pusher().name());
            if (push.headCommit() != null) metadata.put("headCommit", push.headCommit().id());
            metadata.put("url", commit.url());

            result.add(new NormalizedCommit(repository, commitAttributes(
                    commit.id(),
                    pushAuthor(commit.author()),
                    commit.message(),
                    parseTimestamp(commit.timestamp(), commit.id()),
                    push.branch(),
                    files,
                    metadata)));
        }
        return result;
    }

    /**
     * A pull request yields its head commit, keyed by the head sha, when the
     * action moved the head. Other actions (closed, labeled, edited) yield
     * nothing.
     */
    private List<NormalizedCommit> normalizePullRequest(IngestionEvent event) {
        PullRequestPayload payload = read(event, PullRequestPayload.class);
        PullRequestPayload.PullRequest pr = payload.pullRequest();
        if (pr == null)
            throw new MalformedPayloadException("Pull request delivery without pull_request in event " + event.getId());
        RepositoryAttributes repository = webhookRepository(payload.repository());
        if (!HEAD_CHANGING_ACTIONS.contains(payload.action())) return List.of();
        if (pr.head() == null || isBlank(pr.head().sha()))
            throw new MalformedPayloadException("Pull request without head sha in event " + event.getId());

        Map<String, Object> metadata = baseMetadata(event);
        metadata.put("pullRequest", pr.number() != null ? pr.number() : payload.number());
        metadata.put("action", payload.action());
        metadata.put("title", pr.title());
        metadata.put("url", pr.htmlUrl());
        if (pr.base() != null) {
            metadata.put("baseSha", pr.base().sha());
            metadata.put("baseBranch", pr.base().ref());
        }
        return List.of(new NormalizedCommit(repository, commitAttributes(
                pr.head().sha(),
                pr.user() != null ? pr.user().login() : null,
                null,
                null,
                pr.head().ref(),
                List.of(),
                metadata)));
    }

    private List<NormalizedCommit> normalizePolled(IngestionEvent event) {
        PolledCommitPayload polled = read(event, PolledCommitPayload.class);
        PolledCommitPayload.Repository repo = polled.repository();
        if (repo == null || isBlank(repo.owner()) || isBlank(repo.name()))
            throw new MalformedPayloadException("Polled commit without repository identity in event " + event.getId());
        PolledCommitPayload.CommitInfo commit = polled.commit();
        if (commit == null || isBlank(commit.sha()))
            throw new MalformedPayloadException("Polled commit without sha in event " + event.getId());

        List<ChangedFile> files = new ArrayList<>();
        if (commit.files() != null) {
            for (PolledCommitPayload.FileChange f : commit.files()) {
                if (f == null || isBlank(f.filename())) continue;
                files.add(new ChangedFile(f.filename(), ChangeKind.fromUpstreamStatus(f.status())));
            }
        }
        Map<String, Object> metadata = baseMetadata(event);
        metadata.put("url", commit.url());

        RepositoryAttributes repository = repositoryAttributes(repo.owner(), repo.name(),
                repo.description(), repo.language(), repo.isPrivate());
        return List.of(new NormalizedCommit(repository, commitAttributes(
                commit.sha(), commit.author(), commit.message(),
                parseTimestamp(commit.timestamp(), commit.sha()),
                commit.branch(), files, metadata)));
    }

    private RepositoryAttributes webhookRepository(PushPayload.Repository repo) {
        if (repo == null) throw new MalformedPayloadException("Delivery without repository");
        String owner = null;
        String name = repo.name();
        if (repo.owner() != null)
            owner = !isBlank(repo.owner().login()) ? repo.owner().login() : repo.owner().name();
        if (!isBlank(repo.fullName()) && repo.fullName().contains("/")) {
            String[] parts = repo.fullName().split("/", 2);
            if (isBlank(owner)) owner = parts[0];
            if (isBlank(name)) name = parts[1];
        }
        if (isBlank(owner) || isBlank(name))
            throw new MalformedPayloadException("Delivery without repository owner/name");
        return repositoryAttributes(owner, name, repo.description(), repo.language(), repo.isPrivate());
    }

    private static RepositoryAttributes repositoryAttributes(String owner, String name, String description,
                                                             String language, Boolean isPrivate) {
        requireFits("repository owner", owner, MAX_IDENTITY_LENGTH);
        requireFits("repository name", name, MAX_IDENTITY_LENGTH);
        return new RepositoryAttributes(owner, name, truncate(description, MAX_DESCRIPTION_LENGTH),
                truncate(language, MAX_LANGUAGE_LENGTH), visibility(isPrivate));
    }

    private static CommitAttributes commitAttributes(String hash, String author, String message, Instant committedAt,
                                                     String branch, List<ChangedFile> files,
                                                     Map<String, Object> metadata) {
        requireFits("commit id", hash, MAX_HASH_LENGTH);
        return new CommitAttributes(hash, truncate(author, MAX_TEXT_LENGTH), message, committedAt,
                truncate(branch, MAX_TEXT_LENGTH), files, metadata);
    }

    private static void requireFits(String field, String value, int maxLength) {
        if (value.length() > maxLength)
            throw new MalformedPayloadException("%s longer than %d characters: %s..."
                    .formatted(field, maxLength, value.substring(0, 16)));
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) return value;
        return value.substring(0, maxLength);
    }

    private <T> T read(IngestionEvent event, Class<T> type) {
        try {
            T value = objectMapper.readValue(event.getPayload(), type);
            if (value == null) throw new MalformedPayloadException("Empty payload in event " + event.getId());
            return value;
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("Unparsable payload in event " + event.getId(), e);
        }
    }

    private static Map<String, Object> baseMetadata(IngestionEvent event) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source", event.getSource().name());
        metadata.put("deliveryId", event.getDeliveryId());
        return metadata;
    }

    private static Visibility visibility(Boolean isPrivate) {
        return isPrivate == null ? null : Visibility.ofPrivateFlag(isPrivate);
    }

    private static void addFiles(List<ChangedFile> target, List<String> paths, ChangeKind kind) {
        if (paths == null) return;
        for (String path : paths) {
            if (!isBlank(path)) target.add(new ChangedFile(path, kind));
        }
    }

    private static String pushAuthor(PushPayload.Author author) {
        if (author == null) return null;
        return !isBlank(author.name()) ? author.name() : author.username();
    }

    private static Instant parseTimestamp(String value, String hash) {
        if (isBlank(value)) return null;
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw new MalformedPayloadException("Unparsable timestamp '%s' for commit %s".formatted(value, hash), e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
