package dev.craftnudge.domain.entity;

import dev.craftnudge.domain.valueobject.ChangedFile;
import dev.craftnudge.domain.valueobject.CommitAttributes;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Canonical record of one commit, unique per (repository, hash).
 *
 * <p>The changed-file list is a JSONB column of the same row, so a commit and
 * its files are written by a single insert.
 */
@Entity
@Table(name = "commits", uniqueConstraints = {
        @UniqueConstraint(name = "uk_commits_repository_hash", columnNames = {"repository_id", "commit_hash"})
}, indexes = {
        @Index(name = "idx_commits_committed_at", columnList = "committed_at")
})
public class Commit {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "repository_id", nullable = false, columnDefinition = "uuid")
    private UUID repositoryId;

    @Column(name = "commit_hash", nullable = false, length = 64)
    private String commitHash;

    @Column(length = 255)
    private String author;

    @Column(columnDefinition = "text")
    private String message;

    @Column(name = "committed_at")
    private Instant committedAt;

    @Column(length = 255)
    private String branch;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "changed_files", columnDefinition = "jsonb", nullable = false)
    private List<ChangedFile> changedFiles = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb", nullable = false)
    private Map<String, Object> metadata = new HashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Commit() {
    }

    public static Commit create(UUID repositoryId, CommitAttributes attrs, Instant now) {
        Commit c = new Commit();
        c.id = UUID.randomUUID();
        c.repositoryId = repositoryId;
        c.commitHash = attrs.hash();
        c.author = attrs.author();
        c.message = attrs.message();
        c.committedAt = attrs.committedAt();
        c.branch = attrs.branch();
        c.changedFiles = new ArrayList<>(attrs.changedFiles());
        c.metadata = new HashMap<>(attrs.metadata());
        c.createdAt = now;
        return c;
    }

    public UUID getId() {
        return id;
    }

    public UUID getRepositoryId() {
        return repositoryId;
    }

    public String getCommitHash() {
        return commitHash;
    }

    public String getAuthor() {
        return author;
    }

    public String getMessage() {
        return message;
    }

    public Instant getCommittedAt() {
        return committedAt;
    }

    public String getBranch() {
        return branch;
    }

    public List<ChangedFile> getChangedFiles() {
        return List.copyOf(changedFiles);
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
