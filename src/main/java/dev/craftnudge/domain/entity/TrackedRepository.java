package dev.craftnudge.domain.entity;

import dev.craftnudge.domain.enums.Visibility;
import dev.craftnudge.domain.valueobject.RepositoryAttributes;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A source repository, identified by (owner, name). Created the first time a
 * commit of it is ingested and never deleted by the pipeline.
 */
@Entity
@Table(name = "repositories", uniqueConstraints = {
        @UniqueConstraint(name = "uk_repositories_owner_name", columnNames = {"owner", "name"})
})
public class TrackedRepository {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(nullable = false)
    private String owner;

    @Column(nullable = false)
    private String name;

    @Column(length = 2000)
    private String description;

    @Column(length = 100)
    private String language;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private Visibility visibility;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected TrackedRepository() {
    }

    public static TrackedRepository create(RepositoryAttributes attrs, Instant now) {
        TrackedRepository r = new TrackedRepository();
        r.id = UUID.randomUUID();
        r.owner = attrs.owner();
        r.name = attrs.name();
        r.description = attrs.description();
        r.language = attrs.language();
        r.visibility = attrs.visibility();
        r.createdAt = now;
        r.updatedAt = now;
        return r;
    }

    /**
     * Applies the descriptive fields present in {@code attrs}; absent ones keep
     * their stored value. Returns true when something changed.
     */
    public boolean refresh(RepositoryAttributes attrs, Instant now) {
        boolean changed = false;
        if (attrs.description() != null && !attrs.description().equals(description)) {
            description = attrs.description();
            changed = true;
        }
        if (attrs.language() != null && !attrs.language().equals(language)) {
            language = attrs.language();
            changed = true;
        }
        if (attrs.visibility() != null && attrs.visibility() != visibility) {
            visibility = attrs.visibility();
            changed = true;
        }
        if (changed) updatedAt = now;
        return changed;
    }

    public UUID getId() {
        return id;
    }

    public String getOwner() {
        return owner;
    }

    public String getName() {
        return name;
    }

    public String getFullName() {
        return owner + "/" + name;
    }

    public String getDescription() {
        return description;
    }

    public String getLanguage() {
        return language;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
