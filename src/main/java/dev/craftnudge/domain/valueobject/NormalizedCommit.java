package dev.craftnudge.domain.valueobject;

/**
 * One unit of normalizer output: the commit and the repository it belongs to.
 */
public record NormalizedCommit(RepositoryAttributes repository, CommitAttributes commit) {
    public NormalizedCommit {
        if (repository == null || commit == null)
            throw new IllegalArgumentException("repository and commit required");
    }
}
