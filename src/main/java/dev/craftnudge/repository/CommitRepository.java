package dev.craftnudge.repository;

import dev.craftnudge.domain.entity.Commit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CommitRepository extends JpaRepository<Commit, UUID> {
    Optional<Commit> findByRepositoryIdAndCommitHash(UUID repositoryId, String commitHash);
    boolean existsByRepositoryIdAndCommitHash(UUID repositoryId, String commitHash);
    long countByRepositoryId(UUID repositoryId);
}
