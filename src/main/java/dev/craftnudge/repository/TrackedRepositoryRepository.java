package dev.craftnudge.repository;

import dev.craftnudge.domain.entity.TrackedRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TrackedRepositoryRepository extends JpaRepository<TrackedRepository, UUID> {
    Optional<TrackedRepository> findByOwnerAndName(String owner, String name);
    List<TrackedRepository> findAllByOrderByOwnerAscNameAsc();
}
