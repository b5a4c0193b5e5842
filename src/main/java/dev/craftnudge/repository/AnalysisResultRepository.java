package dev.craftnudge.repository;

import dev.craftnudge.domain.entity.AnalysisResult;
import dev.craftnudge.domain.enums.AgentKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AnalysisResultRepository extends JpaRepository<AnalysisResult, UUID> {
    Optional<AnalysisResult> findByCommitIdAndAgentKind(UUID commitId, AgentKind agentKind);
    List<AnalysisResult> findByCommitIdOrderByAgentKindAsc(UUID commitId);
}
