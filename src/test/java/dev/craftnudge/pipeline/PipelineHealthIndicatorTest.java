package dev.craftnudge.pipeline;

import dev.craftnudge.exception.StoreUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PipelineHealthIndicatorTest {

  private final PipelineOrchestrator orchestrator = mock(PipelineOrchestrator.class);
  private final PipelineHealthIndicator indicator = new PipelineHealthIndicator(orchestrator);

  @Test
  @DisplayName("UP with queue counts")
  void up() {
    when(orchestrator.status()).thenReturn(new PipelineStatus(true, Instant.parse("2024-05-01T12:00:00Z"),
        Duration.ofSeconds(30), 2, 1, 0, 3, 40));

    Health health = indicator.health();

    assertThat(health.getStatus()).isEqualTo(Status.UP);
    assertThat(health.getDetails())
        .containsEntry("running", true)
        .containsEntry("pending", 2L)
        .containsEntry("failedPermanent", 3L)
        .containsEntry("lastCycleAt", "2024-05-01T12:00:00Z");
  }

  @Test
  @DisplayName("DOWN when the store is unreachable")
  void down() {
    when(orchestrator.status()).thenThrow(new StoreUnavailableException("countEvents", new RuntimeException("refused")));

    assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
  }
}
