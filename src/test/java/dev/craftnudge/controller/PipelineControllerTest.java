package dev.craftnudge.controller;

import dev.craftnudge.config.SecurityConfig;
import dev.craftnudge.domain.enums.EventSource;
import dev.craftnudge.domain.enums.EventState;
import dev.craftnudge.dto.response.EventSummaryResponse;
import dev.craftnudge.pipeline.CycleReport;
import dev.craftnudge.pipeline.DrainReport;
import dev.craftnudge.pipeline.PipelineOrchestrator;
import dev.craftnudge.pipeline.PipelineStatus;
import dev.craftnudge.domain.entity.IngestionEvent;
import dev.craftnudge.dto.response.EventStatisticsResponse;
import dev.craftnudge.service.EventQueryService;
import dev.craftnudge.service.EventReplayService;
import dev.craftnudge.service.PollReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PipelineController.class)
@Import(SecurityConfig.class)
class PipelineControllerTest {

  @Autowired
  private MockMvc mockMvc;

  @MockitoBean
  private PipelineOrchestrator orchestrator;

  @MockitoBean
  private EventQueryService queryService;

  @MockitoBean
  private EventReplayService replayService;

  @Test
  @DisplayName("operator endpoints require credentials")
  void requiresAuthentication() throws Exception {
    mockMvc.perform(get("/pipeline/status")).andExpect(status().isUnauthorized());
    mockMvc.perform(post("/pipeline/run-once")).andExpect(status().isUnauthorized());
    mockMvc.perform(get("/pipeline/statistics")).andExpect(status().isUnauthorized());
    mockMvc.perform(post("/pipeline/events/{id}/replay", UUID.randomUUID())).andExpect(status().isUnauthorized());
    verifyNoInteractions(orchestrator, queryService, replayService);
  }

  @Nested
  @WithMockUser
  @DisplayName("lifecycle")
  class Lifecycle {

    @Test
    @DisplayName("status reports counts and interval")
    void statusReportsCounts() throws Exception {
      when(orchestrator.status()).thenReturn(new PipelineStatus(true, Instant.parse("2024-05-01T12:00:00Z"),
          Duration.ofSeconds(30), 3, 1, 2, 4, 10));

      mockMvc.perform(get("/pipeline/status"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.running").value(true))
          .andExpect(jsonPath("$.intervalSeconds").value(30))
          .andExpect(jsonPath("$.pending").value(3))
          .andExpect(jsonPath("$.failedPermanent").value(4))
          .andExpect(jsonPath("$.done").value(10));
    }

    @Test
    @DisplayName("start passes the interval through")
    void start() throws Exception {
      when(orchestrator.start(Duration.ofSeconds(15))).thenReturn(true);

      mockMvc.perform(post("/pipeline/start").param("intervalSeconds", "15"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.status").value("started"));
    }

    @Test
    @DisplayName("start while running is a no-op")
    void startTwice() throws Exception {
      when(orchestrator.start(null)).thenReturn(false);

      mockMvc.perform(post("/pipeline/start"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.status").value("already running"));
    }

    @Test
    @DisplayName("non-positive interval is rejected")
    void badInterval() throws Exception {
      mockMvc.perform(post("/pipeline/start").param("intervalSeconds", "0"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.detail").value("intervalSeconds must be positive"));
      verify(orchestrator, never()).start(any());
    }

    @Test
    @DisplayName("stop reports whether anything was running")
    void stop() throws Exception {
      when(orchestrator.stop()).thenReturn(false);

      mockMvc.perform(post("/pipeline/stop"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.status").value("not running"));
    }

    @Test
    @DisplayName("run-once returns the cycle report")
    void runOnce() throws Exception {
      Instant at = Instant.parse("2024-05-01T12:00:00Z");
      when(orchestrator.runOnce()).thenReturn(new CycleReport(at, at.plusSeconds(2), 1,
          new PollReport(2, 1, 1, 0, 0), new DrainReport(2, 2, 0, 0, 0, 0)));

      mockMvc.perform(post("/pipeline/run-once"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.reclaimed").value(1))
          .andExpect(jsonPath("$.poll.queued").value(1))
          .andExpect(jsonPath("$.drain.done").value(2));
    }
  }

  @Nested
  @WithMockUser
  @DisplayName("GET /pipeline/events")
  class Events {

    @Test
    @DisplayName("defaults to permanently failed events")
    void defaults() throws Exception {
      UUID id = UUID.randomUUID();
      when(queryService.findByState(EventState.FAILED_PERMANENT, 50)).thenReturn(List.of(
          new EventSummaryResponse(id, EventSource.WEBHOOK, "d-1", "push", EventState.FAILED_PERMANENT,
              1, "Malformed payload: bad json", Instant.parse("2024-05-01T12:00:00Z"), null,
              Instant.parse("2024-05-01T12:00:05Z"), null)));

      mockMvc.perform(get("/pipeline/events"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$[0].id").value(id.toString()))
          .andExpect(jsonPath("$[0].state").value("FAILED_PERMANENT"))
          .andExpect(jsonPath("$[0].lastError").value("Malformed payload: bad json"));
    }

    @Test
    @DisplayName("limit out of range is a 400")
    void badLimit() throws Exception {
      when(queryService.findByState(any(), eq(1000)))
          .thenThrow(new IllegalArgumentException("limit must be between 1 and 500"));

      mockMvc.perform(get("/pipeline/events").param("limit", "1000"))
          .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("unknown state is a 400")
    void badState() throws Exception {
      mockMvc.perform(get("/pipeline/events").param("state", "EXPLODED"))
          .andExpect(status().isBadRequest());
      verifyNoInteractions(queryService);
    }
  }

  @Nested
  @WithMockUser
  @DisplayName("POST /pipeline/events/{id}/replay")
  class Replay {

    @Test
    @DisplayName("terminal event is queued again as a new event")
    void queued() throws Exception {
      UUID original = UUID.randomUUID();
      IngestionEvent copy = IngestionEvent.create(EventSource.REPLAY, null, "push", "{}",
          Instant.parse("2024-05-01T12:00:00Z"));
      when(replayService.replay(original)).thenReturn(Optional.of(copy));

      mockMvc.perform(post("/pipeline/events/{id}/replay", original))
          .andExpect(status().isAccepted())
          .andExpect(jsonPath("$.status").value("queued"))
          .andExpect(jsonPath("$.eventId").value(copy.getId().toString()))
          .andExpect(jsonPath("$.replayOf").value(original.toString()));
    }

    @Test
    @DisplayName("unknown event is a 404")
    void unknown() throws Exception {
      when(replayService.replay(any())).thenReturn(Optional.empty());

      mockMvc.perform(post("/pipeline/events/{id}/replay", UUID.randomUUID()))
          .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("event that is not terminal is a 409")
    void notTerminal() throws Exception {
      when(replayService.replay(any()))
          .thenThrow(new IllegalStateException("only DONE or FAILED_PERMANENT events can be replayed"));

      mockMvc.perform(post("/pipeline/events/{id}/replay", UUID.randomUUID()))
          .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("malformed id is a 400")
    void badId() throws Exception {
      mockMvc.perform(post("/pipeline/events/not-a-uuid/replay"))
          .andExpect(status().isBadRequest());
      verifyNoInteractions(replayService);
    }
  }

  @Nested
  @WithMockUser
  @DisplayName("GET /pipeline/statistics")
  class Statistics {

    @Test
    @DisplayName("reports events by type, by state and for the last 24 hours")
    void counts() throws Exception {
      when(queryService.statistics()).thenReturn(new EventStatisticsResponse(12,
          Map.of("push", 9L, "pull_request", 3L), Map.of(EventState.DONE, 10L, EventState.PENDING, 2L),
          4, 2, 17, Instant.parse("2024-05-01T12:00:00Z")));

      mockMvc.perform(get("/pipeline/statistics"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.totalEvents").value(12))
          .andExpect(jsonPath("$.eventsByType.pull_request").value(3))
          .andExpect(jsonPath("$.eventsByState.DONE").value(10))
          .andExpect(jsonPath("$.eventsLast24h").value(4))
          .andExpect(jsonPath("$.commits").value(17));
    }
  }
}
