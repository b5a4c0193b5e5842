package dev.craftnudge.controller;

import dev.craftnudge.domain.enums.EventState;
import dev.craftnudge.dto.response.EventStatisticsResponse;
import dev.craftnudge.dto.response.EventSummaryResponse;
import dev.craftnudge.dto.response.PipelineStatusResponse;
import dev.craftnudge.pipeline.CycleReport;
import dev.craftnudge.pipeline.PipelineOrchestrator;
import dev.craftnudge.service.EventQueryService;
import dev.craftnudge.service.EventReplayService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Operator surface: lifecycle control, the list of events needing attention,
 * replay and ingestion statistics.
 */
@RestController
@RequestMapping("/pipeline")
public class PipelineController {
    private final PipelineOrchestrator orchestrator;
    private final EventQueryService queryService;
    private final EventReplayService replayService;

    public PipelineController(PipelineOrchestrator orchestrator, EventQueryService queryService,
                              EventReplayService replayService) {
        this.orchestrator = orchestrator;
        this.queryService = queryService;
        this.replayService = replayService;
    }

    @GetMapping("/status")
    public PipelineStatusResponse status() {
        return PipelineStatusResponse.from(orchestrator.status());
    }

    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start(@RequestParam(required = false) Long intervalSeconds) {
        if (intervalSeconds != null && intervalSeconds <= 0)
            throw new IllegalArgumentException("intervalSeconds must be positive");
        boolean started = orchestrator.start(intervalSeconds != null ? Duration.ofSeconds(intervalSeconds) : null);
        return ResponseEntity.ok(Map.of("status", started ? "started" : "already running"));
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        boolean stopped = orchestrator.stop();
        return ResponseEntity.ok(Map.of("status", stopped ? "stopped" : "not running"));
    }

    @PostMapping("/run-once")
    public CycleReport runOnce() {
        return orchestrator.runOnce();
    }

    @GetMapping("/events")
    public List<EventSummaryResponse> events(@RequestParam(defaultValue = "FAILED_PERMANENT") EventState state,
                                             @RequestParam(defaultValue = "50") int limit) {
        return queryService.findByState(state, limit);
    }

    @PostMapping("/events/{id}/replay")
    public ResponseEntity<Map<String, Object>> replay(@PathVariable UUID id) {
        return replayService.replay(id)
                .<ResponseEntity<Map<String, Object>>>map(copy -> ResponseEntity.status(HttpStatus.ACCEPTED)
                        .body(Map.of("status", "queued", "eventId", copy.getId().toString(),
                                "replayOf", id.toString())))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/statistics")
    public EventStatisticsResponse statistics() {
        return queryService.statistics();
    }
}
