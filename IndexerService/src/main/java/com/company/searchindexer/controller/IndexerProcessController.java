package com.company.searchindexer.controller;

import com.company.searchindexer.service.IndexerJobService;
import com.company.searchindexer.service.StopOutcome;
import common.indexer.dto.IndexerJobView;
import common.indexer.dto.JobLogsResponse;
import common.indexer.dto.StartIndexerRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Tag(name = "Indexer Processes", description = "Arranque, seguimiento y parada de procesos de indexación")
@RestController
@RequestMapping("/api/v1/processes")
@RequiredArgsConstructor
@Slf4j
public class IndexerProcessController {

    private final IndexerJobService indexerJobService;

    @Operation(summary = "Arranca un proceso de indexación en segundo plano")
    @PostMapping("/start")
    public ResponseEntity<IndexerJobView> start(@RequestBody StartIndexerRequest request,
                                                @RequestHeader(value = "X-User-Id", required = false) Long userId) {
        IndexerJobView job = indexerJobService.start(request, userId);
        log.info("✅ Proceso {} arrancado por el usuario {}", job.getId(), userId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    @GetMapping
    public List<IndexerJobView> list(@RequestParam(required = false) String status,
                                     @RequestParam(required = false) String type,
                                     @RequestParam(value = "user_id", required = false) Long userId,
                                     @RequestParam(defaultValue = "50") int limit,
                                     @RequestParam(defaultValue = "0") int offset) {
        return indexerJobService.list(status, type, userId, limit, offset);
    }

    @GetMapping("/{id}")
    public IndexerJobView get(@PathVariable Long id) {
        return indexerJobService.get(id);
    }

    @Operation(summary = "Solicita la parada de un proceso")
    @PostMapping("/{id}/stop")
    public ResponseEntity<Map<String, Object>> stop(@PathVariable Long id) {
        StopOutcome outcome = indexerJobService.stop(id);

        Map<String, Object> response = new HashMap<>();
        response.put("id", id);
        response.put("outcome", outcome);
        response.put("message", outcome == StopOutcome.NOT_RUNNING
                ? "Process " + id + " is not running"
                : "Process " + id + " stop requested");
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Últimas líneas de log de un proceso, opcionalmente desde un timestamp")
    @GetMapping("/{id}/logs")
    public JobLogsResponse logs(@PathVariable Long id, @RequestParam(required = false) String since) {
        return indexerJobService.logs(id, since);
    }
}
