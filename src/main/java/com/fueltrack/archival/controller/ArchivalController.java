package com.fueltrack.archival.controller;

import com.fueltrack.archival.dto.ArchivalRunResult;
import com.fueltrack.archival.dto.ArchivalStats;
import com.fueltrack.archival.dto.ArchivedRecordsResponse;
import com.fueltrack.archival.dto.EntityTypeDTO;
import com.fueltrack.archival.dto.ExportRequest;
import com.fueltrack.archival.dto.QueryArchivedRequest;
import com.fueltrack.archival.dto.RestoreRequest;
import com.fueltrack.archival.dto.RestoreResult;
import com.fueltrack.archival.dto.RunArchivalRequest;
import com.fueltrack.archival.dto.UnifiedExportResponse;
import com.fueltrack.archival.model.ArchivalJob;
import com.fueltrack.archival.service.ArchivalJobService;
import com.fueltrack.archival.service.ArchivalOrchestrator;
import com.fueltrack.archival.service.ArchivalStatsReporter;
import com.fueltrack.archival.service.ArchiveRestorer;
import com.fueltrack.archival.service.ArchivedRecordQueryService;
import com.fueltrack.archival.service.UnifiedExportService;
import com.fueltrack.archival.store.EntityTypeRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.security.Principal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/archival")
@Tag(name = "Archival")
@Slf4j
public class ArchivalController {

    private final ArchivalOrchestrator orchestrator;
    private final ArchiveRestorer restorer;
    private final ArchivalStatsReporter statsReporter;
    private final ArchivedRecordQueryService queryService;
    private final UnifiedExportService exportService;
    private final ArchivalJobService jobService;
    private final EntityTypeRegistry registry;

    public ArchivalController(ArchivalOrchestrator orchestrator, ArchiveRestorer restorer,
            ArchivalStatsReporter statsReporter, ArchivedRecordQueryService queryService,
            UnifiedExportService exportService, ArchivalJobService jobService, EntityTypeRegistry registry) {
        this.orchestrator = orchestrator;
        this.restorer = restorer;
        this.statsReporter = statsReporter;
        this.queryService = queryService;
        this.exportService = exportService;
        this.jobService = jobService;
        this.registry = registry;
    }

    @PostMapping("/run")
    @Operation(summary = "Run archival", description = "Moves records older than the retention period into the archive collections")
    public ResponseEntity<ArchivalRunResult> run(@Valid @RequestBody(required = false) RunArchivalRequest request,
            Principal principal) {
        RunArchivalRequest body = request != null ? request : new RunArchivalRequest();
        String initiatedBy = principal != null ? principal.getName() : "unknown";
        log.info("Archival run requested by {}", initiatedBy);
        return ResponseEntity.ok(orchestrator.run(body.toOptions(orchestrator.defaultOptions()), initiatedBy));
    }

    @GetMapping("/stats")
    @Operation(summary = "Archival statistics", description = "Active and archived counts per entity type. Space saved is an estimate.")
    public ResponseEntity<ArchivalStats> stats() {
        return ResponseEntity.ok(statsReporter.stats());
    }

    @PostMapping("/query")
    @Operation(summary = "Query archived records")
    public ResponseEntity<ArchivedRecordsResponse> query(@Valid @RequestBody QueryArchivedRequest request) {
        return ResponseEntity.ok(queryService.query(request));
    }

    @PostMapping("/export")
    @Operation(summary = "Export complete history", description = "Active and archived records of one entity type, newest first")
    public ResponseEntity<UnifiedExportResponse> export(@Valid @RequestBody ExportRequest request,
            Principal principal) {
        log.info("Unified export of {} requested by {}", request.getCollectionName(),
                principal != null ? principal.getName() : "unknown");
        return ResponseEntity.ok(exportService.export(request));
    }

    @PostMapping("/restore")
    @Operation(summary = "Restore archived records", description = "Moves archived records back into the active collection")
    public ResponseEntity<RestoreResult> restore(@Valid @RequestBody RestoreRequest request, Principal principal) {
        log.warn("Restore of {} requested by {} (window {} - {}, on collision {})", request.getCollectionName(),
                principal != null ? principal.getName() : "unknown", request.getStartDate(), request.getEndDate(),
                request.getOnCollision());
        return ResponseEntity.ok(restorer.restore(request.getCollectionName(), request.getStartDate(),
                request.getEndDate(), request.getOnCollision()));
    }

    @GetMapping("/history")
    @Operation(summary = "Archival job history", description = "Most recent job records first")
    public ResponseEntity<List<ArchivalJob>> history(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(jobService.history(limit));
    }

    @PostMapping("/cancel")
    @Operation(summary = "Cancel the active archival run", description = "The run stops at its next batch boundary")
    public ResponseEntity<Map<String, Object>> cancel() {
        boolean cancelled = orchestrator.cancelActiveRun();
        return ResponseEntity.ok(Map.of(
                "cancelled", cancelled,
                "message", cancelled ? "Cancellation requested" : "No archival run is active"));
    }

    @GetMapping("/entity-types")
    @Operation(summary = "Archivable entity types")
    public ResponseEntity<List<EntityTypeDTO>> entityTypes() {
        return ResponseEntity.ok(registry.all().stream()
                .map(EntityTypeDTO::from)
                .collect(Collectors.toList()));
    }
}
