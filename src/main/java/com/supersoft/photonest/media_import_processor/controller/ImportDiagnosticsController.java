package com.supersoft.photonest.media_import_processor.controller;

import com.supersoft.photonest.media_import_processor.domain.ConsistencyReport;
import com.supersoft.photonest.media_import_processor.domain.ImportSession;
import com.supersoft.photonest.media_import_processor.domain.ImportSessionStats;
import com.supersoft.photonest.media_import_processor.domain.ImportStateAudit;
import com.supersoft.photonest.media_import_processor.domain.ThumbnailRetryRecord;
import com.supersoft.photonest.media_import_processor.domain.WatchdogMetrics;
import com.supersoft.photonest.media_import_processor.exception.IllegalStateTransitionException;
import com.supersoft.photonest.media_import_processor.service.ImportSessionService;
import com.supersoft.photonest.media_import_processor.service.PickerImportWatchdog;
import com.supersoft.photonest.media_import_processor.service.StateTransitionRecorder;
import com.supersoft.photonest.media_import_processor.service.ThumbnailRetryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/api/import")
@Tag(name = "Import Diagnostics", description = "Operator endpoints for inspecting and nudging picker imports")
public class ImportDiagnosticsController {

    @Autowired
    private ImportSessionService sessionService;

    @Autowired
    private PickerImportWatchdog watchdog;

    @Autowired
    private ThumbnailRetryService thumbnailRetryService;

    @Autowired
    private StateTransitionRecorder transitionRecorder;

    @Operation(summary = "Get session", description = "Return the stored session row")
    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<?> getSession(
            @Parameter(description = "Session ID", required = true)
            @PathVariable Long sessionId) {
        Optional<ImportSession> session = sessionService.findSession(sessionId);
        if (session.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Session not found"));
        }
        return ResponseEntity.ok(session.get());
    }

    @Operation(summary = "Check session consistency",
               description = "Cross-check the session status against its selections. Reports only, never repairs.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Consistency report",
                    content = @Content(schema = @Schema(example = """
                    {
                      "sessionStatus": "IMPORTING",
                      "consistent": false,
                      "issues": ["Session is IMPORTING but all 5 selections are terminal"],
                      "recommendations": ["Run the watchdog roll-up to complete the session"]
                    }
                    """))),
        @ApiResponse(responseCode = "404", description = "Session not found")
    })
    @GetMapping("/sessions/{sessionId}/consistency")
    public ResponseEntity<?> checkConsistency(
            @Parameter(description = "Session ID", required = true)
            @PathVariable Long sessionId) {
        try {
            ConsistencyReport report = sessionService.checkConsistency(sessionId);
            return ResponseEntity.ok(report);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Recompute session stats", description = "Recount selections by status and store the result on the session")
    @PostMapping("/sessions/{sessionId}/stats")
    public ResponseEntity<?> refreshStats(
            @Parameter(description = "Session ID", required = true)
            @PathVariable Long sessionId) {
        try {
            ImportSessionStats stats = sessionService.refreshStats(sessionId);
            return ResponseEntity.ok(stats);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Enqueue session", description = "Hand the session's waiting selections to the import workers")
    @PostMapping("/sessions/{sessionId}/enqueue")
    public ResponseEntity<?> enqueueSession(@PathVariable Long sessionId) {
        try {
            int published = sessionService.enqueueSession(sessionId);
            return ResponseEntity.ok(Map.of("sessionId", sessionId, "publishedSelections", published));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (IllegalStateTransitionException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Cancel session",description = "Cancel the session and skip selections not yet claimed by a worker")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Session canceled"),
        @ApiResponse(responseCode = "404", description = "Session not found"),
        @ApiResponse(responseCode = "409", description = "Session cannot be canceled from its current status")
    })
    @PostMapping("/sessions/{sessionId}/cancel")
    public ResponseEntity<?> cancelSession(
            @Parameter(description = "Session ID", required = true)
            @PathVariable Long sessionId,
            @Parameter(description = "Reason recorded in the audit trail")
            @RequestParam(value = "reason", defaultValue = "canceled by operator") String reason) {
        try {
            int skipped = sessionService.cancelSession(sessionId, reason);
            return ResponseEntity.ok(Map.of("sessionId", sessionId, "skippedSelections", skipped));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (IllegalStateTransitionException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Force session status",
               description = "Recovery only: move the session to the given status without transition checks. Recorded as a forced transition.")
    @PostMapping("/sessions/{sessionId}/force-status")
    public ResponseEntity<?> forceSessionStatus(
            @PathVariable Long sessionId,
            @RequestParam("target") ImportSession.SessionStatus target,
            @RequestParam(value = "reason", defaultValue = "operator recovery") String reason) {
        try {
            boolean moved = sessionService.forceStatus(sessionId, target, reason);
            if (!moved) {
                return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "Session status changed concurrently"));
            }
            return ResponseEntity.ok(Map.of("sessionId", sessionId, "status", target));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Session transition history", description = "Audit trail of session status transitions")
    @GetMapping("/sessions/{sessionId}/transitions")
    public ResponseEntity<List<ImportStateAudit>> getSessionTransitions(@PathVariable Long sessionId) {
        return ResponseEntity.ok(transitionRecorder.history(StateTransitionRecorder.ENTITY_SESSION, sessionId));
    }

    @GetMapping("/selections/{selectionId}/transitions")
    public ResponseEntity<List<ImportStateAudit>> getSelectionTransitions(@PathVariable Long selectionId) {
        return ResponseEntity.ok(transitionRecorder.history(StateTransitionRecorder.ENTITY_SELECTION, selectionId));
    }

    @Operation(summary = "Run watchdog sweep", description = "Run one recovery sweep now and return its counters")
    @PostMapping("/watchdog/run")
    public ResponseEntity<WatchdogMetrics> runWatchdog() {
        log.info("Manual watchdog sweep requested");
        return ResponseEntity.ok(watchdog.runOnce());
    }

    @Operation(summary = "List exhausted thumbnail retries", description = "Media whose thumbnail retries were disabled")
    @GetMapping("/thumbnail-retries/exhausted")
    public ResponseEntity<List<ThumbnailRetryRecord>> getExhaustedRetries(
            @RequestParam(value = "limit", defaultValue = "100") int limit) {
        return ResponseEntity.ok(thumbnailRetryService.findExhausted(Math.max(1, Math.min(limit, 500))));
    }
}
