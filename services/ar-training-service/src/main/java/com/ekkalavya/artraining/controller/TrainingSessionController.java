package com.ekkalavya.artraining.controller;

import com.ekkalavya.artraining.config.SportCatalog;
import com.ekkalavya.artraining.domain.MetricType;
import com.ekkalavya.artraining.dto.BounceEventResponse;
import com.ekkalavya.artraining.dto.CreateSessionRequest;
import com.ekkalavya.artraining.dto.MarkerRequest;
import com.ekkalavya.artraining.dto.MetricAverageResponse;
import com.ekkalavya.artraining.dto.PerformanceMetricResponse;
import com.ekkalavya.artraining.dto.RoomAnalyticsResponse;
import com.ekkalavya.artraining.dto.RoomConstraintsResponse;
import com.ekkalavya.artraining.dto.SafetyIncidentRequest;
import com.ekkalavya.artraining.dto.SafetyIncidentResponse;
import com.ekkalavya.artraining.dto.SportProfileResponse;
import com.ekkalavya.artraining.dto.SyncStatusResponse;
import com.ekkalavya.artraining.dto.TrainingSessionResponse;
import com.ekkalavya.artraining.dto.TransitionRequest;
import com.ekkalavya.artraining.model.ImpactData;
import com.ekkalavya.artraining.model.MarkerSet;
import com.ekkalavya.artraining.model.PlaneScan;
import com.ekkalavya.artraining.model.PoseSnapshot;
import com.ekkalavya.artraining.model.SafetyEvaluation;
import com.ekkalavya.artraining.model.sync.SessionSyncPayload;
import com.ekkalavya.artraining.service.PerformanceMetricService;
import com.ekkalavya.artraining.service.RoomSafetyService;
import com.ekkalavya.artraining.service.TrainingSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/ar-training")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "AR Training", description = "Adaptive AR training session operations")
public class TrainingSessionController {

    private final TrainingSessionService sessionService;
    private final RoomSafetyService roomSafetyService;
    private final PerformanceMetricService performanceMetricService;
    private final SportCatalog sportCatalog;

    @GetMapping("/sports")
    @Operation(summary = "List configured sports")
    public ResponseEntity<Set<String>> getSports() {
        return ResponseEntity.ok(sportCatalog.sports());
    }

    @GetMapping("/sports/{sport}")
    @Operation(summary = "Get sport configuration", description = "Tolerances, score weights and room requirements")
    @ApiResponse(responseCode = "404", description = "Sport is not configured")
    public ResponseEntity<SportProfileResponse> getSportProfile(@PathVariable String sport) {
        return sportCatalog.findProfile(sport)
                .map(SportProfileResponse::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/sessions")
    @Operation(summary = "Start training session", description = "Create an ACTIVE session for a drill")
    @ApiResponse(responseCode = "201", description = "Session created")
    @ApiResponse(responseCode = "400", description = "Unknown sport or invalid request")
    public ResponseEntity<TrainingSessionResponse> createSession(@Valid @RequestBody CreateSessionRequest request) {
        log.info("Starting {} session for user: {}", request.getSport(), request.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(TrainingSessionResponse.from(sessionService.createSession(request)));
    }

    @GetMapping("/sessions/{sessionId}")
    @Operation(summary = "Get training session")
    @ApiResponse(responseCode = "404", description = "Session not found")
    public ResponseEntity<TrainingSessionResponse> getSession(@PathVariable UUID sessionId) {
        return ResponseEntity.ok(TrainingSessionResponse.from(sessionService.getSession(sessionId)));
    }

    @DeleteMapping("/sessions/{sessionId}")
    @Operation(summary = "Delete training session", description = "Removes the session and everything recorded for it")
    @ApiResponse(responseCode = "204", description = "Session deleted")
    public ResponseEntity<Void> deleteSession(@PathVariable UUID sessionId) {
        sessionService.deleteSession(sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/users/{userId}/sessions")
    @Operation(summary = "List user sessions", description = "Newest first, optionally filtered by sport")
    public ResponseEntity<Page<TrainingSessionResponse>> getUserSessions(
            @PathVariable UUID userId,
            @Parameter(description = "Sport filter") @RequestParam(required = false) String sport,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(sessionService.getUserSessions(userId, sport, PageRequest.of(page, size))
                .map(TrainingSessionResponse::from));
    }

    @PostMapping("/sessions/{sessionId}/bounces")
    @Operation(summary = "Record bounce", description = "Validate an impact against its target and rescore the session")
    @ApiResponse(responseCode = "201", description = "Bounce recorded")
    @ApiResponse(responseCode = "400", description = "Malformed impact, nothing recorded")
    @ApiResponse(responseCode = "409", description = "Session is not active")
    public ResponseEntity<BounceEventResponse> recordBounce(@PathVariable UUID sessionId,
                                                            @RequestBody ImpactData impact) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BounceEventResponse.from(sessionService.recordBounceEvent(sessionId, impact)));
    }

    @GetMapping("/sessions/{sessionId}/bounces")
    @Operation(summary = "List bounces", description = "Bounce events in impact order")
    public ResponseEntity<List<BounceEventResponse>> getBounces(@PathVariable UUID sessionId) {
        return ResponseEntity.ok(sessionService.getBounceEvents(sessionId).stream()
                .map(BounceEventResponse::from)
                .collect(Collectors.toList()));
    }

    @PostMapping("/sessions/{sessionId}/transitions")
    @Operation(summary = "Transition session", description = "Pause, resume, end or fail a session")
    @ApiResponse(responseCode = "200", description = "Transition applied")
    @ApiResponse(responseCode = "409", description = "Transition not allowed from the current status")
    public ResponseEntity<TrainingSessionResponse> transition(@PathVariable UUID sessionId,
                                                              @Valid @RequestBody TransitionRequest request) {
        log.info("Transition {} requested for session: {}", request.getTrigger(), sessionId);
        return ResponseEntity.ok(TrainingSessionResponse.from(
                sessionService.transitionSession(sessionId, request.getTrigger(), request.getCause())));
    }

    @PostMapping("/sessions/{sessionId}/room")
    @Operation(summary = "Analyse room", description = "Compute safety score, room mode and eligible drill patterns")
    @ApiResponse(responseCode = "201", description = "Room constraints stored")
    public ResponseEntity<RoomConstraintsResponse> analyzeRoom(@PathVariable UUID sessionId,
                                                               @RequestBody PlaneScan scan) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(RoomConstraintsResponse.from(roomSafetyService.analyzeRoom(sessionId, scan)));
    }

    @PostMapping("/markers")
    @Operation(summary = "Generate markers", description = "Lay out drill targets inside the usable area")
    public ResponseEntity<MarkerSet> generateMarkers(@Valid @RequestBody MarkerRequest request) {
        return ResponseEntity.ok(roomSafetyService.generateMarkers(request));
    }

    @PostMapping("/sessions/{sessionId}/pose")
    @Operation(summary = "Evaluate pose safety", description = "Check a pose against the analysed room boundary")
    @ApiResponse(responseCode = "200", description = "Evaluation returned; critical risks pause the session")
    public ResponseEntity<SafetyEvaluation> evaluatePose(@PathVariable UUID sessionId,
                                                         @RequestBody PoseSnapshot pose) {
        return ResponseEntity.ok(roomSafetyService.evaluatePoseSafety(sessionId, pose));
    }

    @PostMapping("/sessions/{sessionId}/incidents")
    @Operation(summary = "Log safety incident")
    @ApiResponse(responseCode = "201", description = "Incident logged")
    public ResponseEntity<SafetyIncidentResponse> logIncident(@PathVariable UUID sessionId,
                                                              @Valid @RequestBody SafetyIncidentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(SafetyIncidentResponse.from(roomSafetyService.logSafetyIncident(sessionId, request)));
    }

    @GetMapping("/sessions/{sessionId}/incidents")
    @Operation(summary = "Get safety log")
    public ResponseEntity<List<SafetyIncidentResponse>> getIncidents(@PathVariable UUID sessionId) {
        return ResponseEntity.ok(roomSafetyService.getSafetyLog(sessionId).stream()
                .map(SafetyIncidentResponse::from)
                .collect(Collectors.toList()));
    }

    @PostMapping("/sessions/{sessionId}/sync")
    @Operation(summary = "Sync platform metrics", description = "Merge a web or native client's quality report")
    @ApiResponse(responseCode = "200", description = "Merged session returned")
    @ApiResponse(responseCode = "409", description = "Session missing or terminal")
    public ResponseEntity<TrainingSessionResponse> sync(@PathVariable UUID sessionId,
                                                        @Valid @RequestBody SessionSyncPayload payload) {
        return ResponseEntity.ok(TrainingSessionResponse.from(sessionService.syncSession(sessionId, payload)));
    }

    @GetMapping("/sessions/{sessionId}/sync")
    @Operation(summary = "Get sync status")
    public ResponseEntity<SyncStatusResponse> getSyncStatus(@PathVariable UUID sessionId) {
        return ResponseEntity.ok(sessionService.getSyncStatus(sessionId));
    }

    @GetMapping("/users/{userId}/metrics")
    @Operation(summary = "Get metric history", description = "Per-session rollups for one sport and metric, newest first")
    public ResponseEntity<List<PerformanceMetricResponse>> getMetricHistory(@PathVariable UUID userId,
                                                                            @RequestParam String sport,
                                                                            @RequestParam MetricType type) {
        return ResponseEntity.ok(performanceMetricService.getMetricHistory(userId, sport, type).stream()
                .map(PerformanceMetricResponse::from)
                .collect(Collectors.toList()));
    }

    @GetMapping("/users/{userId}/metrics/average")
    @Operation(summary = "Get metric average", description = "Mean of all session rollups for one sport and metric")
    public ResponseEntity<MetricAverageResponse> getMetricAverage(@PathVariable UUID userId,
                                                                  @RequestParam String sport,
                                                                  @RequestParam MetricType type) {
        return ResponseEntity.ok(performanceMetricService.getAverage(userId, sport, type));
    }

    @GetMapping("/users/{userId}/room-analytics")
    @Operation(summary = "Get room analytics",
            description = "Pattern mix, safety record, average scores and trends over completed room-mode sessions")
    public ResponseEntity<RoomAnalyticsResponse> getRoomAnalytics(@PathVariable UUID userId) {
        return ResponseEntity.ok(performanceMetricService.getRoomAnalytics(userId));
    }
}
