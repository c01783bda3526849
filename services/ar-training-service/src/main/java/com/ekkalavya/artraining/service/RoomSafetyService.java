package com.ekkalavya.artraining.service;

import com.ekkalavya.artraining.concurrent.SessionLockManager;
import com.ekkalavya.artraining.config.SportCatalog;
import com.ekkalavya.artraining.domain.Difficulty;
import com.ekkalavya.artraining.domain.DrillPattern;
import com.ekkalavya.artraining.domain.RoomConstraints;
import com.ekkalavya.artraining.domain.SafetyIncident;
import com.ekkalavya.artraining.domain.SessionStatus;
import com.ekkalavya.artraining.domain.SessionTrigger;
import com.ekkalavya.artraining.domain.TrainingSession;
import com.ekkalavya.artraining.dto.MarkerRequest;
import com.ekkalavya.artraining.dto.SafetyIncidentRequest;
import com.ekkalavya.artraining.engine.MarkerGenerator;
import com.ekkalavya.artraining.engine.PoseSafetyMonitor;
import com.ekkalavya.artraining.engine.RoomConstraintAnalyzer;
import com.ekkalavya.artraining.engine.SessionStateMachine;
import com.ekkalavya.artraining.exception.SessionNotActiveException;
import com.ekkalavya.artraining.exception.SessionNotFoundException;
import com.ekkalavya.artraining.exception.TrainingValidationException;
import com.ekkalavya.artraining.model.MarkerSet;
import com.ekkalavya.artraining.model.PlaneScan;
import com.ekkalavya.artraining.model.PoseSnapshot;
import com.ekkalavya.artraining.model.SafetyEvaluation;
import com.ekkalavya.artraining.model.SportProfile;
import com.ekkalavya.artraining.model.UsableArea;
import com.ekkalavya.artraining.repository.RoomConstraintsRepository;
import com.ekkalavya.artraining.repository.SafetyIncidentRepository;
import com.ekkalavya.artraining.repository.TrainingSessionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Room scans, marker layout, pose safety and the safety incident log.
 *
 * <p>A critical incident pauses an ACTIVE session at most once: the first critical
 * incident moves it to PAUSED, later ones find it already paused. Incidents on
 * terminal sessions are logged without touching the session.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RoomSafetyService {

    private final TrainingSessionRepository sessionRepository;
    private final RoomConstraintsRepository roomConstraintsRepository;
    private final SafetyIncidentRepository safetyIncidentRepository;
    private final RoomConstraintAnalyzer roomConstraintAnalyzer;
    private final MarkerGenerator markerGenerator;
    private final PoseSafetyMonitor poseSafetyMonitor;
    private final SessionStateMachine stateMachine;
    private final SportCatalog sportCatalog;
    private final SessionLockManager lockManager;
    private final TransactionOperations transactions;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public RoomConstraints analyzeRoom(UUID sessionId, PlaneScan scan) {
        return lockManager.executeWithLock(sessionId, () -> transactions.execute(status -> {
            TrainingSession session = loadSession(sessionId);
            if (session.getStatus().isTerminal()) {
                throw new SessionNotActiveException(sessionId, session.getStatus());
            }

            RoomConstraints constraints = meterRegistry.timer("ar.training.room.analysis").record(() ->
                    roomConstraintAnalyzer.analyze(sessionId, session.getSport(), scan, LocalDateTime.now(clock)));
            RoomConstraints saved = roomConstraintsRepository.save(constraints);

            log.info("Room analysed for session {}: {}x{} m, roomMode={}, safety={}, patterns={}",
                    sessionId, saved.getWidth(), saved.getHeight(), saved.isRoomMode(),
                    saved.getSafetyScore(), saved.getRecommendedPatterns());
            if (!saved.getSafetyWarnings().isEmpty()) {
                log.warn("Room safety warnings for session {}: {}", sessionId, saved.getSafetyWarnings());
            }
            return saved;
        }));
    }

    public MarkerSet generateMarkers(MarkerRequest request) {
        DrillPattern pattern = DrillPattern.fromId(request.getPatternId());
        SportProfile profile = sportCatalog.getProfile(request.getSport());
        Difficulty difficulty = request.getDifficulty() == null ? Difficulty.MEDIUM : request.getDifficulty();
        if (request.getWidth() == null || request.getHeight() == null) {
            throw new TrainingValidationException("Usable width and height are required");
        }

        MarkerSet markers = markerGenerator.generate(pattern,
                new UsableArea(request.getWidth(), request.getHeight()),
                profile.toleranceFor(difficulty),
                request.getCanvasWidth(), request.getCanvasHeight());
        markers.setSport(profile.getSport());
        markers.setDifficulty(difficulty);

        log.debug("Generated {} markers for {} in {}x{} m", markers.getMarkers().size(),
                pattern.getId(), request.getWidth(), request.getHeight());
        return markers;
    }

    public SafetyEvaluation evaluatePoseSafety(UUID sessionId, PoseSnapshot pose) {
        return lockManager.executeWithLock(sessionId, () -> transactions.execute(status -> {
            TrainingSession session = loadSession(sessionId);
            RoomConstraints room = roomConstraintsRepository.findFirstBySessionIdOrderByAnalyzedAtDesc(sessionId)
                    .orElseThrow(() -> new TrainingValidationException(
                            "Session " + sessionId + " has no room analysis yet"));

            SafetyEvaluation evaluation = poseSafetyMonitor.evaluate(session, pose, room, LocalDateTime.now(clock));
            List<SafetyIncident> recorded = recordIncidents(session, evaluation.getIncidents());

            return evaluation.toBuilder()
                    .incidents(recorded)
                    .build();
        }));
    }

    /**
     * Appends a client-reported incident; accepted on terminal sessions as an audit entry.
     */
    public SafetyIncident logSafetyIncident(UUID sessionId, SafetyIncidentRequest request) {
        if (request.getIncidentType() == null || request.getSeverity() == null) {
            throw new TrainingValidationException("Incident type and severity are required");
        }
        return lockManager.executeWithLock(sessionId, () -> transactions.execute(status -> {
            TrainingSession session = loadSession(sessionId);
            SafetyIncident incident = SafetyIncident.builder()
                    .sessionId(sessionId)
                    .userId(session.getUserId())
                    .incidentType(request.getIncidentType())
                    .severity(request.getSeverity())
                    .message(request.getMessage())
                    .userPosition(request.getUserPosition())
                    .drillPattern(session.getDrillPatternId())
                    .automaticResponse(request.getAutomaticResponse())
                    .sessionPaused(false)
                    .occurredAt(LocalDateTime.now(clock))
                    .build();
            return recordIncidents(session, List.of(incident)).get(0);
        }));
    }

    public List<SafetyIncident> getSafetyLog(UUID sessionId) {
        if (!sessionRepository.existsById(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        return safetyIncidentRepository.findBySessionIdOrderByOccurredAtAsc(sessionId);
    }

    private List<SafetyIncident> recordIncidents(TrainingSession session, List<SafetyIncident> incidents) {
        LocalDateTime now = LocalDateTime.now(clock);
        TrainingSession current = session;
        List<SafetyIncident> saved = new ArrayList<>(incidents.size());

        for (SafetyIncident incident : incidents) {
            SafetyIncident toSave = incident.getOccurredAt() == null
                    ? incident.toBuilder().occurredAt(now).build()
                    : incident;
            if (incident.isCritical() && !incident.isSessionPaused() && current.getStatus() == SessionStatus.ACTIVE) {
                TrainingSession paused = stateMachine.transition(current, SessionTrigger.SAFETY_PAUSE,
                        incident.getIncidentType() + ": " + incident.getMessage(),
                        toSave.getOccurredAt(), List::of);
                current = sessionRepository.save(paused.toBuilder().updatedAt(now).build());
                toSave = toSave.toBuilder()
                        .sessionPaused(true)
                        .automaticResponse("pause")
                        .build();
                meterRegistry.counter("ar.training.transitions", "to", SessionStatus.PAUSED.name()).increment();
                log.warn("Session {} paused by critical {} incident: {}",
                        current.getId(), incident.getIncidentType(), incident.getMessage());
            }
            saved.add(safetyIncidentRepository.save(toSave));
            meterRegistry.counter("ar.training.safety.incidents", "severity", incident.getSeverity().name()).increment();
        }
        return saved;
    }

    private TrainingSession loadSession(UUID sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }
}
