package com.ekkalavya.artraining.service;

import com.ekkalavya.artraining.concurrent.SessionLockManager;
import com.ekkalavya.artraining.config.SportCatalog;
import com.ekkalavya.artraining.domain.BounceEvent;
import com.ekkalavya.artraining.domain.Difficulty;
import com.ekkalavya.artraining.domain.DrillPattern;
import com.ekkalavya.artraining.domain.SessionStatus;
import com.ekkalavya.artraining.domain.SessionTrigger;
import com.ekkalavya.artraining.domain.TrainingSession;
import com.ekkalavya.artraining.dto.CreateSessionRequest;
import com.ekkalavya.artraining.dto.PerformanceMetricResponse;
import com.ekkalavya.artraining.dto.RoomConstraintsResponse;
import com.ekkalavya.artraining.dto.SafetyIncidentResponse;
import com.ekkalavya.artraining.dto.SyncStatusResponse;
import com.ekkalavya.artraining.dto.TrainingSessionResponse;
import com.ekkalavya.artraining.engine.BounceValidator;
import com.ekkalavya.artraining.engine.ScoringEngine;
import com.ekkalavya.artraining.engine.SessionStateMachine;
import com.ekkalavya.artraining.engine.SessionSyncReconciler;
import com.ekkalavya.artraining.exception.SessionNotActiveException;
import com.ekkalavya.artraining.exception.SessionNotFoundException;
import com.ekkalavya.artraining.exception.SyncConflictException;
import com.ekkalavya.artraining.exception.TrainingValidationException;
import com.ekkalavya.artraining.model.ImpactData;
import com.ekkalavya.artraining.model.ScoreBreakdown;
import com.ekkalavya.artraining.model.SportProfile;
import com.ekkalavya.artraining.model.sync.SessionSyncPayload;
import com.ekkalavya.artraining.repository.BounceEventRepository;
import com.ekkalavya.artraining.repository.PerformanceMetricRepository;
import com.ekkalavya.artraining.repository.RoomConstraintsRepository;
import com.ekkalavya.artraining.repository.SafetyIncidentRepository;
import com.ekkalavya.artraining.repository.TrainingSessionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Session lifecycle, bounce scoring and cross-platform sync.
 *
 * <p>Every write loads the persisted snapshot, lets the engine produce an updated copy and
 * saves that copy, all under the session's lock and inside one transaction. A failed save
 * leaves the previously persisted snapshot as the canonical state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrainingSessionService {

    private final TrainingSessionRepository sessionRepository;
    private final BounceEventRepository bounceEventRepository;
    private final RoomConstraintsRepository roomConstraintsRepository;
    private final SafetyIncidentRepository safetyIncidentRepository;
    private final PerformanceMetricRepository performanceMetricRepository;
    private final PerformanceMetricService performanceMetricService;
    private final BounceValidator bounceValidator;
    private final ScoringEngine scoringEngine;
    private final SessionStateMachine stateMachine;
    private final SessionSyncReconciler syncReconciler;
    private final SportCatalog sportCatalog;
    private final SessionLockManager lockManager;
    private final TransactionOperations transactions;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public TrainingSession createSession(CreateSessionRequest request) {
        if (request.getUserId() == null) {
            throw new TrainingValidationException("User ID is required");
        }
        if (request.getPlatform() == null) {
            throw new TrainingValidationException("Device platform is required");
        }
        DrillPattern pattern = DrillPattern.fromId(request.getDrillPatternId());
        SportProfile profile = sportCatalog.getProfile(request.getSport());
        LocalDateTime now = LocalDateTime.now(clock);

        TrainingSession session = TrainingSession.builder()
                .id(UUID.randomUUID())
                .userId(request.getUserId())
                .sport(profile.getSport())
                .drillPatternId(pattern.getId())
                .difficulty(request.getDifficulty() == null ? Difficulty.MEDIUM : request.getDifficulty())
                .devicePlatform(request.getPlatform())
                .status(SessionStatus.ACTIVE)
                .startedAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build()
                .withScores(ScoreBreakdown.empty(profile));

        TrainingSession saved = transactions.execute(status -> sessionRepository.save(session));
        log.info("Created {} training session {} for user {} (pattern {}, {}, {})",
                saved.getSport(), saved.getId(), saved.getUserId(), saved.getDrillPatternId(),
                saved.getDifficulty(), saved.getDevicePlatform());
        return saved;
    }

    public TrainingSession getSession(UUID sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public Page<TrainingSession> getUserSessions(UUID userId, String sport, Pageable pageable) {
        if (sport == null || sport.isBlank()) {
            return sessionRepository.findByUserIdOrderByStartedAtDesc(userId, pageable);
        }
        return sessionRepository.findByUserIdAndSportOrderByStartedAtDesc(
                userId, sport.trim().toLowerCase(Locale.ROOT), pageable);
    }

    /**
     * Validates the impact, appends it and rescores the session from its full event stream.
     */
    public BounceEvent recordBounceEvent(UUID sessionId, ImpactData impact) {
        return lockManager.executeWithLock(sessionId, () -> transactions.execute(status -> {
            TrainingSession session = loadSession(sessionId);
            if (!session.isActive()) {
                throw new SessionNotActiveException(sessionId, session.getStatus());
            }
            SportProfile profile = sportCatalog.getProfile(session.getSport());
            double tolerance = profile.toleranceFor(session.getDifficulty());

            LocalDateTime now = LocalDateTime.now(clock);

            BounceEvent event = bounceValidator.validate(sessionId, impact, tolerance, now);
            BounceEvent saved = bounceEventRepository.save(event);

            List<BounceEvent> events = new ArrayList<>(
                    bounceEventRepository.findBySessionIdOrderByTimestampMsAscCreatedAtAsc(sessionId));
            if (events.stream().noneMatch(e -> e.getId().equals(saved.getId()))) {
                events.add(saved);
                events.sort(Comparator.comparingLong(BounceEvent::getTimestampMs));
            }
            sessionRepository.save(session.withScores(scoringEngine.score(events, profile)).toBuilder()
                    .updatedAt(now)
                    .build());

            meterRegistry.counter("ar.training.bounces", "result", saved.isHit() ? "hit" : "miss").increment();
            log.debug("Bounce on session {} target {}: error={}mm tolerance={}mm hit={}",
                    sessionId, saved.getTargetIndex(), saved.getErrorDistanceMm(),
                    saved.getToleranceRadiusMm(), saved.isHit());
            return saved;
        }));
    }

    public List<BounceEvent> getBounceEvents(UUID sessionId) {
        if (!sessionRepository.existsById(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        return bounceEventRepository.findBySessionIdOrderByTimestampMsAscCreatedAtAsc(sessionId);
    }

    public TrainingSession transitionSession(UUID sessionId, SessionTrigger trigger, String cause) {
        if (trigger == null) {
            throw new TrainingValidationException("Transition trigger is required");
        }
        return lockManager.executeWithLock(sessionId, () -> transactions.execute(status -> {
            TrainingSession session = loadSession(sessionId);
            LocalDateTime now = LocalDateTime.now(clock);

            TrainingSession next = stateMachine.transition(session, trigger, cause, now,
                    () -> bounceEventRepository.findBySessionIdOrderByTimestampMsAscCreatedAtAsc(sessionId));
            TrainingSession saved = sessionRepository.save(next.toBuilder().updatedAt(now).build());

            if (saved.getStatus() == SessionStatus.COMPLETED) {
                performanceMetricService.recordSessionRollups(saved, now);
                log.info("Session {} completed: total={} accuracy={}% maxStreak={} duration={}s",
                        sessionId, saved.getTotalScore(), saved.getAccuracy(),
                        saved.getMaxStreak(), saved.getDurationSeconds());
            }
            meterRegistry.counter("ar.training.transitions", "to", saved.getStatus().name()).increment();
            return saved;
        }));
    }

    /**
     * Merges a platform quality report. Missing and terminal sessions are sync conflicts.
     */
    public TrainingSession syncSession(UUID sessionId, SessionSyncPayload payload) {
        return lockManager.executeWithLock(sessionId, () -> transactions.execute(status -> {
            TrainingSession session = sessionRepository.findById(sessionId)
                    .orElseThrow(() -> new SyncConflictException(sessionId, "session does not exist"));

            TrainingSession merged = syncReconciler.merge(session, payload).toBuilder()
                    .updatedAt(LocalDateTime.now(clock))
                    .build();
            TrainingSession saved = sessionRepository.save(merged);

            meterRegistry.counter("ar.training.syncs", "platform",
                    payload.getSyncPlatform().getWireName()).increment();
            log.debug("Synced session {} from {}", sessionId, payload.getSyncPlatform());
            return saved;
        }));
    }

    public SyncStatusResponse getSyncStatus(UUID sessionId) {
        TrainingSession session = getSession(sessionId);
        return SyncStatusResponse.builder()
                .session(TrainingSessionResponse.from(session))
                .lastReportingPlatform(session.getLastReportingPlatform())
                .roomConstraints(roomConstraintsRepository.findFirstBySessionIdOrderByAnalyzedAtDesc(sessionId)
                        .map(RoomConstraintsResponse::from)
                        .orElse(null))
                .safetyIncidents(safetyIncidentRepository.findBySessionIdOrderByOccurredAtAsc(sessionId).stream()
                        .map(SafetyIncidentResponse::from)
                        .collect(Collectors.toList()))
                .performanceMetrics(performanceMetricRepository.findBySessionId(sessionId).stream()
                        .map(PerformanceMetricResponse::from)
                        .collect(Collectors.toList()))
                .build();
    }

    /**
     * Removes the session together with its events, room scans, safety log and rollups.
     */
    public void deleteSession(UUID sessionId) {
        lockManager.runWithLock(sessionId, () -> transactions.executeWithoutResult(status -> {
            TrainingSession session = loadSession(sessionId);
            int events = bounceEventRepository.deleteBySessionId(sessionId);
            int rooms = roomConstraintsRepository.deleteBySessionId(sessionId);
            int incidents = safetyIncidentRepository.deleteBySessionId(sessionId);
            int metrics = performanceMetricRepository.deleteBySessionId(sessionId);
            sessionRepository.delete(session);
            log.info("Deleted session {} with {} events, {} room scans, {} incidents, {} metrics",
                    sessionId, events, rooms, incidents, metrics);
        }));
    }

    private TrainingSession loadSession(UUID sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }
}
