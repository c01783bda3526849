package com.ekkalavya.artraining.engine;

import com.ekkalavya.artraining.config.SportCatalog;
import com.ekkalavya.artraining.domain.BounceEvent;
import com.ekkalavya.artraining.domain.SessionStatus;
import com.ekkalavya.artraining.domain.SessionTrigger;
import com.ekkalavya.artraining.domain.TrainingSession;
import com.ekkalavya.artraining.exception.IllegalSessionTransitionException;
import com.ekkalavya.artraining.model.ScoreBreakdown;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Session lifecycle:
 * <pre>
 *   ACTIVE --PAUSE|SAFETY_PAUSE--> PAUSED --RESUME--> ACTIVE
 *   ACTIVE --END--> COMPLETED
 *   ACTIVE|PAUSED --FAIL--> FAILED
 * </pre>
 * COMPLETED and FAILED are terminal.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionStateMachine {

    private static final Map<SessionStatus, Map<SessionTrigger, SessionStatus>> TRANSITIONS = buildTransitions();

    private final ScoringEngine scoringEngine;
    private final SportCatalog sportCatalog;

    /**
     * Returns a copy of {@code session} in the target status with the transition logged.
     * Completing a session rescores it from {@code events}, which is only read for END.
     *
     * @throws IllegalSessionTransitionException if the trigger is not allowed; the session is untouched
     */
    public TrainingSession transition(TrainingSession session, SessionTrigger trigger, String cause,
                                      LocalDateTime at, Supplier<List<BounceEvent>> events) {
        SessionStatus from = session.getStatus();
        SessionStatus to = TRANSITIONS.getOrDefault(from, Map.of()).get(trigger);
        if (to == null) {
            throw new IllegalSessionTransitionException(from, trigger);
        }

        TrainingSession next = session.withTransition(TrainingSession.TransitionRecord.builder()
                .from(from)
                .to(to)
                .trigger(trigger)
                .cause(cause)
                .occurredAt(at)
                .build());

        if (to == SessionStatus.COMPLETED) {
            ScoreBreakdown finalScores = scoringEngine.score(events.get(), sportCatalog.getProfile(session.getSport()));
            next = next.withScores(finalScores).toBuilder()
                    .completedAt(at)
                    .durationSeconds(session.elapsedSecondsAt(at))
                    .build();
        } else if (to == SessionStatus.FAILED) {
            next = next.toBuilder()
                    .completedAt(at)
                    .durationSeconds(session.elapsedSecondsAt(at))
                    .build();
        }

        log.info("Session {} transitioned {} -> {} on {}{}", session.getId(), from, to, trigger,
                cause == null ? "" : " (" + cause + ")");
        return next;
    }

    private static Map<SessionStatus, Map<SessionTrigger, SessionStatus>> buildTransitions() {
        Map<SessionStatus, Map<SessionTrigger, SessionStatus>> transitions = new EnumMap<>(SessionStatus.class);

        Map<SessionTrigger, SessionStatus> fromActive = new EnumMap<>(SessionTrigger.class);
        fromActive.put(SessionTrigger.PAUSE, SessionStatus.PAUSED);
        fromActive.put(SessionTrigger.SAFETY_PAUSE, SessionStatus.PAUSED);
        fromActive.put(SessionTrigger.END, SessionStatus.COMPLETED);
        fromActive.put(SessionTrigger.FAIL, SessionStatus.FAILED);
        transitions.put(SessionStatus.ACTIVE, Collections.unmodifiableMap(fromActive));

        Map<SessionTrigger, SessionStatus> fromPaused = new EnumMap<>(SessionTrigger.class);
        fromPaused.put(SessionTrigger.RESUME, SessionStatus.ACTIVE);
        fromPaused.put(SessionTrigger.FAIL, SessionStatus.FAILED);
        transitions.put(SessionStatus.PAUSED, Collections.unmodifiableMap(fromPaused));

        transitions.put(SessionStatus.COMPLETED, Map.of());
        transitions.put(SessionStatus.FAILED, Map.of());
        return Collections.unmodifiableMap(transitions);
    }
}
