package com.ekkalavya.artraining.engine;

import com.ekkalavya.artraining.config.TrainingEngineProperties;
import com.ekkalavya.artraining.domain.RoomConstraints;
import com.ekkalavya.artraining.domain.SafetyIncident;
import com.ekkalavya.artraining.domain.SafetyIncident.IncidentType;
import com.ekkalavya.artraining.domain.SafetyIncident.Severity;
import com.ekkalavya.artraining.domain.TrainingSession;
import com.ekkalavya.artraining.exception.TrainingValidationException;
import com.ekkalavya.artraining.model.Landmark;
import com.ekkalavya.artraining.model.Point3;
import com.ekkalavya.artraining.model.PoseSnapshot;
import com.ekkalavya.artraining.model.SafetyEvaluation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks a pose against the analysed room boundary. Read-only over {@link RoomConstraints}.
 *
 * <p>Landmarks are room-centred: the walls sit at {@code x = ±width/2} and {@code z = ±height/2},
 * the ceiling at {@code y = ceilingHeight}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PoseSafetyMonitor {

    static final int HEAD_LANDMARK_INDEX = 0;
    static final String PAUSE_RESPONSE = "pause";
    static final String WARNING_RESPONSE = "warning";

    private final TrainingEngineProperties properties;

    public SafetyEvaluation evaluate(TrainingSession session, PoseSnapshot pose, RoomConstraints room,
                                     LocalDateTime at) {
        if (pose == null || pose.getLandmarks() == null) {
            throw new TrainingValidationException("Pose snapshot with landmarks is required");
        }
        if (room == null) {
            throw new TrainingValidationException("Room must be analysed before pose safety can be evaluated");
        }
        TrainingEngineProperties.PoseSafetyConfig config = properties.getPoseSafety();

        List<String> warnings = new ArrayList<>();
        List<SafetyIncident> incidents = new ArrayList<>();
        int visible = 0;

        List<Landmark> landmarks = pose.getLandmarks();
        for (int i = 0; i < landmarks.size(); i++) {
            Landmark landmark = landmarks.get(i);
            if (landmark == null || landmark.getVisibility() <= config.getVisibilityThreshold()) {
                continue;
            }
            visible++;
            String label = label(landmark, i);

            double wallClearance = Math.min(
                    room.getWidth() / 2 - Math.abs(landmark.getX()),
                    room.getHeight() / 2 - Math.abs(landmark.getZ()));
            checkClearance(session, landmark, label, wallClearance, "wall", config, warnings, incidents, at);

            if (i == HEAD_LANDMARK_INDEX && room.hasCeilingHeight()) {
                double ceilingClearance = room.getCeilingHeight() - landmark.getY();
                checkClearance(session, landmark, label, ceilingClearance, "ceiling", config, warnings, incidents, at);
            }

            checkSpeed(session, pose, i, landmark, label, config, warnings, incidents, at);
        }

        if (!landmarks.isEmpty() && visible == 0) {
            warnings.add("Pose tracking lost - step back into the camera view");
            incidents.add(incident(session, IncidentType.TRACKING_LOST, Severity.WARNING,
                    "No landmark above visibility threshold", null, null, WARNING_RESPONSE, at));
        }

        if (room.getSafetyScore() < config.getLowSafetyScore()) {
            warnings.add("Room conditions may not be optimal for safe training");
        }

        boolean pauseRequired = incidents.stream().anyMatch(SafetyIncident::isCritical);
        boolean safe = incidents.stream().noneMatch(incident ->
                incident.getIncidentType() == IncidentType.BOUNDARY_VIOLATION
                        || incident.getIncidentType() == IncidentType.COLLISION_RISK
                        || incident.getIncidentType() == IncidentType.POSE_UNSAFE);

        if (pauseRequired) {
            log.warn("Critical pose safety risk in session {}: {}", session.getId(), warnings);
        }

        return SafetyEvaluation.builder()
                .safe(safe)
                .warnings(warnings)
                .incidents(incidents)
                .pauseRequired(pauseRequired)
                .build();
    }

    private void checkClearance(TrainingSession session, Landmark landmark, String label, double clearance,
                                String boundary, TrainingEngineProperties.PoseSafetyConfig config,
                                List<String> warnings, List<SafetyIncident> incidents, LocalDateTime at) {
        if (clearance < config.getCriticalDistance()) {
            String message = String.format("%s at the %s (%.2f m) - stop and move to the centre", label, boundary, clearance);
            warnings.add(message);
            incidents.add(incident(session, IncidentType.COLLISION_RISK, Severity.CRITICAL, message,
                    landmark, position(landmark), PAUSE_RESPONSE, at));
        } else if (clearance < config.getWarningDistance()) {
            String message = String.format("%s too close to the %s (%.2f m)", label, boundary, clearance);
            warnings.add(message);
            incidents.add(incident(session, IncidentType.BOUNDARY_VIOLATION, Severity.WARNING, message,
                    landmark, position(landmark), WARNING_RESPONSE, at));
        }
    }

    private void checkSpeed(TrainingSession session, PoseSnapshot pose, int index, Landmark landmark, String label,
                            TrainingEngineProperties.PoseSafetyConfig config,
                            List<String> warnings, List<SafetyIncident> incidents, LocalDateTime at) {
        List<Landmark> previous = pose.getPreviousLandmarks();
        if (previous == null || index >= previous.size() || previous.get(index) == null
                || pose.getTimestampMs() == null || pose.getPreviousTimestampMs() == null) {
            return;
        }
        long elapsedMs = pose.getTimestampMs() - pose.getPreviousTimestampMs();
        if (elapsedMs <= 0) {
            return;
        }
        double speed = GeometryUtils.distance(position(previous.get(index)), position(landmark)) * 1000.0 / elapsedMs;
        if (speed > config.getMaxLandmarkSpeed()) {
            String message = String.format("%s moving too fast (%.1f m/s)", label, speed);
            warnings.add(message);
            incidents.add(incident(session, IncidentType.POSE_UNSAFE, Severity.WARNING, message,
                    landmark, position(landmark), WARNING_RESPONSE, at));
        }
    }

    private static SafetyIncident incident(TrainingSession session, IncidentType type, Severity severity,
                                           String message, Landmark landmark, Point3 position,
                                           String response, LocalDateTime at) {
        return SafetyIncident.builder()
                .sessionId(session.getId())
                .userId(session.getUserId())
                .incidentType(type)
                .severity(severity)
                .message(message)
                .landmark(landmark == null ? null : landmark.getName())
                .userPosition(position)
                .drillPattern(session.getDrillPatternId())
                .automaticResponse(response)
                .sessionPaused(false)
                .occurredAt(at)
                .build();
    }

    private static Point3 position(Landmark landmark) {
        return Point3.of(landmark.getX(), landmark.getY(), landmark.getZ());
    }

    private static String label(Landmark landmark, int index) {
        if (landmark.getName() != null && !landmark.getName().isBlank()) {
            return landmark.getName();
        }
        return index == HEAD_LANDMARK_INDEX ? "head" : "landmark " + index;
    }
}
