package com.ekkalavya.artraining.engine;

import com.ekkalavya.artraining.domain.RoomConstraints;
import com.ekkalavya.artraining.domain.SafetyIncident;
import com.ekkalavya.artraining.domain.SessionStatus;
import com.ekkalavya.artraining.domain.TrainingSession;
import com.ekkalavya.artraining.exception.TrainingValidationException;
import com.ekkalavya.artraining.model.Landmark;
import com.ekkalavya.artraining.model.PoseSnapshot;
import com.ekkalavya.artraining.model.SafetyEvaluation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ekkalavya.artraining.TrainingFixtures.STARTED_AT;
import static com.ekkalavya.artraining.TrainingFixtures.properties;
import static com.ekkalavya.artraining.TrainingFixtures.room;
import static com.ekkalavya.artraining.TrainingFixtures.session;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PoseSafetyMonitor Tests")
class PoseSafetyMonitorTest {

    private final PoseSafetyMonitor monitor = new PoseSafetyMonitor(properties());
    private final TrainingSession session = session(SessionStatus.ACTIVE);

    // 3 x 2 m room: walls at x = +-1.5 and z = +-1.0, ceiling 2.6 m
    private final RoomConstraints room = room(3.0, 2.0, 2.6, 100.0);

    private static Landmark landmark(String name, double x, double y, double z, double visibility) {
        return Landmark.builder().name(name).x(x).y(y).z(z).visibility(visibility).build();
    }

    private static PoseSnapshot pose(Landmark... landmarks) {
        return PoseSnapshot.builder().timestampMs(1_000L).landmarks(List.of(landmarks)).build();
    }

    private SafetyEvaluation evaluate(PoseSnapshot pose) {
        return monitor.evaluate(session, pose, room, STARTED_AT);
    }

    @Nested
    @DisplayName("Wall proximity")
    class WallProximityTests {

        @Test
        @DisplayName("Centred pose is safe with no warnings")
        void shouldPassCentredPose() {
            SafetyEvaluation evaluation = evaluate(pose(
                    landmark("nose", 0.0, 1.7, 0.0, 0.9),
                    landmark("left_wrist", -0.4, 1.1, 0.1, 0.9)));

            assertThat(evaluation.isSafe()).isTrue();
            assertThat(evaluation.getWarnings()).isEmpty();
            assertThat(evaluation.isPauseRequired()).isFalse();
        }

        @Test
        @DisplayName("Landmark within 0.3 m of a wall raises a warning")
        void shouldWarnNearWall() {
            SafetyEvaluation evaluation = evaluate(pose(
                    landmark("nose", 0.0, 1.7, 0.0, 0.9),
                    landmark("right_wrist", 1.3, 1.1, 0.0, 0.9)));

            assertThat(evaluation.isSafe()).isFalse();
            assertThat(evaluation.isPauseRequired()).isFalse();
            assertThat(evaluation.getWarnings()).singleElement().asString().contains("right_wrist");
            assertThat(evaluation.getIncidents()).singleElement().satisfies(incident -> {
                assertThat(incident.getIncidentType()).isEqualTo(SafetyIncident.IncidentType.BOUNDARY_VIOLATION);
                assertThat(incident.getSeverity()).isEqualTo(SafetyIncident.Severity.WARNING);
            });
        }

        @Test
        @DisplayName("Landmark within 0.1 m of a wall is critical and requires a pause")
        void shouldEscalateCriticalProximity() {
            SafetyEvaluation evaluation = evaluate(pose(
                    landmark("nose", 0.0, 1.7, 0.0, 0.9),
                    landmark("left_ankle", 0.0, 0.1, -0.95, 0.8)));

            assertThat(evaluation.isPauseRequired()).isTrue();
            assertThat(evaluation.getIncidents()).singleElement().satisfies(incident -> {
                assertThat(incident.getIncidentType()).isEqualTo(SafetyIncident.IncidentType.COLLISION_RISK);
                assertThat(incident.getSeverity()).isEqualTo(SafetyIncident.Severity.CRITICAL);
                assertThat(incident.getAutomaticResponse()).isEqualTo("pause");
                assertThat(incident.isSessionPaused()).isFalse();
                assertThat(incident.getSessionId()).isEqualTo(session.getId());
                assertThat(incident.getUserPosition().getZ()).isEqualTo(-0.95);
            });
        }

        @Test
        @DisplayName("Landmark outside the room counts as critical")
        void shouldTreatOutsideAsCritical() {
            SafetyEvaluation evaluation = evaluate(pose(landmark("right_hand", 1.7, 1.0, 0.0, 0.9)));

            assertThat(evaluation.isPauseRequired()).isTrue();
        }

        @Test
        @DisplayName("Low-visibility landmarks are not checked")
        void shouldIgnoreLowVisibilityLandmarks() {
            SafetyEvaluation evaluation = evaluate(pose(
                    landmark("nose", 0.0, 1.7, 0.0, 0.9),
                    landmark("left_wrist", -1.45, 1.1, 0.0, 0.5)));

            assertThat(evaluation.isSafe()).isTrue();
            assertThat(evaluation.getIncidents()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Ceiling and general checks")
    class CeilingTests {

        @Test
        @DisplayName("Head close to the ceiling is critical")
        void shouldFlagHeadAtCeiling() {
            SafetyEvaluation evaluation = evaluate(pose(landmark("nose", 0.0, 2.55, 0.0, 0.9)));

            assertThat(evaluation.isPauseRequired()).isTrue();
            assertThat(evaluation.getWarnings()).singleElement().asString().contains("ceiling");
        }

        @Test
        @DisplayName("Ceiling is skipped when unknown")
        void shouldSkipCeilingWhenUnknown() {
            SafetyEvaluation evaluation = monitor.evaluate(session,
                    pose(landmark("nose", 0.0, 2.55, 0.0, 0.9)), room(3.0, 2.0, null, 100.0), STARTED_AT);

            assertThat(evaluation.isSafe()).isTrue();
        }

        @Test
        @DisplayName("Low room safety score adds a general warning")
        void shouldWarnOnLowRoomScore() {
            SafetyEvaluation evaluation = monitor.evaluate(session,
                    pose(landmark("nose", 0.0, 1.7, 0.0, 0.9)), room(3.0, 2.0, 2.6, 60.0), STARTED_AT);

            assertThat(evaluation.isSafe()).isTrue();
            assertThat(evaluation.getWarnings()).containsExactly("Room conditions may not be optimal for safe training");
        }

        @Test
        @DisplayName("No visible landmark reports tracking loss")
        void shouldReportTrackingLoss() {
            SafetyEvaluation evaluation = evaluate(pose(landmark("nose", 0.0, 1.7, 0.0, 0.1)));

            assertThat(evaluation.getIncidents()).singleElement()
                    .extracting(SafetyIncident::getIncidentType)
                    .isEqualTo(SafetyIncident.IncidentType.TRACKING_LOST);
            assertThat(evaluation.isPauseRequired()).isFalse();
        }

        @Test
        @DisplayName("Fast landmark movement is flagged as unsafe")
        void shouldFlagFastMovement() {
            PoseSnapshot pose = PoseSnapshot.builder()
                    .timestampMs(1_100L)
                    .landmarks(List.of(landmark("right_wrist", 0.5, 1.2, 0.0, 0.9)))
                    .previousTimestampMs(1_000L)
                    .previousLandmarks(List.of(landmark("right_wrist", 0.0, 1.2, 0.0, 0.9)))
                    .build();

            SafetyEvaluation evaluation = evaluate(pose);

            assertThat(evaluation.isSafe()).isFalse();
            assertThat(evaluation.getIncidents()).singleElement()
                    .extracting(SafetyIncident::getIncidentType)
                    .isEqualTo(SafetyIncident.IncidentType.POSE_UNSAFE);
        }

        @Test
        @DisplayName("Room geometry is left untouched")
        void shouldNotMutateRoom() {
            RoomConstraints before = room(3.0, 2.0, 2.6, 100.0);

            evaluate(pose(landmark("right_hand", 1.45, 1.0, 0.0, 0.9)));

            assertThat(room).isEqualTo(before);
        }

        @Test
        void shouldRequireRoom() {
            assertThatThrownBy(() -> monitor.evaluate(session, pose(), null, STARTED_AT))
                    .isInstanceOf(TrainingValidationException.class);
        }
    }
}
