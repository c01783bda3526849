package com.ekkalavya.artraining.service;

import com.ekkalavya.artraining.domain.MetricType;
import com.ekkalavya.artraining.domain.PerformanceMetric;
import com.ekkalavya.artraining.domain.PerformanceTrend;
import com.ekkalavya.artraining.domain.RoomConstraints;
import com.ekkalavya.artraining.domain.SafetyIncident;
import com.ekkalavya.artraining.domain.SessionStatus;
import com.ekkalavya.artraining.domain.TrainingSession;
import com.ekkalavya.artraining.dto.MetricAverageResponse;
import com.ekkalavya.artraining.dto.RoomAnalyticsResponse;
import com.ekkalavya.artraining.engine.ScoringEngine;
import com.ekkalavya.artraining.model.ScoreBreakdown;
import com.ekkalavya.artraining.repository.PerformanceMetricRepository;
import com.ekkalavya.artraining.repository.RoomConstraintsRepository;
import com.ekkalavya.artraining.repository.SafetyIncidentRepository;
import com.ekkalavya.artraining.repository.TrainingSessionRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;

import static com.ekkalavya.artraining.TrainingFixtures.STARTED_AT;
import static com.ekkalavya.artraining.TrainingFixtures.USER_ID;
import static com.ekkalavya.artraining.TrainingFixtures.bounces;
import static com.ekkalavya.artraining.TrainingFixtures.catalog;
import static com.ekkalavya.artraining.TrainingFixtures.room;
import static com.ekkalavya.artraining.TrainingFixtures.session;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PerformanceMetricService Unit Tests")
class PerformanceMetricServiceTest {

    @Mock
    private PerformanceMetricRepository metricRepository;

    @Mock
    private TrainingSessionRepository sessionRepository;

    @Mock
    private RoomConstraintsRepository roomConstraintsRepository;

    @Mock
    private SafetyIncidentRepository safetyIncidentRepository;

    @InjectMocks
    private PerformanceMetricService metricService;

    @Test
    @DisplayName("Completed session yields one rollup per score component")
    void shouldRecordRollups() {
        ScoreBreakdown scores = new ScoringEngine()
                .score(bounces(500, true, true, false, true), catalog().getProfile("basketball"));
        TrainingSession completed = session(SessionStatus.COMPLETED).withScores(scores);
        when(metricRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));

        List<PerformanceMetric> rollups = metricService.recordSessionRollups(completed, STARTED_AT);

        assertThat(rollups)
                .extracting(PerformanceMetric::getMetricType)
                .containsExactly(MetricType.PRECISION, MetricType.PACE, MetricType.STREAK, MetricType.ACCURACY);
        assertThat(rollups).allSatisfy(metric -> {
            assertThat(metric.getUserId()).isEqualTo(USER_ID);
            assertThat(metric.getSport()).isEqualTo("basketball");
            assertThat(metric.getPeriodType()).isEqualTo("SESSION");
            assertThat(metric.getCalculatedAt()).isEqualTo(STARTED_AT);
        });
        assertThat(rollups.get(3).getValue()).isEqualTo(75.0);
    }

    @Test
    @DisplayName("Average with no history is zero")
    void shouldDefaultAverageToZero() {
        when(metricRepository.averageValue(USER_ID, "tennis", MetricType.PACE)).thenReturn(null);

        MetricAverageResponse average = metricService.getAverage(USER_ID, " Tennis ", MetricType.PACE);

        assertThat(average.getAverage()).isZero();
        assertThat(average.getSport()).isEqualTo("tennis");
        assertThat(average.getMetricType()).isEqualTo(MetricType.PACE);
    }

    @Test
    void shouldReturnStoredAverage() {
        when(metricRepository.averageValue(USER_ID, "basketball", MetricType.ACCURACY)).thenReturn(72.5);

        assertThat(metricService.getAverage(USER_ID, "basketball", MetricType.ACCURACY).getAverage())
                .isEqualTo(72.5);
    }

    @Nested
    @DisplayName("Room analytics")
    class RoomAnalyticsTests {

        private final UUID newest = UUID.fromString("00000000-0000-0000-0000-000000000001");
        private final UUID older = UUID.fromString("00000000-0000-0000-0000-000000000002");
        private final UUID reanalysed = UUID.fromString("00000000-0000-0000-0000-000000000003");
        private final UUID outdoor = UUID.fromString("00000000-0000-0000-0000-000000000004");

        private TrainingSession completed(UUID id, String pattern, double totalScore, double accuracy) {
            return session(SessionStatus.COMPLETED).toBuilder()
                    .id(id)
                    .drillPatternId(pattern)
                    .totalScore(totalScore)
                    .accuracy(accuracy)
                    .build();
        }

        private RoomConstraints analysis(UUID sessionId, boolean roomMode, int minutesAfterStart) {
            RoomConstraints room = room(3.0, 3.0, 2.6, 90.0);
            room.setSessionId(sessionId);
            room.setRoomMode(roomMode);
            room.setAnalyzedAt(STARTED_AT.plusMinutes(minutesAfterStart));
            return room;
        }

        private SafetyIncident incident(UUID sessionId, SafetyIncident.Severity severity) {
            return SafetyIncident.builder()
                    .sessionId(sessionId)
                    .userId(USER_ID)
                    .incidentType(SafetyIncident.IncidentType.BOUNDARY_VIOLATION)
                    .severity(severity)
                    .occurredAt(STARTED_AT)
                    .build();
        }

        @Test
        @DisplayName("Only sessions whose latest analysis enabled room mode are aggregated")
        void shouldAggregateRoomModeSessions() {
            when(sessionRepository.findByUserIdAndStatusOrderByStartedAtDesc(USER_ID, SessionStatus.COMPLETED))
                    .thenReturn(List.of(
                            completed(newest, "dribble_box", 80.0, 90.0),
                            completed(older, "figure_8", 60.0, 70.0),
                            completed(reanalysed, "dribble_box", 10.0, 10.0),
                            completed(outdoor, "zigzag", 95.0, 95.0)));
            when(roomConstraintsRepository.findBySessionIdIn(List.of(newest, older, reanalysed, outdoor)))
                    .thenReturn(List.of(
                            analysis(newest, true, 0),
                            analysis(older, true, 0),
                            analysis(reanalysed, true, 0),
                            analysis(reanalysed, false, 5)));
            when(safetyIncidentRepository.findBySessionIdIn(List.of(newest, older)))
                    .thenReturn(List.of(
                            incident(newest, SafetyIncident.Severity.WARNING),
                            incident(older, SafetyIncident.Severity.CRITICAL),
                            incident(older, SafetyIncident.Severity.WARNING)));

            RoomAnalyticsResponse analytics = metricService.getRoomAnalytics(USER_ID);

            assertThat(analytics.getTotalRoomSessions()).isEqualTo(2);
            assertThat(analytics.getPatternDistribution())
                    .containsOnly(entry("dribble_box", 1L), entry("figure_8", 1L));

            RoomAnalyticsResponse.SafetyMetrics safety = analytics.getSafetyMetrics();
            assertThat(safety.getTotalIncidents()).isEqualTo(3L);
            assertThat(safety.getAverageIncidentsPerSession()).isEqualTo(1.5);
            assertThat(safety.getCriticalIncidents()).isEqualTo(1L);
            assertThat(safety.getSafetyComplianceRate()).isEqualTo(50.0);

            assertThat(analytics.getAverageScores().getOverallScore()).isEqualTo(70.0);
            assertThat(analytics.getAverageScores().getAccuracy()).isEqualTo(80.0);
            assertThat(analytics.getImprovement().getScoresTrend()).isEqualTo(PerformanceTrend.IMPROVING);
            assertThat(analytics.getImprovement().getSafetyTrend()).isEqualTo(PerformanceTrend.IMPROVING);
        }

        @Test
        @DisplayName("User without completed sessions gets an empty report")
        void shouldReturnEmptyReport() {
            when(sessionRepository.findByUserIdAndStatusOrderByStartedAtDesc(USER_ID, SessionStatus.COMPLETED))
                    .thenReturn(List.of());

            RoomAnalyticsResponse analytics = metricService.getRoomAnalytics(USER_ID);

            assertThat(analytics.getTotalRoomSessions()).isZero();
            assertThat(analytics.getPatternDistribution()).isEmpty();
            assertThat(analytics.getImprovement().getScoresTrend()).isEqualTo(PerformanceTrend.INSUFFICIENT_DATA);
            verify(safetyIncidentRepository, never()).findBySessionIdIn(any());
        }
    }
}
