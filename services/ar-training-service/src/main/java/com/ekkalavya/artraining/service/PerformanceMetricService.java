package com.ekkalavya.artraining.service;

import com.ekkalavya.artraining.domain.MetricType;
import com.ekkalavya.artraining.domain.PerformanceMetric;
import com.ekkalavya.artraining.domain.RoomConstraints;
import com.ekkalavya.artraining.domain.SafetyIncident;
import com.ekkalavya.artraining.domain.SessionStatus;
import com.ekkalavya.artraining.domain.TrainingSession;
import com.ekkalavya.artraining.dto.MetricAverageResponse;
import com.ekkalavya.artraining.dto.RoomAnalyticsResponse;
import com.ekkalavya.artraining.engine.TrendCalculator;
import com.ekkalavya.artraining.repository.PerformanceMetricRepository;
import com.ekkalavya.artraining.repository.RoomConstraintsRepository;
import com.ekkalavya.artraining.repository.SafetyIncidentRepository;
import com.ekkalavya.artraining.repository.TrainingSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Writes per-session score rollups and reads a user's metric history and room analytics.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PerformanceMetricService {

    static final String SESSION_PERIOD = "SESSION";

    private final PerformanceMetricRepository metricRepository;
    private final TrainingSessionRepository sessionRepository;
    private final RoomConstraintsRepository roomConstraintsRepository;
    private final SafetyIncidentRepository safetyIncidentRepository;

    public List<PerformanceMetric> recordSessionRollups(TrainingSession session, LocalDateTime calculatedAt) {
        List<PerformanceMetric> rollups = List.of(
                rollup(session, MetricType.PRECISION, session.getPrecisionScore(), calculatedAt),
                rollup(session, MetricType.PACE, session.getPaceScore(), calculatedAt),
                rollup(session, MetricType.STREAK, session.getStreakScore(), calculatedAt),
                rollup(session, MetricType.ACCURACY, session.getAccuracy(), calculatedAt));

        List<PerformanceMetric> saved = metricRepository.saveAll(rollups);
        log.debug("Recorded {} performance metrics for session {}", saved.size(), session.getId());
        return saved;
    }

    public List<PerformanceMetric> getMetricHistory(UUID userId, String sport, MetricType metricType) {
        return metricRepository.findByUserIdAndSportAndMetricTypeOrderByCalculatedAtDesc(
                userId, sport.trim().toLowerCase(Locale.ROOT), metricType);
    }

    public MetricAverageResponse getAverage(UUID userId, String sport, MetricType metricType) {
        String normalizedSport = sport.trim().toLowerCase(Locale.ROOT);
        Double average = metricRepository.averageValue(userId, normalizedSport, metricType);
        return MetricAverageResponse.builder()
                .userId(userId)
                .sport(normalizedSport)
                .metricType(metricType)
                .average(average == null ? 0.0 : average)
                .build();
    }

    /**
     * Aggregates the user's completed sessions whose latest room analysis enabled room mode.
     */
    public RoomAnalyticsResponse getRoomAnalytics(UUID userId) {
        List<TrainingSession> completed =
                sessionRepository.findByUserIdAndStatusOrderByStartedAtDesc(userId, SessionStatus.COMPLETED);
        if (completed.isEmpty()) {
            return RoomAnalyticsResponse.empty(userId);
        }

        Map<UUID, RoomConstraints> latestRooms = roomConstraintsRepository.findBySessionIdIn(
                        completed.stream().map(TrainingSession::getId).collect(Collectors.toList()))
                .stream()
                .collect(Collectors.toMap(RoomConstraints::getSessionId, Function.identity(), newestAnalysis()));
        List<TrainingSession> roomSessions = completed.stream()
                .filter(session -> {
                    RoomConstraints room = latestRooms.get(session.getId());
                    return room != null && room.isRoomMode();
                })
                .collect(Collectors.toList());
        if (roomSessions.isEmpty()) {
            return RoomAnalyticsResponse.empty(userId);
        }

        Map<UUID, List<SafetyIncident>> incidentsBySession = safetyIncidentRepository.findBySessionIdIn(
                        roomSessions.stream().map(TrainingSession::getId).collect(Collectors.toList()))
                .stream()
                .collect(Collectors.groupingBy(SafetyIncident::getSessionId));

        List<Integer> incidentCounts = roomSessions.stream()
                .map(session -> incidentsBySession.getOrDefault(session.getId(), List.of()).size())
                .collect(Collectors.toList());
        long totalIncidents = incidentCounts.stream().mapToLong(Integer::longValue).sum();
        long criticalIncidents = incidentsBySession.values().stream()
                .flatMap(List::stream)
                .filter(SafetyIncident::isCritical)
                .count();
        long sessionsWithCritical = roomSessions.stream()
                .filter(session -> incidentsBySession.getOrDefault(session.getId(), List.of()).stream()
                        .anyMatch(SafetyIncident::isCritical))
                .count();
        int sessionCount = roomSessions.size();

        List<Double> totalScores = roomSessions.stream()
                .map(TrainingSession::getTotalScore)
                .collect(Collectors.toList());

        RoomAnalyticsResponse analytics = RoomAnalyticsResponse.builder()
                .userId(userId)
                .totalRoomSessions(sessionCount)
                .patternDistribution(roomSessions.stream().collect(Collectors.groupingBy(
                        TrainingSession::getDrillPatternId, TreeMap::new, Collectors.counting())))
                .safetyMetrics(RoomAnalyticsResponse.SafetyMetrics.builder()
                        .totalIncidents(totalIncidents)
                        .averageIncidentsPerSession((double) totalIncidents / sessionCount)
                        .criticalIncidents(criticalIncidents)
                        .safetyComplianceRate((sessionCount - sessionsWithCritical) * 100.0 / sessionCount)
                        .build())
                .averageScores(RoomAnalyticsResponse.AverageScores.builder()
                        .overallScore(averageOf(totalScores))
                        .accuracy(averageOf(roomSessions.stream()
                                .map(TrainingSession::getAccuracy)
                                .collect(Collectors.toList())))
                        .build())
                .improvement(RoomAnalyticsResponse.Improvement.builder()
                        .scoresTrend(TrendCalculator.scoreTrend(totalScores))
                        .safetyTrend(TrendCalculator.safetyTrend(incidentCounts))
                        .build())
                .build();

        log.debug("Room analytics for user {}: {} room sessions of {} completed",
                userId, sessionCount, completed.size());
        return analytics;
    }

    private static BinaryOperator<RoomConstraints> newestAnalysis() {
        return (a, b) -> b.getAnalyzedAt() != null
                && (a.getAnalyzedAt() == null || b.getAnalyzedAt().isAfter(a.getAnalyzedAt())) ? b : a;
    }

    private static double averageOf(List<Double> values) {
        return values.stream()
                .mapToDouble(value -> value == null ? 0.0 : value)
                .average()
                .orElse(0.0);
    }

    private static PerformanceMetric rollup(TrainingSession session, MetricType type, Double value,
                                            LocalDateTime calculatedAt) {
        return PerformanceMetric.builder()
                .sessionId(session.getId())
                .userId(session.getUserId())
                .sport(session.getSport())
                .metricType(type)
                .periodType(SESSION_PERIOD)
                .value(value == null ? 0.0 : value)
                .difficulty(session.getDifficulty())
                .calculatedAt(calculatedAt)
                .build();
    }
}
