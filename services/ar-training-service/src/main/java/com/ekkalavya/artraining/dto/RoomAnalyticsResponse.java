package com.ekkalavya.artraining.dto;

import com.ekkalavya.artraining.domain.PerformanceTrend;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.UUID;

/**
 * Aggregate over a user's completed room-mode sessions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoomAnalyticsResponse {

    private UUID userId;
    private int totalRoomSessions;
    private Map<String, Long> patternDistribution;
    private SafetyMetrics safetyMetrics;
    private AverageScores averageScores;
    private Improvement improvement;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class SafetyMetrics {
        private long totalIncidents;
        private double averageIncidentsPerSession;
        private long criticalIncidents;
        private double safetyComplianceRate; // % of sessions without a critical incident
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class AverageScores {
        private double overallScore;
        private double accuracy;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Improvement {
        private PerformanceTrend scoresTrend;
        private PerformanceTrend safetyTrend;
    }

    public static RoomAnalyticsResponse empty(UUID userId) {
        return RoomAnalyticsResponse.builder()
                .userId(userId)
                .totalRoomSessions(0)
                .patternDistribution(Map.of())
                .safetyMetrics(new SafetyMetrics())
                .averageScores(new AverageScores())
                .improvement(new Improvement(PerformanceTrend.INSUFFICIENT_DATA, PerformanceTrend.INSUFFICIENT_DATA))
                .build();
    }
}
