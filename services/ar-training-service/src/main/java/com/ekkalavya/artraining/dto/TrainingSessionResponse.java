package com.ekkalavya.artraining.dto;

import com.ekkalavya.artraining.domain.DevicePlatform;
import com.ekkalavya.artraining.domain.Difficulty;
import com.ekkalavya.artraining.domain.RoomQualityMetrics;
import com.ekkalavya.artraining.domain.SessionStatus;
import com.ekkalavya.artraining.domain.SyncPlatform;
import com.ekkalavya.artraining.domain.TrainingSession;
import com.ekkalavya.artraining.model.PlatformContext;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrainingSessionResponse {

    private UUID sessionId;
    private UUID userId;
    private String sport;
    private String drillPatternId;
    private Difficulty difficulty;
    private DevicePlatform devicePlatform;
    private SessionStatus status;

    private int totalBounces;
    private int successfulHits;
    private int maxStreak;
    private Double accuracy;
    private Double averageReactionTimeMs;
    private Double precisionScore;
    private Double paceScore;
    private Double streakScore;
    private Double totalScore;

    private RoomQualityMetrics roomQuality;
    private SyncPlatform lastReportingPlatform;
    private PlatformContext platformContext;
    private List<TrainingSession.TransitionRecord> transitionLog;

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Long durationSeconds;
    private LocalDateTime updatedAt;

    public static TrainingSessionResponse from(TrainingSession session) {
        return TrainingSessionResponse.builder()
                .sessionId(session.getId())
                .userId(session.getUserId())
                .sport(session.getSport())
                .drillPatternId(session.getDrillPatternId())
                .difficulty(session.getDifficulty())
                .devicePlatform(session.getDevicePlatform())
                .status(session.getStatus())
                .totalBounces(session.getTotalBounces())
                .successfulHits(session.getSuccessfulHits())
                .maxStreak(session.getMaxStreak())
                .accuracy(session.getAccuracy())
                .averageReactionTimeMs(session.getAverageReactionTimeMs())
                .precisionScore(session.getPrecisionScore())
                .paceScore(session.getPaceScore())
                .streakScore(session.getStreakScore())
                .totalScore(session.getTotalScore())
                .roomQuality(session.getRoomQuality())
                .lastReportingPlatform(session.getLastReportingPlatform())
                .platformContext(session.getPlatformContext())
                .transitionLog(session.getTransitionLog() == null ? List.of() : List.copyOf(session.getTransitionLog()))
                .startedAt(session.getStartedAt())
                .completedAt(session.getCompletedAt())
                .durationSeconds(session.getDurationSeconds())
                .updatedAt(session.getUpdatedAt())
                .build();
    }
}
