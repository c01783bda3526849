package com.ekkalavya.artraining.domain;

import com.ekkalavya.artraining.model.PlatformContext;
import com.ekkalavya.artraining.model.ScoreBreakdown;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "ar_training_sessions", indexes = {
        @Index(name = "idx_training_sessions_user", columnList = "user_id"),
        @Index(name = "idx_training_sessions_status", columnList = "status")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class TrainingSession {

    @Id
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "sport", nullable = false, length = 30)
    private String sport;

    @Column(name = "drill_pattern_id", nullable = false, length = 60)
    private String drillPatternId;

    @Column(name = "difficulty", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private Difficulty difficulty;

    @Column(name = "device_platform", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private DevicePlatform devicePlatform;

    @Column(name = "status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private SessionStatus status = SessionStatus.ACTIVE;

    @Column(name = "total_bounces")
    @Builder.Default
    private int totalBounces = 0;

    @Column(name = "successful_hits")
    @Builder.Default
    private int successfulHits = 0;

    @Column(name = "max_streak")
    @Builder.Default
    private int maxStreak = 0;

    @Column(name = "accuracy")
    private Double accuracy;

    @Column(name = "average_reaction_time_ms")
    private Double averageReactionTimeMs;

    @Column(name = "precision_score")
    private Double precisionScore;

    @Column(name = "pace_score")
    private Double paceScore;

    @Column(name = "streak_score")
    private Double streakScore;

    // only ever derived from a ScoreBreakdown, see withScores
    @Column(name = "total_score")
    @Setter(AccessLevel.NONE)
    private Double totalScore;

    @Embedded
    private RoomQualityMetrics roomQuality;

    @Column(name = "last_reporting_platform", length = 20)
    @Enumerated(EnumType.STRING)
    private SyncPlatform lastReportingPlatform;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "platform_context", columnDefinition = "jsonb")
    private PlatformContext platformContext;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "transition_log", columnDefinition = "jsonb")
    @Builder.Default
    private List<TransitionRecord> transitionLog = new ArrayList<>();

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "duration_seconds")
    private Long durationSeconds;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    /**
     * Entry of the append-only status history.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TransitionRecord {
        private SessionStatus from;
        private SessionStatus to;
        private SessionTrigger trigger;
        private String cause;
        private LocalDateTime occurredAt;
    }

    /**
     * Copy of this session carrying the given scores and the counters they were computed from.
     */
    public TrainingSession withScores(ScoreBreakdown scores) {
        return toBuilder()
                .totalBounces(scores.getAttempts())
                .successfulHits(scores.getHits())
                .maxStreak(scores.getMaxStreak())
                .accuracy(scores.getAccuracy())
                .averageReactionTimeMs(scores.getAverageIntervalMs())
                .precisionScore(scores.getPrecisionScore())
                .paceScore(scores.getPaceScore())
                .streakScore(scores.getStreakScore())
                .totalScore(scores.getTotalScore())
                .build();
    }

    public TrainingSession withTransition(TransitionRecord record) {
        List<TransitionRecord> log = new ArrayList<>(transitionLog == null ? List.of() : transitionLog);
        log.add(record);
        return toBuilder()
                .status(record.getTo())
                .transitionLog(log)
                .build();
    }

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    public long elapsedSecondsAt(LocalDateTime at) {
        if (startedAt == null || at == null) {
            return 0L;
        }
        return Math.max(0L, Duration.between(startedAt, at).getSeconds());
    }
}
