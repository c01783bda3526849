package com.ekkalavya.artraining.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Per-session score rollup, written when a session completes.
 */
@Entity
@Table(name = "ar_performance_metrics", indexes = {
        @Index(name = "idx_performance_metrics_user_sport", columnList = "user_id, sport, metric_type")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PerformanceMetric {

    @Id
    @GeneratedValue
    private UUID id;

    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "sport", nullable = false, length = 30)
    private String sport;

    @Column(name = "metric_type", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private MetricType metricType;

    @Column(name = "period_type", nullable = false, length = 20)
    @Builder.Default
    private String periodType = "SESSION";

    @Column(name = "metric_value", nullable = false)
    private double value;

    @Column(name = "difficulty", length = 20)
    @Enumerated(EnumType.STRING)
    private Difficulty difficulty;

    @Column(name = "calculated_at", nullable = false)
    private LocalDateTime calculatedAt;
}
