package com.ekkalavya.artraining.domain;

import com.ekkalavya.artraining.model.Point3;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Validated ball impact. Rows are written once and never updated.
 */
@Entity
@Immutable
@Table(name = "ar_bounce_events", indexes = {
        @Index(name = "idx_bounce_events_session", columnList = "session_id, timestamp_ms")
})
@Getter
@ToString
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BounceEvent {

    @Id
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Column(name = "timestamp_ms", nullable = false, updatable = false)
    private long timestampMs;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "world_position", columnDefinition = "jsonb", updatable = false)
    private Point3 worldPosition;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "court_position", columnDefinition = "jsonb", updatable = false)
    private Point3 courtPosition;

    @Column(name = "target_index", nullable = false, updatable = false)
    private int targetIndex;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "target_position", columnDefinition = "jsonb", updatable = false)
    private Point3 targetPosition;

    @Column(name = "error_distance_mm", nullable = false, updatable = false)
    private double errorDistanceMm;

    @Column(name = "tolerance_radius_mm", nullable = false, updatable = false)
    private double toleranceRadiusMm;

    @Column(name = "is_hit", nullable = false, updatable = false)
    private boolean hit;

    @Column(name = "tolerance_zone", length = 10, updatable = false)
    @Enumerated(EnumType.STRING)
    private ToleranceZone zone;

    @Column(name = "vision_confidence", updatable = false)
    private Double visionConfidence;

    @Column(name = "audio_confidence", updatable = false)
    private Double audioConfidence;

    @Column(name = "fusion_confidence", nullable = false, updatable = false)
    private double fusionConfidence;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
