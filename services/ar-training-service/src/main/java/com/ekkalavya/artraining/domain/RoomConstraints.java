package com.ekkalavya.artraining.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Result of one room scan analysis. Each scan is stored as its own row; the newest
 * row is the session's current room.
 */
@Entity
@Table(name = "ar_room_constraints", indexes = {
        @Index(name = "idx_room_constraints_session", columnList = "session_id, analyzed_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoomConstraints {

    @Id
    @GeneratedValue
    private UUID id;

    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @Column(name = "sport", nullable = false, length = 30)
    private String sport;

    @Column(name = "width", nullable = false)
    private double width;

    @Column(name = "height", nullable = false)
    private double height;

    @Column(name = "area", nullable = false)
    private double area;

    @Column(name = "aspect_ratio", nullable = false)
    private double aspectRatio;

    @Column(name = "ceiling_height")
    private Double ceilingHeight;

    @Column(name = "is_flat", nullable = false)
    private boolean flat;

    @Column(name = "obstacle_count", nullable = false)
    private int obstacleCount;

    @Column(name = "lighting", length = 20)
    @Enumerated(EnumType.STRING)
    private LightingCondition lighting;

    @Column(name = "reflective_surfaces", nullable = false)
    private boolean reflectiveSurfaces;

    @Column(name = "safety_score", nullable = false)
    private double safetyScore;

    @Column(name = "is_room_mode", nullable = false)
    private boolean roomMode;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "recommended_patterns", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> recommendedPatterns = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "safety_warnings", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> safetyWarnings = new ArrayList<>();

    @Column(name = "analyzed_at", nullable = false)
    private LocalDateTime analyzedAt;

    public boolean hasCeilingHeight() {
        return ceilingHeight != null;
    }
}
