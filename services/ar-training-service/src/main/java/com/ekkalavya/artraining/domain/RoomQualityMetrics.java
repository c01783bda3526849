package com.ekkalavya.artraining.domain;

import com.ekkalavya.artraining.model.Point3;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Room-session quality block merged from cross-platform sync reports.
 */
@Embeddable
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RoomQualityMetrics {

    @Column(name = "average_fps")
    private Double averageFps;

    @Column(name = "tracking_quality")
    private Double trackingQuality;

    @Column(name = "room_safety_score")
    private Double safetyScore;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "room_center", columnDefinition = "jsonb")
    private Point3 roomCenter;

    @Column(name = "scale_factor")
    private Double scaleFactor;

    @Column(name = "obstacle_count")
    private Integer obstacleCount;

    @Column(name = "lighting_conditions", length = 20)
    @Enumerated(EnumType.STRING)
    private LightingCondition lightingConditions;

    @Column(name = "reflective_surfaces")
    private Boolean reflectiveSurfaces;
}
