package com.ekkalavya.artraining.model;

import com.ekkalavya.artraining.domain.LightingCondition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Detected floor plane plus room context from an AR scan. Dimensions in metres.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaneScan {
    private Double width;
    private Double height;
    private Double ceilingHeight;
    @Builder.Default
    private boolean flat = true;
    @Builder.Default
    private int obstacleCount = 0;
    @Builder.Default
    private LightingCondition lighting = LightingCondition.GOOD;
    @Builder.Default
    private boolean reflectiveSurfaces = false;
}
