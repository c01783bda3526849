package com.ekkalavya.artraining.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A detected ball impact as reported by the client.
 *
 * <p>Confidences are on a 0..100 scale; either may be absent when the corresponding
 * detector did not fire.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImpactData {
    private Long timestampMs;
    private Point3 worldPosition;
    private Point3 courtPosition;
    private Integer targetIndex;
    private Point3 targetPosition;
    private Double visionConfidence;
    private Double audioConfidence;
}
