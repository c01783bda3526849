package com.ekkalavya.artraining.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single drill target. {@code x}/{@code y} are metres from the usable-area origin,
 * the normalized pair is the same position divided by the area dimensions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TargetMarker {
    private String id;
    private int index;
    private double x;
    private double y;
    private double normalizedX;
    private double normalizedY;
    private double toleranceRadiusMm;
    private Double pixelX;
    private Double pixelY;
}
