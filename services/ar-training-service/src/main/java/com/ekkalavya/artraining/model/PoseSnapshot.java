package com.ekkalavya.artraining.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One frame of pose landmarks. Index 0 is the head (nose) landmark.
 * The previous frame is optional and only used for the speed check.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoseSnapshot {
    private Long timestampMs;
    private List<Landmark> landmarks;
    private Long previousTimestampMs;
    private List<Landmark> previousLandmarks;
}
