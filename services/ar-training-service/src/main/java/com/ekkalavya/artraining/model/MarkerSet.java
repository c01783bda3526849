package com.ekkalavya.artraining.model;

import com.ekkalavya.artraining.domain.Difficulty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarkerSet {
    private String patternId;
    private String sport;
    private Difficulty difficulty;
    private UsableArea usableArea;
    private double safetyMargin;
    private List<TargetMarker> markers;
}
