package com.ekkalavya.artraining.model;

import com.ekkalavya.artraining.domain.Difficulty;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Validated, immutable view of one sport's tuning. Built by the sport catalog at startup.
 */
@Value
@Builder
public class SportProfile {
    String sport;
    Map<Difficulty, Double> tolerancesMm;
    double precisionWeight;
    double paceWeight;
    double streakWeight;
    double paceTargetHz;
    int streakCap;
    double venueAreaThreshold;
    double minCeilingHeight;
    double overheadCeilingHeight;

    public double toleranceFor(Difficulty difficulty) {
        return tolerancesMm.get(difficulty == null ? Difficulty.MEDIUM : difficulty);
    }
}
