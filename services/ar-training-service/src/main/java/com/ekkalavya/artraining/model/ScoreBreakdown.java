package com.ekkalavya.artraining.model;

import lombok.Builder;
import lombok.Value;

/**
 * Component scores (0..100 each) and the weighted total derived from them.
 */
@Value
@Builder
public class ScoreBreakdown {
    int attempts;
    int hits;
    int maxStreak;
    double cadenceHz;
    double averageIntervalMs;
    double precisionScore;
    double paceScore;
    double streakScore;
    double precisionWeight;
    double paceWeight;
    double streakWeight;

    public static ScoreBreakdown empty(SportProfile profile) {
        return ScoreBreakdown.builder()
                .precisionWeight(profile.getPrecisionWeight())
                .paceWeight(profile.getPaceWeight())
                .streakWeight(profile.getStreakWeight())
                .build();
    }

    public double getPrecisionContribution() {
        return precisionScore * precisionWeight / 100.0;
    }

    public double getPaceContribution() {
        return paceScore * paceWeight / 100.0;
    }

    public double getStreakContribution() {
        return streakScore * streakWeight / 100.0;
    }

    public double getTotalScore() {
        return getPrecisionContribution() + getPaceContribution() + getStreakContribution();
    }

    /** Hit ratio in percent; same value as precision but kept for the accuracy rollup. */
    public double getAccuracy() {
        return attempts == 0 ? 0.0 : hits * 100.0 / attempts;
    }
}
