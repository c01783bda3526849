package com.ekkalavya.artraining.engine;

import com.ekkalavya.artraining.domain.PerformanceTrend;

import java.util.List;

/**
 * Compares a user's most recent sessions with the ones before them.
 *
 * <p>Inputs are ordered newest first. The recent window holds up to five sessions but
 * always leaves at least one older session to compare against; fewer than two sessions
 * is {@link PerformanceTrend#INSUFFICIENT_DATA}.
 */
public final class TrendCalculator {

    static final int RECENT_WINDOW = 5;

    /** Average score must move more than 10% to count as a change. */
    static final double SCORE_BAND = 0.10;

    /** Incident rate must move more than 20% to count as a change. */
    static final double SAFETY_BAND = 0.20;

    private TrendCalculator() {
    }

    public static PerformanceTrend scoreTrend(List<Double> scoresNewestFirst) {
        if (scoresNewestFirst.size() < 2) {
            return PerformanceTrend.INSUFFICIENT_DATA;
        }
        int split = recentCount(scoresNewestFirst.size());
        double recent = average(scoresNewestFirst.subList(0, split));
        double older = average(scoresNewestFirst.subList(split, scoresNewestFirst.size()));

        if (recent > older * (1.0 + SCORE_BAND)) {
            return PerformanceTrend.IMPROVING;
        }
        if (recent < older * (1.0 - SCORE_BAND)) {
            return PerformanceTrend.DECLINING;
        }
        return PerformanceTrend.STABLE;
    }

    /**
     * Fewer incidents per session is an improvement, so the bands are inverted.
     */
    public static PerformanceTrend safetyTrend(List<Integer> incidentsNewestFirst) {
        if (incidentsNewestFirst.size() < 2) {
            return PerformanceTrend.INSUFFICIENT_DATA;
        }
        int split = recentCount(incidentsNewestFirst.size());
        double recentRate = incidentsNewestFirst.subList(0, split).stream()
                .mapToInt(Integer::intValue).average().orElse(0.0);
        double olderRate = incidentsNewestFirst.subList(split, incidentsNewestFirst.size()).stream()
                .mapToInt(Integer::intValue).average().orElse(0.0);

        if (recentRate < olderRate * (1.0 - SAFETY_BAND)) {
            return PerformanceTrend.IMPROVING;
        }
        if (recentRate > olderRate * (1.0 + SAFETY_BAND)) {
            return PerformanceTrend.DECLINING;
        }
        return PerformanceTrend.STABLE;
    }

    private static int recentCount(int total) {
        return Math.min(RECENT_WINDOW, total - 1);
    }

    private static double average(List<Double> values) {
        return values.stream()
                .mapToDouble(value -> value == null ? 0.0 : value)
                .average()
                .orElse(0.0);
    }
}
