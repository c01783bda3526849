package com.ekkalavya.artraining.engine;

import com.ekkalavya.artraining.domain.BounceEvent;
import com.ekkalavya.artraining.model.ScoreBreakdown;
import com.ekkalavya.artraining.model.SportProfile;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Recomputes precision, pace and streak sub-scores from the full event stream.
 *
 * <p>Scores are always derived from the ordered events, never accumulated, so replaying
 * the same stream yields the same breakdown.
 */
@Component
public class ScoringEngine {

    public ScoreBreakdown score(List<BounceEvent> events, SportProfile profile) {
        if (events == null || events.isEmpty()) {
            return ScoreBreakdown.empty(profile);
        }

        int attempts = events.size();
        int hits = 0;
        int streak = 0;
        int maxStreak = 0;
        long firstTs = Long.MAX_VALUE;
        long lastTs = Long.MIN_VALUE;

        for (BounceEvent event : events) {
            if (event.isHit()) {
                hits++;
                streak++;
                maxStreak = Math.max(maxStreak, streak);
            } else {
                streak = 0;
            }
            firstTs = Math.min(firstTs, event.getTimestampMs());
            lastTs = Math.max(lastTs, event.getTimestampMs());
        }

        double spanSeconds = (lastTs - firstTs) / 1000.0;
        double cadenceHz = attempts > 1 && spanSeconds > 0 ? (attempts - 1) / spanSeconds : 0.0;
        double averageIntervalMs = attempts > 1 && spanSeconds > 0 ? spanSeconds * 1000.0 / (attempts - 1) : 0.0;

        return ScoreBreakdown.builder()
                .attempts(attempts)
                .hits(hits)
                .maxStreak(maxStreak)
                .cadenceHz(cadenceHz)
                .averageIntervalMs(averageIntervalMs)
                .precisionScore(hits * 100.0 / attempts)
                .paceScore(paceScore(cadenceHz, profile.getPaceTargetHz()))
                .streakScore(streakScore(maxStreak, profile.getStreakCap()))
                .precisionWeight(profile.getPrecisionWeight())
                .paceWeight(profile.getPaceWeight())
                .streakWeight(profile.getStreakWeight())
                .build();
    }

    /**
     * 100 at the target cadence, falling linearly to 0 at a deviation of one full target in
     * either direction. No cadence (fewer than two timed bounces) scores 0.
     */
    double paceScore(double cadenceHz, double targetHz) {
        if (cadenceHz <= 0) {
            return 0.0;
        }
        double deviation = Math.abs(cadenceHz - targetHz) / targetHz;
        return Math.max(0.0, 100.0 * (1.0 - deviation));
    }

    double streakScore(int maxStreak, int cap) {
        return Math.min(maxStreak, cap) * 100.0 / cap;
    }
}
