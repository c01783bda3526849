package com.ekkalavya.artraining.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tuning for the training engine: per-sport scoring and tolerances, marker placement,
 * pose safety thresholds and session locking.
 */
@Data
@ConfigurationProperties(prefix = "ekkalavya.training")
public class TrainingEngineProperties {

    /**
     * Sport profiles keyed by sport id (basketball, tennis, ...)
     */
    private Map<String, SportConfig> sports = defaultSports();

    private MarkerConfig markers = new MarkerConfig();

    private PoseSafetyConfig poseSafety = new PoseSafetyConfig();

    private LockingConfig locking = new LockingConfig();

    @Data
    public static class SportConfig {
        /**
         * Hit radius per difficulty in millimetres
         */
        private ToleranceConfig tolerancesMm = new ToleranceConfig();

        /**
         * Score weights in percent, must sum to 100
         */
        private WeightConfig weights = new WeightConfig();

        /**
         * Target bounce cadence in Hz
         */
        private double paceTargetHz = 2.2;

        /**
         * Consecutive hits that earn a full streak score
         */
        private int streakCap = 10;

        /**
         * Scanned area (m²) at or above which a space counts as a venue
         */
        private double venueAreaThreshold = 9.0;

        private double minCeilingHeight = 2.4;

        /**
         * Ceiling height needed for overhead-motion patterns
         */
        private double overheadCeilingHeight = 2.8;
    }

    @Data
    public static class ToleranceConfig {
        private double easy = 300.0;
        private double medium = 200.0;
        private double hard = 100.0;
        private double expert = 50.0;
    }

    @Data
    public static class WeightConfig {
        private double precision = 60.0;
        private double pace = 30.0;
        private double streak = 10.0;
    }

    @Data
    public static class MarkerConfig {
        /**
         * Clearance in metres kept between every marker and the usable-area edge
         */
        private double safetyMargin = 0.3;
    }

    @Data
    public static class PoseSafetyConfig {
        private double visibilityThreshold = 0.5;
        private double warningDistance = 0.3;
        private double criticalDistance = 0.1;
        private double lowSafetyScore = 70.0;
        /**
         * Landmark speed in m/s above which a pose is flagged unsafe
         */
        private double maxLandmarkSpeed = 4.0;
    }

    @Data
    public static class LockingConfig {
        private int stripes = 64;
        private long timeoutMs = 5000;
    }

    private static Map<String, SportConfig> defaultSports() {
        Map<String, SportConfig> sports = new LinkedHashMap<>();
        sports.put("basketball", new SportConfig());

        SportConfig tennis = new SportConfig();
        tennis.getTolerancesMm().setEasy(400.0);
        tennis.getTolerancesMm().setMedium(250.0);
        tennis.getTolerancesMm().setHard(150.0);
        tennis.getTolerancesMm().setExpert(75.0);
        tennis.getWeights().setPrecision(50.0);
        tennis.getWeights().setPace(30.0);
        tennis.getWeights().setStreak(20.0);
        tennis.setPaceTargetHz(1.5);
        tennis.setStreakCap(8);
        tennis.setVenueAreaThreshold(12.0);
        tennis.setMinCeilingHeight(2.6);
        tennis.setOverheadCeilingHeight(3.2);
        sports.put("tennis", tennis);
        return sports;
    }
}
