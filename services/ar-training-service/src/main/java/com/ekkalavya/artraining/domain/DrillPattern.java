package com.ekkalavya.artraining.domain;

import com.ekkalavya.artraining.exception.TrainingValidationException;

import java.util.Arrays;

/**
 * Drill patterns with the minimum usable floor area each one needs.
 *
 * <p>Room patterns fit confined spaces; venue patterns are only offered when the
 * scanned area is at or above the sport's venue threshold.
 */
public enum DrillPattern {

    DRIBBLE_BOX("dribble_box", 4.0, false, false),
    MICRO_LADDER("micro_ladder", 2.4, false, false),
    FIGURE_8("figure_8", 3.0, false, false),
    WALL_REBOUND("wall_rebound", 2.0, true, false),
    SEATED_CONTROL("seated_control", 1.6, false, false),
    ZIGZAG("zigzag", 9.0, false, true),
    GRID("grid", 12.0, false, true);

    private final String id;
    private final double minArea;
    private final boolean overheadMotion;
    private final boolean venueOnly;

    DrillPattern(String id, double minArea, boolean overheadMotion, boolean venueOnly) {
        this.id = id;
        this.minArea = minArea;
        this.overheadMotion = overheadMotion;
        this.venueOnly = venueOnly;
    }

    public String getId() {
        return id;
    }

    /** Minimum usable floor area in square metres. */
    public double getMinArea() {
        return minArea;
    }

    public boolean requiresOverheadMotion() {
        return overheadMotion;
    }

    public boolean isVenueOnly() {
        return venueOnly;
    }

    public static DrillPattern fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new TrainingValidationException("Drill pattern id is required");
        }
        return Arrays.stream(values())
                .filter(pattern -> pattern.id.equalsIgnoreCase(id.trim()))
                .findFirst()
                .orElseThrow(() -> new TrainingValidationException("Unknown drill pattern: " + id));
    }
}
