package com.ekkalavya.artraining.engine;

import com.ekkalavya.artraining.config.SportCatalog;
import com.ekkalavya.artraining.domain.DrillPattern;
import com.ekkalavya.artraining.domain.LightingCondition;
import com.ekkalavya.artraining.domain.RoomConstraints;
import com.ekkalavya.artraining.exception.TrainingValidationException;
import com.ekkalavya.artraining.model.PlaneScan;
import com.ekkalavya.artraining.model.SportProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Derives the safety score, room/venue mode and eligible drill patterns from a plane scan.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomConstraintAnalyzer {

    static final double CRITICAL_CEILING_HEIGHT = 2.2;
    static final double LOW_CEILING_PENALTY = 10.0;
    static final double CRITICAL_CEILING_PENALTY = 30.0;
    static final double OBSTACLE_PENALTY = 10.0;
    static final double UNEVEN_SURFACE_PENALTY = 20.0;
    static final double REFLECTIVE_PENALTY = 10.0;
    static final double POOR_LIGHTING_PENALTY = 15.0;
    static final double MODERATE_LIGHTING_PENALTY = 5.0;

    private final SportCatalog sportCatalog;

    public RoomConstraints analyze(UUID sessionId, String sport, PlaneScan scan, LocalDateTime analyzedAt) {
        checkScan(scan);
        SportProfile profile = sportCatalog.getProfile(sport);

        double width = scan.getWidth();
        double height = scan.getHeight();
        double area = width * height;
        double aspectRatio = Math.max(width, height) / Math.min(width, height);
        boolean roomMode = area < profile.getVenueAreaThreshold();

        List<String> warnings = new ArrayList<>();
        double safetyScore = safetyScore(scan, profile, warnings);
        List<String> recommended = recommendPatterns(area, roomMode, scan.getCeilingHeight(), profile, warnings);

        log.debug("Room analysis for session {}: area={} roomMode={} safety={} patterns={}",
                sessionId, area, roomMode, safetyScore, recommended);

        return RoomConstraints.builder()
                .sessionId(sessionId)
                .sport(profile.getSport())
                .width(width)
                .height(height)
                .area(area)
                .aspectRatio(aspectRatio)
                .ceilingHeight(scan.getCeilingHeight())
                .flat(scan.isFlat())
                .obstacleCount(scan.getObstacleCount())
                .lighting(scan.getLighting())
                .reflectiveSurfaces(scan.isReflectiveSurfaces())
                .safetyScore(safetyScore)
                .roomMode(roomMode)
                .recommendedPatterns(recommended)
                .safetyWarnings(warnings)
                .analyzedAt(analyzedAt)
                .build();
    }

    double safetyScore(PlaneScan scan, SportProfile profile, List<String> warnings) {
        double score = 100.0;

        Double ceiling = scan.getCeilingHeight();
        if (ceiling != null) {
            if (ceiling < CRITICAL_CEILING_HEIGHT) {
                score -= CRITICAL_CEILING_PENALTY;
                warnings.add(String.format("Ceiling height %.2f m is critically low", ceiling));
            } else if (ceiling < profile.getMinCeilingHeight()) {
                score -= LOW_CEILING_PENALTY;
                warnings.add(String.format("Ceiling height %.2f m is below the %.2f m recommended for %s",
                        ceiling, profile.getMinCeilingHeight(), profile.getSport()));
            }
        }

        if (scan.getObstacleCount() > 0) {
            score -= OBSTACLE_PENALTY * scan.getObstacleCount();
            warnings.add(scan.getObstacleCount() + " obstacle(s) detected in the play area");
        }
        if (!scan.isFlat()) {
            score -= UNEVEN_SURFACE_PENALTY;
            warnings.add("Floor surface is not flat");
        }
        if (scan.isReflectiveSurfaces()) {
            score -= REFLECTIVE_PENALTY;
            warnings.add("Reflective surfaces may reduce tracking confidence");
        }

        LightingCondition lighting = scan.getLighting() == null ? LightingCondition.GOOD : scan.getLighting();
        if (lighting == LightingCondition.POOR) {
            score -= POOR_LIGHTING_PENALTY;
            warnings.add("Poor lighting may reduce tracking accuracy");
        } else if (lighting == LightingCondition.MODERATE) {
            score -= MODERATE_LIGHTING_PENALTY;
        }

        return GeometryUtils.clamp(score, 0.0, 100.0);
    }

    List<String> recommendPatterns(double area, boolean roomMode, Double ceilingHeight,
                                   SportProfile profile, List<String> warnings) {
        List<DrillPattern> eligible = new ArrayList<>();
        for (DrillPattern pattern : DrillPattern.values()) {
            if (pattern.isVenueOnly() && roomMode) {
                warnings.add(String.format("%s excluded: venue pattern not available in room mode", pattern.getId()));
            } else if (area < pattern.getMinArea()) {
                warnings.add(String.format("%s excluded: needs %.1f m² of floor, room offers %.2f m²",
                        pattern.getId(), pattern.getMinArea(), area));
            } else if (pattern.requiresOverheadMotion() && ceilingHeight != null
                    && ceilingHeight < profile.getOverheadCeilingHeight()) {
                warnings.add(String.format("%s excluded: overhead motion needs a %.2f m ceiling, room has %.2f m",
                        pattern.getId(), profile.getOverheadCeilingHeight(), ceilingHeight));
            } else {
                eligible.add(pattern);
            }
        }

        if (eligible.isEmpty()) {
            warnings.add("No drill pattern fits this space");
        }

        // larger patterns first, declaration order breaks ties
        return eligible.stream()
                .sorted(Comparator.comparingDouble(DrillPattern::getMinArea).reversed()
                        .thenComparingInt(DrillPattern::ordinal))
                .map(DrillPattern::getId)
                .toList();
    }

    private static void checkScan(PlaneScan scan) {
        if (scan == null) {
            throw new TrainingValidationException("Plane scan is required");
        }
        if (scan.getWidth() == null || scan.getHeight() == null) {
            throw new TrainingValidationException("Plane width and height are required");
        }
        if (!(scan.getWidth() > 0) || !(scan.getHeight() > 0)
                || !Double.isFinite(scan.getWidth()) || !Double.isFinite(scan.getHeight())) {
            throw new TrainingValidationException(String.format(
                    "Plane dimensions must be positive, got %s x %s", scan.getWidth(), scan.getHeight()));
        }
        if (scan.getObstacleCount() < 0) {
            throw new TrainingValidationException("Obstacle count must not be negative");
        }
        if (scan.getCeilingHeight() != null
                && (!(scan.getCeilingHeight() > 0) || !Double.isFinite(scan.getCeilingHeight()))) {
            throw new TrainingValidationException("Ceiling height must be positive when present");
        }
    }
}
