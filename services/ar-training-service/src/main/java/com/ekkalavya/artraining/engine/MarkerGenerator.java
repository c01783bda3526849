package com.ekkalavya.artraining.engine;

import com.ekkalavya.artraining.config.TrainingEngineProperties;
import com.ekkalavya.artraining.domain.DrillPattern;
import com.ekkalavya.artraining.exception.MarkerConstraintViolationException;
import com.ekkalavya.artraining.exception.TrainingValidationException;
import com.ekkalavya.artraining.model.MarkerSet;
import com.ekkalavya.artraining.model.TargetMarker;
import com.ekkalavya.artraining.model.UsableArea;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out drill targets inside the usable area.
 *
 * <p>Each pattern is defined on the unit square with every coordinate strictly inside (0, 1).
 * The unit square is then mapped onto the usable area shrunk by the safety margin on all
 * sides, so markers always keep at least the margin from the edges.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarkerGenerator {

    private final TrainingEngineProperties properties;

    public MarkerSet generate(DrillPattern pattern, UsableArea area, double toleranceRadiusMm,
                              Integer canvasWidth, Integer canvasHeight) {
        double margin = properties.getMarkers().getSafetyMargin();
        checkArea(pattern, area, margin);
        if ((canvasWidth == null) != (canvasHeight == null)
                || (canvasWidth != null && (canvasWidth <= 0 || canvasHeight <= 0))) {
            throw new TrainingValidationException("Canvas width and height must both be positive when given");
        }

        double innerWidth = area.getWidth() - 2 * margin;
        double innerHeight = area.getHeight() - 2 * margin;
        List<double[]> layout = layout(pattern, innerWidth, innerHeight);

        List<TargetMarker> markers = new ArrayList<>(layout.size());
        for (int i = 0; i < layout.size(); i++) {
            double x = margin + layout.get(i)[0] * innerWidth;
            double y = margin + layout.get(i)[1] * innerHeight;
            verifyContainment(pattern, i, x, y, area, margin);

            double nx = x / area.getWidth();
            double ny = y / area.getHeight();
            markers.add(TargetMarker.builder()
                    .id(pattern.getId() + "_" + i)
                    .index(i)
                    .x(x)
                    .y(y)
                    .normalizedX(nx)
                    .normalizedY(ny)
                    .toleranceRadiusMm(toleranceRadiusMm)
                    .pixelX(canvasWidth == null ? null : nx * canvasWidth)
                    .pixelY(canvasHeight == null ? null : ny * canvasHeight)
                    .build());
        }

        return MarkerSet.builder()
                .patternId(pattern.getId())
                .usableArea(area)
                .safetyMargin(margin)
                .markers(markers)
                .build();
    }

    List<double[]> layout(DrillPattern pattern, double innerWidth, double innerHeight) {
        return switch (pattern) {
            case DRIBBLE_BOX -> dribbleBox();
            case MICRO_LADDER -> microLadder(innerWidth >= innerHeight);
            case FIGURE_8 -> figureEight();
            case WALL_REBOUND -> wallRebound();
            case SEATED_CONTROL -> seatedControl(innerWidth, innerHeight);
            case ZIGZAG -> zigzag();
            case GRID -> grid();
        };
    }

    // corners, edge midpoints, centre
    private static List<double[]> dribbleBox() {
        return List.of(
                new double[]{0.1, 0.1}, new double[]{0.9, 0.1}, new double[]{0.9, 0.9}, new double[]{0.1, 0.9},
                new double[]{0.5, 0.1}, new double[]{0.9, 0.5}, new double[]{0.5, 0.9}, new double[]{0.1, 0.5},
                new double[]{0.5, 0.5});
    }

    // six rungs along the long axis, two feet per rung
    private static List<double[]> microLadder(boolean horizontal) {
        List<double[]> points = new ArrayList<>();
        int rungs = 6;
        for (int rung = 0; rung < rungs; rung++) {
            double along = (rung + 0.5) / rungs;
            for (double lane : new double[]{0.35, 0.65}) {
                points.add(horizontal ? new double[]{along, lane} : new double[]{lane, along});
            }
        }
        return points;
    }

    // lemniscate of Bernoulli sampled at eight points plus the two loop anchors
    private static List<double[]> figureEight() {
        List<double[]> points = new ArrayList<>();
        double a = 0.4;
        for (int k = 0; k < 8; k++) {
            double t = Math.PI / 8 + k * Math.PI / 4;
            double denom = 1 + Math.sin(t) * Math.sin(t);
            points.add(new double[]{
                    0.5 + a * Math.cos(t) / denom,
                    0.5 + a * Math.sin(t) * Math.cos(t) / denom});
        }
        points.add(new double[]{0.3, 0.5});
        points.add(new double[]{0.7, 0.5});
        return points;
    }

    // wall along y = 0, rows at increasing distance from it
    private static List<double[]> wallRebound() {
        List<double[]> points = new ArrayList<>();
        for (double row : new double[]{0.15, 0.35, 0.55, 0.75}) {
            for (double col : new double[]{0.3, 0.5, 0.7}) {
                points.add(new double[]{col, row});
            }
        }
        return points;
    }

    // centre, inner ring of four, outer ring of six; rings are circular in metres
    private static List<double[]> seatedControl(double innerWidth, double innerHeight) {
        List<double[]> points = new ArrayList<>();
        points.add(new double[]{0.5, 0.5});
        double side = Math.min(innerWidth, innerHeight);
        addRing(points, 4, 0.2 * side, innerWidth, innerHeight, 0.0);
        addRing(points, 6, 0.4 * side, innerWidth, innerHeight, Math.PI / 6);
        return points;
    }

    private static void addRing(List<double[]> points, int count, double radius,
                                double innerWidth, double innerHeight, double phase) {
        for (int i = 0; i < count; i++) {
            double angle = phase + 2 * Math.PI * i / count;
            points.add(new double[]{
                    0.5 + radius * Math.cos(angle) / innerWidth,
                    0.5 + radius * Math.sin(angle) / innerHeight});
        }
    }

    private static List<double[]> zigzag() {
        List<double[]> points = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            points.add(new double[]{i % 2 == 0 ? 0.25 : 0.75, (i + 0.5) / 8});
        }
        return points;
    }

    private static List<double[]> grid() {
        List<double[]> points = new ArrayList<>();
        for (int row = 0; row < 4; row++) {
            for (int col = 0; col < 3; col++) {
                points.add(new double[]{(col + 0.5) / 3, (row + 0.5) / 4});
            }
        }
        return points;
    }

    private void checkArea(DrillPattern pattern, UsableArea area, double margin) {
        if (pattern == null) {
            throw new TrainingValidationException("Drill pattern is required");
        }
        if (area == null || !(area.getWidth() > 0) || !(area.getHeight() > 0)
                || !Double.isFinite(area.getWidth()) || !Double.isFinite(area.getHeight())) {
            throw new TrainingValidationException("Usable area must have positive width and height");
        }
        if (area.getWidth() <= 2 * margin || area.getHeight() <= 2 * margin) {
            throw new TrainingValidationException(String.format(
                    "Usable area %.2f x %.2f m leaves no room inside a %.2f m safety margin",
                    area.getWidth(), area.getHeight(), margin));
        }
        if (area.area() < pattern.getMinArea()) {
            throw new TrainingValidationException(String.format(
                    "%s needs %.1f m² of floor, usable area is %.2f m²",
                    pattern.getId(), pattern.getMinArea(), area.area()));
        }
    }

    private void verifyContainment(DrillPattern pattern, int index, double x, double y,
                                   UsableArea area, double margin) {
        boolean inside = x > margin && x < area.getWidth() - margin
                && y > margin && y < area.getHeight() - margin;
        if (!inside) {
            String message = String.format("Marker %d of %s at (%.4f, %.4f) is outside the %.2f m margin of %.2f x %.2f",
                    index, pattern.getId(), x, y, margin, area.getWidth(), area.getHeight());
            log.error("CONSTRAINT VIOLATION: {}", message);
            throw new MarkerConstraintViolationException(message);
        }
    }
}
