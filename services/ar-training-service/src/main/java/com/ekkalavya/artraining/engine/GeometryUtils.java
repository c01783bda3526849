package com.ekkalavya.artraining.engine;

import com.ekkalavya.artraining.domain.ToleranceZone;
import com.ekkalavya.artraining.model.Point3;

/**
 * Pure geometry helpers shared by the validators and the pose monitor.
 */
public final class GeometryUtils {

    public static final double METRES_TO_MM = 1000.0;

    /** Fraction of the tolerance radius that counts as a perfect hit. */
    public static final double PERFECT_ZONE_RATIO = 0.2;

    private static final double COINCIDENT_EPSILON = 1e-12;

    private GeometryUtils() {
    }

    /**
     * Euclidean distance; two-dimensional points carry {@code z = 0}.
     */
    public static double distance(Point3 a, Point3 b) {
        double dx = a.getX() - b.getX();
        double dy = a.getY() - b.getY();
        double dz = a.getZ() - b.getZ();
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    public static double distanceMm(Point3 a, Point3 b) {
        return distance(a, b) * METRES_TO_MM;
    }

    /**
     * Angle at vertex {@code b} formed by rays to {@code a} and {@code c}, in degrees within [0, 180].
     * Uses the x/y plane. Returns 0 when {@code b} coincides with either endpoint.
     */
    public static double angleBetween(Point3 a, Point3 b, Point3 c) {
        double ax = a.getX() - b.getX();
        double ay = a.getY() - b.getY();
        double cx = c.getX() - b.getX();
        double cy = c.getY() - b.getY();
        if (isZero(ax, ay) || isZero(cx, cy)) {
            return 0.0;
        }

        double radians = Math.abs(Math.atan2(cy, cx) - Math.atan2(ay, ax));
        double degrees = Math.toDegrees(radians);
        if (degrees > 180.0) {
            degrees = 360.0 - degrees;
        }
        return degrees;
    }

    public static ToleranceZone classify(Point3 point, Point3 target, double toleranceRadiusMm) {
        double errorMm = distanceMm(point, target);
        if (errorMm > toleranceRadiusMm) {
            return ToleranceZone.MISS;
        }
        return errorMm <= toleranceRadiusMm * PERFECT_ZONE_RATIO ? ToleranceZone.PERFECT : ToleranceZone.HIT;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static boolean isZero(double x, double y) {
        return Math.abs(x) < COINCIDENT_EPSILON && Math.abs(y) < COINCIDENT_EPSILON;
    }
}
