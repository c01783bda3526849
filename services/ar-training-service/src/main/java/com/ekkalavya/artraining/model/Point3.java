package com.ekkalavya.artraining.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point in metres. Court and floor positions are two-dimensional and leave {@code z} at zero.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Point3 {
    private double x;
    private double y;
    private double z;

    public static Point3 of(double x, double y) {
        return new Point3(x, y, 0.0);
    }

    public static Point3 of(double x, double y, double z) {
        return new Point3(x, y, z);
    }

    @JsonIgnore
    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
    }
}
