package com.ekkalavya.artraining.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UsableArea {
    private double width;
    private double height;

    public double area() {
        return width * height;
    }
}
