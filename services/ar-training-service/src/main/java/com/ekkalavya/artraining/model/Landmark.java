package com.ekkalavya.artraining.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body landmark in room-centred coordinates: {@code x} across the width, {@code z} across
 * the depth, {@code y} height above the floor. Visibility is 0..1.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Landmark {
    private String name;
    private double x;
    private double y;
    private double z;
    private double visibility;
}
