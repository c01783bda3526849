package com.ekkalavya.artraining.dto;

import com.ekkalavya.artraining.domain.Difficulty;
import com.ekkalavya.artraining.model.SportProfile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scoring and room requirements of one configured sport. Tolerances are keyed by
 * lower-case difficulty name.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SportProfileResponse {

    private String sport;
    private Map<String, Double> tolerancesMm;
    private double precisionWeight;
    private double paceWeight;
    private double streakWeight;
    private double paceTargetHz;
    private int streakCap;
    private double venueAreaThreshold;
    private double minCeilingHeight;
    private double overheadCeilingHeight;

    public static SportProfileResponse from(SportProfile profile) {
        Map<String, Double> tolerances = new LinkedHashMap<>();
        for (Difficulty difficulty : Difficulty.values()) {
            tolerances.put(difficulty.getWireName(), profile.toleranceFor(difficulty));
        }
        return SportProfileResponse.builder()
                .sport(profile.getSport())
                .tolerancesMm(tolerances)
                .precisionWeight(profile.getPrecisionWeight())
                .paceWeight(profile.getPaceWeight())
                .streakWeight(profile.getStreakWeight())
                .paceTargetHz(profile.getPaceTargetHz())
                .streakCap(profile.getStreakCap())
                .venueAreaThreshold(profile.getVenueAreaThreshold())
                .minCeilingHeight(profile.getMinCeilingHeight())
                .overheadCeilingHeight(profile.getOverheadCeilingHeight())
                .build();
    }
}
