package com.ekkalavya.artraining.dto;

import com.ekkalavya.artraining.domain.LightingCondition;
import com.ekkalavya.artraining.domain.RoomConstraints;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * One room analysis as returned to clients. Dimensions in metres, area in square metres.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoomConstraintsResponse {

    private UUID analysisId;
    private UUID sessionId;
    private String sport;
    private double width;
    private double height;
    private double area;
    private double aspectRatio;
    private Double ceilingHeight;
    private boolean flat;
    private int obstacleCount;
    private LightingCondition lighting;
    private boolean reflectiveSurfaces;
    private double safetyScore;
    private boolean roomMode;
    private List<String> recommendedPatterns;
    private List<String> safetyWarnings;
    private LocalDateTime analyzedAt;

    public static RoomConstraintsResponse from(RoomConstraints room) {
        return RoomConstraintsResponse.builder()
                .analysisId(room.getId())
                .sessionId(room.getSessionId())
                .sport(room.getSport())
                .width(room.getWidth())
                .height(room.getHeight())
                .area(room.getArea())
                .aspectRatio(room.getAspectRatio())
                .ceilingHeight(room.getCeilingHeight())
                .flat(room.isFlat())
                .obstacleCount(room.getObstacleCount())
                .lighting(room.getLighting())
                .reflectiveSurfaces(room.isReflectiveSurfaces())
                .safetyScore(room.getSafetyScore())
                .roomMode(room.isRoomMode())
                .recommendedPatterns(room.getRecommendedPatterns())
                .safetyWarnings(room.getSafetyWarnings())
                .analyzedAt(room.getAnalyzedAt())
                .build();
    }
}
