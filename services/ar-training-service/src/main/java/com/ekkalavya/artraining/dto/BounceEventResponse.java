package com.ekkalavya.artraining.dto;

import com.ekkalavya.artraining.domain.BounceEvent;
import com.ekkalavya.artraining.domain.ToleranceZone;
import com.ekkalavya.artraining.model.Point3;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BounceEventResponse {

    private UUID eventId;
    private UUID sessionId;
    private long timestampMs;
    private Point3 courtPosition;
    private int targetIndex;
    private Point3 targetPosition;
    private double errorDistanceMm;
    private double toleranceRadiusMm;
    private boolean hit;
    private ToleranceZone zone;
    private double fusionConfidence;
    private LocalDateTime recordedAt;

    public static BounceEventResponse from(BounceEvent event) {
        return BounceEventResponse.builder()
                .eventId(event.getId())
                .sessionId(event.getSessionId())
                .timestampMs(event.getTimestampMs())
                .courtPosition(event.getCourtPosition())
                .targetIndex(event.getTargetIndex())
                .targetPosition(event.getTargetPosition())
                .errorDistanceMm(event.getErrorDistanceMm())
                .toleranceRadiusMm(event.getToleranceRadiusMm())
                .hit(event.isHit())
                .zone(event.getZone())
                .fusionConfidence(event.getFusionConfidence())
                .recordedAt(event.getCreatedAt())
                .build();
    }
}
