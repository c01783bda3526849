package com.ekkalavya.artraining.model.sync;

import com.ekkalavya.artraining.domain.SyncPlatform;
import com.ekkalavya.artraining.model.PlatformContext;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class WebMediaPipeSyncPayload extends SessionSyncPayload {

    @Min(0)
    @Max(2)
    private Integer poseModelComplexity;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double detectionConfidence;

    @Min(0)
    private Integer landmarkCount;

    @Override
    public SyncPlatform getSyncPlatform() {
        return SyncPlatform.WEB_MEDIAPIPE;
    }

    @Override
    public PlatformContext mergeInto(PlatformContext current) {
        PlatformContext base = current == null ? new PlatformContext() : current;
        return base.toBuilder()
                .webMediaPipe(PlatformContext.WebMediaPipeDetails.builder()
                        .poseModelComplexity(poseModelComplexity)
                        .detectionConfidence(detectionConfidence)
                        .landmarkCount(landmarkCount)
                        .build())
                .build();
    }
}
