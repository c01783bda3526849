package com.ekkalavya.artraining.model.sync;

import com.ekkalavya.artraining.domain.SyncPlatform;
import com.ekkalavya.artraining.model.PlatformContext;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class FlutterUnitySyncPayload extends SessionSyncPayload {

    private String unityVersion;

    private String deviceModel;

    @DecimalMin("0.0")
    private Double planeArea;

    @Override
    public SyncPlatform getSyncPlatform() {
        return SyncPlatform.FLUTTER_UNITY;
    }

    @Override
    public PlatformContext mergeInto(PlatformContext current) {
        PlatformContext base = current == null ? new PlatformContext() : current;
        return base.toBuilder()
                .flutterUnity(PlatformContext.FlutterUnityDetails.builder()
                        .unityVersion(unityVersion)
                        .deviceModel(deviceModel)
                        .planeArea(planeArea)
                        .build())
                .build();
    }
}
