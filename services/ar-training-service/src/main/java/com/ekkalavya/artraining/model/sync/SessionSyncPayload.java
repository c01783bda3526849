package com.ekkalavya.artraining.model.sync;

import com.ekkalavya.artraining.domain.LightingCondition;
import com.ekkalavya.artraining.domain.SyncPlatform;
import com.ekkalavya.artraining.model.PlatformContext;
import com.ekkalavya.artraining.model.Point3;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * Room-session metrics reported by one client platform. The {@code platform}
 * property selects the concrete payload type.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "platform"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = WebMediaPipeSyncPayload.class, name = "web_mediapipe"),
    @JsonSubTypes.Type(value = FlutterUnitySyncPayload.class, name = "flutter_unity")
})
@Data
public abstract class SessionSyncPayload {

    @DecimalMin("0.0")
    private Double averageFps;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private Double trackingQuality;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private Double safetyScore;

    private Point3 roomCenter;

    @Positive
    private Double scaleFactor;

    @Min(0)
    private Integer obstacleCount;

    private LightingCondition lightingConditions;

    private Boolean reflectiveSurfaces;

    @JsonIgnore
    public abstract SyncPlatform getSyncPlatform();

    /**
     * Returns a copy of {@code current} with this platform's slot replaced.
     */
    public abstract PlatformContext mergeInto(PlatformContext current);
}
