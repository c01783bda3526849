package com.ekkalavya.artraining.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Platform-specific tracking details, one slot per reporting platform.
 * Stored as JSON on the session row.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlatformContext {

    private WebMediaPipeDetails webMediaPipe;
    private FlutterUnityDetails flutterUnity;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class WebMediaPipeDetails {
        private Integer poseModelComplexity;  // 0 lite, 1 full, 2 heavy
        private Double detectionConfidence;
        private Integer landmarkCount;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class FlutterUnityDetails {
        private String unityVersion;
        private String deviceModel;
        private Double planeArea;
    }
}
