package com.ekkalavya.artraining.model;

import com.ekkalavya.artraining.domain.LightingCondition;
import com.ekkalavya.artraining.domain.SyncPlatform;
import com.ekkalavya.artraining.model.sync.FlutterUnitySyncPayload;
import com.ekkalavya.artraining.model.sync.SessionSyncPayload;
import com.ekkalavya.artraining.model.sync.WebMediaPipeSyncPayload;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Sync payload JSON Tests")
class SessionSyncPayloadJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldReadWebPayload() throws Exception {
        SessionSyncPayload payload = objectMapper.readValue("""
                {"platform": "web_mediapipe", "averageFps": 29.5, "trackingQuality": 91,
                 "lightingConditions": "moderate", "poseModelComplexity": 1, "landmarkCount": 33}
                """, SessionSyncPayload.class);

        assertThat(payload).isInstanceOf(WebMediaPipeSyncPayload.class);
        assertThat(payload.getSyncPlatform()).isEqualTo(SyncPlatform.WEB_MEDIAPIPE);
        assertThat(payload.getLightingConditions()).isEqualTo(LightingCondition.MODERATE);
        assertThat(((WebMediaPipeSyncPayload) payload).getLandmarkCount()).isEqualTo(33);
    }

    @Test
    void shouldReadUnityPayload() throws Exception {
        SessionSyncPayload payload = objectMapper.readValue("""
                {"platform": "flutter_unity", "safetyScore": 80, "roomCenter": {"x": 0.1, "y": 0.0, "z": -0.2},
                 "unityVersion": "2022.3.10f1", "planeArea": 6.2}
                """, SessionSyncPayload.class);

        assertThat(payload).isInstanceOfSatisfying(FlutterUnitySyncPayload.class, unity -> {
            assertThat(unity.getPlaneArea()).isEqualTo(6.2);
            assertThat(unity.getRoomCenter()).isEqualTo(Point3.of(0.1, 0.0, -0.2));
        });
    }

    @Test
    @DisplayName("Unknown platform tag is rejected")
    void shouldRejectUnknownPlatform() {
        assertThatThrownBy(() -> objectMapper.readValue("{\"platform\": \"hololens\"}", SessionSyncPayload.class))
                .isInstanceOf(InvalidTypeIdException.class);
    }

    @Test
    @DisplayName("Serialized payload carries its platform tag")
    void shouldWritePlatformTag() throws Exception {
        WebMediaPipeSyncPayload payload = new WebMediaPipeSyncPayload();
        payload.setAverageFps(30.0);

        String json = objectMapper.writeValueAsString(payload);

        assertThat(json).contains("\"platform\":\"web_mediapipe\"").doesNotContain("syncPlatform");
    }
}
