package com.ekkalavya.artraining.engine;

import com.ekkalavya.artraining.domain.RoomQualityMetrics;
import com.ekkalavya.artraining.domain.TrainingSession;
import com.ekkalavya.artraining.exception.SyncConflictException;
import com.ekkalavya.artraining.exception.TrainingValidationException;
import com.ekkalavya.artraining.model.sync.SessionSyncPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Merges a platform's quality report into the canonical session record.
 *
 * <p>Peak-quality metrics (fps, tracking quality) only ever rise; current-condition
 * fields are last-writer-wins when present. The merge reads no clock, so applying
 * the same payload twice gives the same record as applying it once.
 */
@Slf4j
@Component
public class SessionSyncReconciler {

    public TrainingSession merge(TrainingSession session, SessionSyncPayload payload) {
        if (payload == null) {
            throw new TrainingValidationException("Sync payload is required");
        }
        if (session.getStatus().isTerminal()) {
            throw new SyncConflictException(session.getId(), "session is " + session.getStatus());
        }

        RoomQualityMetrics current = session.getRoomQuality() == null
                ? new RoomQualityMetrics()
                : session.getRoomQuality();

        RoomQualityMetrics merged = current.toBuilder()
                .averageFps(peak(current.getAverageFps(), payload.getAverageFps()))
                .trackingQuality(peak(current.getTrackingQuality(), payload.getTrackingQuality()))
                .safetyScore(latest(current.getSafetyScore(), payload.getSafetyScore()))
                .roomCenter(latest(current.getRoomCenter(), payload.getRoomCenter()))
                .scaleFactor(latest(current.getScaleFactor(), payload.getScaleFactor()))
                .obstacleCount(latest(current.getObstacleCount(), payload.getObstacleCount()))
                .lightingConditions(latest(current.getLightingConditions(), payload.getLightingConditions()))
                .reflectiveSurfaces(latest(current.getReflectiveSurfaces(), payload.getReflectiveSurfaces()))
                .build();

        log.debug("Merged {} sync into session {}", payload.getSyncPlatform(), session.getId());

        return session.toBuilder()
                .roomQuality(merged)
                .lastReportingPlatform(payload.getSyncPlatform())
                .platformContext(payload.mergeInto(session.getPlatformContext()))
                .build();
    }

    private static Double peak(Double current, Double incoming) {
        if (incoming == null) {
            return current;
        }
        return current == null ? incoming : Math.max(current, incoming);
    }

    private static <T> T latest(T current, T incoming) {
        return incoming != null ? incoming : current;
    }
}
