package com.ekkalavya.artraining;

import com.ekkalavya.artraining.config.SportCatalog;
import com.ekkalavya.artraining.config.TrainingEngineProperties;
import com.ekkalavya.artraining.domain.BounceEvent;
import com.ekkalavya.artraining.domain.DevicePlatform;
import com.ekkalavya.artraining.domain.Difficulty;
import com.ekkalavya.artraining.domain.LightingCondition;
import com.ekkalavya.artraining.domain.RoomConstraints;
import com.ekkalavya.artraining.domain.SessionStatus;
import com.ekkalavya.artraining.domain.ToleranceZone;
import com.ekkalavya.artraining.domain.TrainingSession;
import com.ekkalavya.artraining.model.Point3;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Shared builders for training engine tests.
 */
public final class TrainingFixtures {

    public static final UUID SESSION_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");
    public static final UUID USER_ID = UUID.fromString("22222222-2222-2222-2222-222222222222");
    public static final LocalDateTime STARTED_AT = LocalDateTime.of(2024, 3, 1, 10, 0, 0);

    private TrainingFixtures() {
    }

    public static TrainingEngineProperties properties() {
        return new TrainingEngineProperties();
    }

    public static SportCatalog catalog() {
        return new SportCatalog(properties());
    }

    public static TrainingSession session(SessionStatus status) {
        return TrainingSession.builder()
                .id(SESSION_ID)
                .userId(USER_ID)
                .sport("basketball")
                .drillPatternId("dribble_box")
                .difficulty(Difficulty.MEDIUM)
                .devicePlatform(DevicePlatform.WEB)
                .status(status)
                .startedAt(STARTED_AT)
                .createdAt(STARTED_AT)
                .updatedAt(STARTED_AT)
                .version(0L)
                .build();
    }

    /**
     * Bounce 50 mm (hit) or 250 mm (miss) from its target at the medium basketball tolerance.
     */
    public static BounceEvent bounce(long timestampMs, boolean hit) {
        double offset = hit ? 0.05 : 0.25;
        return BounceEvent.builder()
                .id(UUID.randomUUID())
                .sessionId(SESSION_ID)
                .timestampMs(timestampMs)
                .worldPosition(Point3.of(1.0 + offset, 0.0, 1.0))
                .courtPosition(Point3.of(1.0 + offset, 1.0))
                .targetIndex(0)
                .targetPosition(Point3.of(1.0, 1.0))
                .errorDistanceMm(offset * 1000.0)
                .toleranceRadiusMm(200.0)
                .hit(hit)
                .zone(hit ? ToleranceZone.HIT : ToleranceZone.MISS)
                .fusionConfidence(80.0)
                .createdAt(STARTED_AT)
                .build();
    }

    /**
     * Events spaced {@code intervalMs} apart with the given hit pattern.
     */
    public static List<BounceEvent> bounces(long intervalMs, boolean... hits) {
        List<BounceEvent> events = new ArrayList<>();
        for (int i = 0; i < hits.length; i++) {
            events.add(bounce(i * intervalMs, hits[i]));
        }
        return events;
    }

    public static RoomConstraints room(double width, double height, Double ceiling, double safetyScore) {
        return RoomConstraints.builder()
                .sessionId(SESSION_ID)
                .sport("basketball")
                .width(width)
                .height(height)
                .area(width * height)
                .aspectRatio(Math.max(width, height) / Math.min(width, height))
                .ceilingHeight(ceiling)
                .flat(true)
                .lighting(LightingCondition.GOOD)
                .safetyScore(safetyScore)
                .roomMode(true)
                .analyzedAt(STARTED_AT)
                .build();
    }
}
