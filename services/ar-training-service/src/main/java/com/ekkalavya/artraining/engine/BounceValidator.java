package com.ekkalavya.artraining.engine;

import com.ekkalavya.artraining.domain.BounceEvent;
import com.ekkalavya.artraining.domain.ToleranceZone;
import com.ekkalavya.artraining.exception.TrainingValidationException;
import com.ekkalavya.artraining.model.ImpactData;
import com.ekkalavya.artraining.model.Point3;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Turns a reported impact into an immutable {@link BounceEvent}.
 *
 * <p>Court and target positions are in metres; the error distance and tolerance
 * radius are in millimetres. Malformed impacts are rejected before any event exists.
 */
@Component
public class BounceValidator {

    public BounceEvent validate(UUID sessionId, ImpactData impact, double toleranceRadiusMm,
                                LocalDateTime recordedAt) {
        checkImpact(impact);
        if (!(toleranceRadiusMm > 0) || !Double.isFinite(toleranceRadiusMm)) {
            throw new TrainingValidationException("Tolerance radius must be positive, got " + toleranceRadiusMm);
        }

        double errorDistanceMm = GeometryUtils.distanceMm(impact.getCourtPosition(), impact.getTargetPosition());
        ToleranceZone zone = GeometryUtils.classify(impact.getCourtPosition(), impact.getTargetPosition(),
                toleranceRadiusMm);

        return BounceEvent.builder()
                .id(UUID.randomUUID())
                .sessionId(sessionId)
                .timestampMs(impact.getTimestampMs())
                .worldPosition(impact.getWorldPosition())
                .courtPosition(impact.getCourtPosition())
                .targetIndex(impact.getTargetIndex())
                .targetPosition(impact.getTargetPosition())
                .errorDistanceMm(errorDistanceMm)
                .toleranceRadiusMm(toleranceRadiusMm)
                .hit(zone.isHit())
                .zone(zone)
                .visionConfidence(impact.getVisionConfidence())
                .audioConfidence(impact.getAudioConfidence())
                .fusionConfidence(ConfidenceFusion.fuse(impact.getVisionConfidence(), impact.getAudioConfidence()))
                .createdAt(recordedAt)
                .build();
    }

    private void checkImpact(ImpactData impact) {
        if (impact == null) {
            throw new TrainingValidationException("Impact data is required");
        }
        if (impact.getTimestampMs() == null || impact.getTimestampMs() < 0) {
            throw new TrainingValidationException("Impact timestamp is required and must not be negative");
        }
        requirePoint(impact.getWorldPosition(), "worldPosition");
        requirePoint(impact.getCourtPosition(), "courtPosition");
        requirePoint(impact.getTargetPosition(), "targetPosition");
        if (impact.getTargetIndex() == null || impact.getTargetIndex() < 0) {
            throw new TrainingValidationException("Impact must reference a target index");
        }
        checkConfidence(impact.getVisionConfidence(), "visionConfidence");
        checkConfidence(impact.getAudioConfidence(), "audioConfidence");
    }

    private static void requirePoint(Point3 point, String field) {
        if (point == null) {
            throw new TrainingValidationException("Impact is missing " + field);
        }
        if (!point.isFinite()) {
            throw new TrainingValidationException("Impact " + field + " must be finite");
        }
    }

    private static void checkConfidence(Double confidence, String field) {
        if (confidence != null && !(confidence >= 0.0 && confidence <= 100.0)) {
            throw new TrainingValidationException(field + " must be within [0, 100], got " + confidence);
        }
    }
}
