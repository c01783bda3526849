package com.ekkalavya.artraining.engine;

/**
 * Combines vision and audio detection confidences (0..100) into one value.
 *
 * <pre>
 *   base  = 0.6 * vision + 0.4 * audio
 *   fused = base * (0.75 + 0.25 * (1 - |vision - audio| / 100))
 * </pre>
 *
 * The result never exceeds the larger input, is non-decreasing in each input while
 * the other is fixed, and drops by up to a quarter when the sensors disagree.
 * An absent confidence counts as 0.
 */
public final class ConfidenceFusion {

    static final double VISION_WEIGHT = 0.6;
    static final double AUDIO_WEIGHT = 0.4;
    static final double AGREEMENT_FLOOR = 0.75;

    private ConfidenceFusion() {
    }

    public static double fuse(Double visionConfidence, Double audioConfidence) {
        double vision = visionConfidence == null ? 0.0 : visionConfidence;
        double audio = audioConfidence == null ? 0.0 : audioConfidence;

        double base = VISION_WEIGHT * vision + AUDIO_WEIGHT * audio;
        double agreement = 1.0 - Math.abs(vision - audio) / 100.0;
        double fused = base * (AGREEMENT_FLOOR + (1.0 - AGREEMENT_FLOOR) * agreement);
        return GeometryUtils.clamp(fused, 0.0, 100.0);
    }
}
