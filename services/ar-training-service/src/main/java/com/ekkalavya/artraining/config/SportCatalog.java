package com.ekkalavya.artraining.config;

import com.ekkalavya.artraining.domain.Difficulty;
import com.ekkalavya.artraining.exception.TrainingConfigurationException;
import com.ekkalavya.artraining.exception.TrainingValidationException;
import com.ekkalavya.artraining.model.SportProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validated sport profiles built once from {@link TrainingEngineProperties}.
 *
 * <p>Startup fails if any sport's weights do not sum to 100 or if its tolerances
 * do not strictly tighten from EASY to EXPERT.
 */
@Slf4j
@Component
public class SportCatalog {

    private static final double WEIGHT_SUM_EPSILON = 1e-6;

    private final Map<String, SportProfile> profiles;

    public SportCatalog(TrainingEngineProperties properties) {
        if (properties.getSports() == null || properties.getSports().isEmpty()) {
            throw new TrainingConfigurationException("At least one sport must be configured");
        }
        Map<String, SportProfile> built = new LinkedHashMap<>();
        properties.getSports().forEach((sport, config) -> {
            String key = normalize(sport);
            built.put(key, toProfile(key, config));
        });
        this.profiles = Collections.unmodifiableMap(built);
        log.info("Loaded sport profiles: {}", profiles.keySet());
    }

    public SportProfile getProfile(String sport) {
        return findProfile(sport)
                .orElseThrow(() -> new TrainingValidationException("Unsupported sport: " + sport));
    }

    public Optional<SportProfile> findProfile(String sport) {
        return sport == null ? Optional.empty() : Optional.ofNullable(profiles.get(normalize(sport)));
    }

    public Set<String> sports() {
        return profiles.keySet();
    }

    private static SportProfile toProfile(String sport, TrainingEngineProperties.SportConfig config) {
        TrainingEngineProperties.WeightConfig weights = config.getWeights();
        double sum = weights.getPrecision() + weights.getPace() + weights.getStreak();
        if (Math.abs(sum - 100.0) > WEIGHT_SUM_EPSILON) {
            throw new TrainingConfigurationException(
                    String.format("Score weights for %s must sum to 100, got %.2f", sport, sum));
        }
        if (weights.getPrecision() < 0 || weights.getPace() < 0 || weights.getStreak() < 0) {
            throw new TrainingConfigurationException("Score weights for " + sport + " must not be negative");
        }

        TrainingEngineProperties.ToleranceConfig t = config.getTolerancesMm();
        if (!(t.getEasy() > t.getMedium() && t.getMedium() > t.getHard()
                && t.getHard() > t.getExpert() && t.getExpert() > 0)) {
            throw new TrainingConfigurationException(String.format(
                    "Tolerances for %s must strictly decrease EASY > MEDIUM > HARD > EXPERT > 0, got %s/%s/%s/%s",
                    sport, t.getEasy(), t.getMedium(), t.getHard(), t.getExpert()));
        }
        if (config.getPaceTargetHz() <= 0) {
            throw new TrainingConfigurationException("Pace target for " + sport + " must be positive");
        }
        if (config.getStreakCap() <= 0) {
            throw new TrainingConfigurationException("Streak cap for " + sport + " must be positive");
        }

        Map<Difficulty, Double> tolerances = new EnumMap<>(Difficulty.class);
        tolerances.put(Difficulty.EASY, t.getEasy());
        tolerances.put(Difficulty.MEDIUM, t.getMedium());
        tolerances.put(Difficulty.HARD, t.getHard());
        tolerances.put(Difficulty.EXPERT, t.getExpert());

        return SportProfile.builder()
                .sport(sport)
                .tolerancesMm(Collections.unmodifiableMap(tolerances))
                .precisionWeight(weights.getPrecision())
                .paceWeight(weights.getPace())
                .streakWeight(weights.getStreak())
                .paceTargetHz(config.getPaceTargetHz())
                .streakCap(config.getStreakCap())
                .venueAreaThreshold(config.getVenueAreaThreshold())
                .minCeilingHeight(config.getMinCeilingHeight())
                .overheadCeilingHeight(config.getOverheadCeilingHeight())
                .build();
    }

    private static String normalize(String sport) {
        return sport.trim().toLowerCase(Locale.ROOT);
    }
}
