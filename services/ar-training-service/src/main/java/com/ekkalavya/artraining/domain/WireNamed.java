package com.ekkalavya.artraining.domain;

import com.ekkalavya.artraining.exception.TrainingValidationException;

import java.util.Locale;

/**
 * Enum constant with a lower-case name used on the JSON wire and in query strings.
 */
public interface WireNamed {

    String getWireName();

    /**
     * Resolves a constant by wire name or by enum name, ignoring case and surrounding whitespace.
     *
     * @throws TrainingValidationException when the value is blank or matches no constant
     */
    static <E extends Enum<E> & WireNamed> E fromWireName(Class<E> type, String value) {
        if (value == null || value.isBlank()) {
            throw new TrainingValidationException(type.getSimpleName() + " must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (E constant : type.getEnumConstants()) {
            if (constant.getWireName().equals(normalized)
                    || constant.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return constant;
            }
        }
        throw new TrainingValidationException("Unknown " + type.getSimpleName() + ": " + value);
    }
}
