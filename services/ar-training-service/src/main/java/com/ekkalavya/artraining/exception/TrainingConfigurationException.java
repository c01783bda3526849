package com.ekkalavya.artraining.exception;

/**
 * Invalid sport or engine configuration detected at startup.
 */
public class TrainingConfigurationException extends TrainingSessionException {

    public TrainingConfigurationException(String message) {
        super("CONFIGURATION_ERROR", message);
    }
}
