package com.contact.dedup.core;

/**
 * Thrown when a threshold, similarity floor or other option is outside its valid range.
 * Signals a programming error in the caller rather than a recoverable runtime condition.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    /**
     * Validates a 0-100 confidence threshold.
     */
    public static double requireThreshold(double value, String name) {
        if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
            throw new InvalidConfigurationException(name + " must be between 0 and 100, got " + value);
        }
        return value;
    }

    /**
     * Validates a 0.0-1.0 ratio.
     */
    public static double requireRatio(double value, String name) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidConfigurationException(name + " must be between 0.0 and 1.0, got " + value);
        }
        return value;
    }
}
