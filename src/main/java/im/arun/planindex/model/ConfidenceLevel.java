package im.arun.planindex.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Three-tier bucketing of a numeric confidence. Always derived, never stored.
 */
public enum ConfidenceLevel {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    public static final double HIGH_THRESHOLD = 0.8;
    public static final double MEDIUM_THRESHOLD = 0.5;

    private final String value;

    ConfidenceLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ConfidenceLevel fromConfidence(double confidence) {
        if (confidence >= HIGH_THRESHOLD) {
            return HIGH;
        }
        if (confidence >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }
}
