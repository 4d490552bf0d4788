package im.arun.planindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of a text token. Lower priority value wins during merging.
 */
public enum TokenSource {
    VECTOR("vector", 0),
    MODEL("model", 1),
    OCR("ocr", 2);

    private final String value;
    private final int priority;

    TokenSource(String value, int priority) {
        this.value = value;
        this.priority = priority;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getPriority() {
        return priority;
    }

    @JsonCreator
    public static TokenSource fromValue(String value) {
        for (TokenSource source : values()) {
            if (source.value.equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown token source: " + value);
    }
}
