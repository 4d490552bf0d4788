package im.arun.planindex.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * CONSERVATIVE runs with a fully validated rule set, RELAXED with provisional rules only.
 * Both apply identical matching; RELAXED results carry extra provenance tags.
 */
public enum ExtractionPolicy {
    CONSERVATIVE("conservative"),
    RELAXED("relaxed");

    private final String value;

    ExtractionPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
