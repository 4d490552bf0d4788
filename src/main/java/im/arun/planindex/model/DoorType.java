package im.arun.planindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DoorType {
    SINGLE("single"),
    DOUBLE("double"),
    SLIDING("sliding"),
    REVOLVING("revolving"),
    UNKNOWN("unknown");

    private final String value;

    DoorType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient parse; anything unrecognized is {@link #UNKNOWN}.
     */
    @JsonCreator
    public static DoorType parse(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.strip();
        for (DoorType type : values()) {
            if (type.value.equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
