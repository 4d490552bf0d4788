package im.arun.planindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ObjectType {
    ROOM("room"),
    DOOR("door"),
    SCHEDULE_TABLE("schedule_table");

    private final String value;

    ObjectType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ObjectType fromValue(String value) {
        for (ObjectType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown object type: " + value);
    }
}
