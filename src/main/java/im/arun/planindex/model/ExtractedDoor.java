package im.arun.planindex.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.UUID;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ExtractedDoor extends ExtractedObject {

    @JsonProperty("door_number")
    private final String doorNumber;

    @JsonProperty("door_type")
    private final DoorType doorType;

    @Builder
    public ExtractedDoor(String id, UUID pageId, String label, BoundingBox bbox, double confidence,
                         List<String> sources, String doorNumber, DoorType doorType) {
        super(id, pageId, label, bbox, confidence, sources);
        this.doorNumber = doorNumber;
        this.doorType = doorType != null ? doorType : DoorType.UNKNOWN;
    }

    @Override
    public ObjectType getType() {
        return ObjectType.DOOR;
    }
}
