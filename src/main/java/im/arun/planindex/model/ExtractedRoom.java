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
public class ExtractedRoom extends ExtractedObject {

    @JsonProperty("room_number")
    private final String roomNumber;

    @JsonProperty("room_name")
    private final String roomName;

    /** Box of the printed name (and number) the room was read from. */
    @JsonProperty("label_bbox")
    private final BoundingBox labelBbox;

    @Builder
    public ExtractedRoom(String id, UUID pageId, String label, BoundingBox bbox, double confidence,
                         List<String> sources, String roomNumber, String roomName, BoundingBox labelBbox) {
        super(id, pageId, label, bbox, confidence, sources);
        this.roomNumber = roomNumber;
        this.roomName = roomName;
        this.labelBbox = labelBbox;
    }

    @Override
    public ObjectType getType() {
        return ObjectType.ROOM;
    }
}
