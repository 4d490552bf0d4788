package im.arun.planindex.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.UUID;

/**
 * A schedule (door, room finish, window...) table found on a schedule page.
 * Tables are produced by collaborators outside this library and registered with the
 * object repository so they take part in indexing and type queries.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ExtractedScheduleTable extends ExtractedObject {

    @JsonProperty("schedule_type")
    private final String scheduleType;

    @JsonProperty("title")
    private final String title;

    @JsonProperty("headers")
    private final List<String> headers;

    @JsonProperty("rows")
    private final List<List<String>> rows;

    @Builder
    public ExtractedScheduleTable(String id, UUID pageId, String label, BoundingBox bbox, double confidence,
                                  List<String> sources, String scheduleType, String title,
                                  List<String> headers, List<List<String>> rows) {
        super(id, pageId, label, bbox, confidence, sources);
        this.scheduleType = scheduleType != null ? scheduleType : "other";
        this.title = title;
        this.headers = headers == null ? List.of() : List.copyOf(headers);
        this.rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
    }

    @Override
    public ObjectType getType() {
        return ObjectType.SCHEDULE_TABLE;
    }
}
