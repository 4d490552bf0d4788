package im.arun.planindex.index;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Reverse lookups over a project's extracted objects. Always rebuilt as a whole, never patched.
 * Keys are the exact extracted values; lists keep object insertion order.
 */
@Value
public class ProjectIndex {

    @JsonProperty("project_id")
    UUID projectId;

    @JsonProperty("generated_at")
    Instant generatedAt;

    @JsonProperty("rooms_by_number")
    Map<String, List<String>> roomsByNumber;

    @JsonProperty("rooms_by_name")
    Map<String, List<String>> roomsByName;

    @JsonProperty("objects_by_type")
    Map<String, List<String>> objectsByType;
}
