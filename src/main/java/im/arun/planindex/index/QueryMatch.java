package im.arun.planindex.index;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.planindex.model.BoundingBox;
import im.arun.planindex.model.ConfidenceLevel;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class QueryMatch {

    @JsonProperty("object_id")
    String objectId;

    @JsonProperty("page_id")
    UUID pageId;

    @JsonProperty("score")
    double score;

    @JsonProperty("bbox")
    BoundingBox bbox;

    @JsonProperty("label")
    String label;

    @JsonProperty("confidence_level")
    ConfidenceLevel confidenceLevel;

    @JsonProperty("reasons")
    List<String> reasons;
}
