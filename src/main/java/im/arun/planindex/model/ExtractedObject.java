package im.arun.planindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * An object resolved from a plan page. Created once per extraction run and never mutated;
 * persistence is owned by the caller.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "type", "page_id", "label", "bbox", "confidence", "confidence_level", "sources"})
public abstract class ExtractedObject {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("page_id")
    private final UUID pageId;

    @JsonProperty("label")
    private final String label;

    @JsonProperty("bbox")
    private final BoundingBox bbox;

    @JsonProperty("confidence")
    private final double confidence;

    @JsonProperty("sources")
    private final List<String> sources;

    protected ExtractedObject(String id, UUID pageId, String label, BoundingBox bbox,
                              double confidence, List<String> sources) {
        this.id = Objects.requireNonNull(id, "id");
        this.pageId = Objects.requireNonNull(pageId, "pageId");
        this.label = label;
        this.bbox = Objects.requireNonNull(bbox, "bbox");
        this.confidence = confidence;
        this.sources = sources == null ? List.of() : List.copyOf(sources);
    }

    @JsonProperty("type")
    public abstract ObjectType getType();

    @JsonProperty("confidence_level")
    public ConfidenceLevel getConfidenceLevel() {
        return ConfidenceLevel.fromConfidence(confidence);
    }
}
