package im.arun.planindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Objects;
import java.util.UUID;

/**
 * A recognized text fragment in page-pixel space. All sources produce tokens in the
 * same coordinate space as the stored page raster.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TextToken {

    @JsonProperty("text")
    String text;

    @JsonProperty("bbox")
    BoundingBox bbox;

    @JsonProperty("confidence")
    double confidence;

    @JsonProperty("source")
    TokenSource source;

    @JsonProperty("page_id")
    UUID pageId;

    @Builder(toBuilder = true)
    @JsonCreator
    public TextToken(@JsonProperty("text") String text,
                     @JsonProperty("bbox") BoundingBox bbox,
                     @JsonProperty("confidence") Double confidence,
                     @JsonProperty("source") TokenSource source,
                     @JsonProperty("page_id") UUID pageId) {
        this.text = Objects.requireNonNull(text, "text");
        this.bbox = Objects.requireNonNull(bbox, "bbox");
        this.source = Objects.requireNonNull(source, "source");
        this.confidence = confidence != null ? confidence : 1.0;
        if (this.confidence < 0.0 || this.confidence > 1.0) {
            throw new IllegalArgumentException("Token confidence must be in [0, 1]: " + this.confidence);
        }
        this.pageId = pageId;
    }

    public static TextToken of(String text, BoundingBox bbox, double confidence, TokenSource source) {
        return new TextToken(text, bbox, confidence, source, null);
    }

    /**
     * Text with surrounding whitespace removed, as used by rule evaluation.
     */
    public String strippedText() {
        return text.strip();
    }
}
