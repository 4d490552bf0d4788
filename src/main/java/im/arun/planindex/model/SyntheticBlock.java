package im.arun.planindex.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A labeled region built from one token, or from a name token paired with a number token.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyntheticBlock {

    @JsonProperty("bbox")
    BoundingBox bbox;

    @JsonProperty("text")
    String text;

    /** Detector role of the leading token, e.g. {@code room_name} or {@code door_number}. */
    @JsonProperty("role")
    String role;

    @JsonProperty("name_value")
    String nameValue;

    @JsonProperty("number_value")
    String numberValue;

    @JsonProperty("confidence")
    double confidence;

    @Singular
    @JsonProperty("source_texts")
    List<String> sourceTexts;

    @JsonIgnore
    public boolean isPaired() {
        return nameValue != null && numberValue != null;
    }

    public List<String> textLines() {
        return List.of(text.split("\n"));
    }
}
