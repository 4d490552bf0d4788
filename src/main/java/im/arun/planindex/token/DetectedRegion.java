package im.arun.planindex.token;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A text region reported by a fallback detector, bbox as {@code [x, y, width, height]} pixels.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DetectedRegion {

    @JsonProperty("bbox")
    private List<Integer> bbox;

    @JsonProperty("text")
    private String text;

    @JsonProperty("confidence")
    private Double confidence;
}
