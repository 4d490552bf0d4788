package im.arun.planindex.extraction;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.planindex.block.AdapterMetrics;
import im.arun.planindex.model.ExtractedObject;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of extracting one page. A failed page carries no objects and the error message.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageExtraction {

    @JsonProperty("page_id")
    UUID pageId;

    @JsonProperty("token_sources")
    Map<String, Integer> tokenSources;

    @JsonProperty("objects")
    List<ExtractedObject> objects;

    @JsonProperty("adapter_metrics")
    AdapterMetrics adapterMetrics;

    @JsonProperty("drop_reasons")
    Map<String, Integer> dropReasons;

    @JsonProperty("error")
    String error;

    public boolean isFailed() {
        return error != null;
    }

    static PageExtraction failed(UUID pageId, String error) {
        return PageExtraction.builder()
                .pageId(pageId)
                .tokenSources(Map.of())
                .objects(List.of())
                .adapterMetrics(new AdapterMetrics())
                .dropReasons(Map.of())
                .error(error)
                .build();
    }
}
