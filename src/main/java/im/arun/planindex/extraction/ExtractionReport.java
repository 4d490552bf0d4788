package im.arun.planindex.extraction;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Summary of one project extraction run.
 */
@Value
@Builder
public class ExtractionReport {

    @JsonProperty("project_id")
    UUID projectId;

    @JsonProperty("policy")
    String policy;

    @JsonProperty("pages_processed")
    int pagesProcessed;

    @JsonProperty("rooms_extracted")
    int roomsExtracted;

    @JsonProperty("doors_extracted")
    int doorsExtracted;

    @JsonProperty("rules_skipped")
    int rulesSkipped;

    @JsonProperty("drop_reasons")
    Map<String, Integer> dropReasons;

    @Singular
    @JsonProperty("failed_pages")
    List<UUID> failedPages;

    @Singular
    @JsonProperty("pages")
    List<PageExtraction> pages;
}
