package im.arun.planindex.block;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counters collected while turning one page's tokens into blocks.
 */
@Data
public class AdapterMetrics {

    @JsonProperty("tokens_input")
    private int tokensInput;

    @JsonProperty("name_tokens")
    private int nameTokens;

    @JsonProperty("number_tokens")
    private int numberTokens;

    @JsonProperty("other_role_tokens")
    private int otherRoleTokens;

    @JsonProperty("blocks_created")
    private int blocksCreated;

    @JsonProperty("paired_with_number")
    private int pairedWithNumber;

    @JsonProperty("name_only_no_number")
    private int nameOnlyNoNumber;

    @JsonProperty("number_only_no_name")
    private int numberOnlyNoName;

    @JsonProperty("excluded_by_rule")
    private int excludedByRule;

    @JsonProperty("excluded_reasons")
    private Map<String, Integer> excludedReasons = new LinkedHashMap<>();

    void recordExclusion(String reason) {
        excludedByRule++;
        excludedReasons.merge(reason, 1, Integer::sum);
    }

    @JsonProperty("rooms_with_number_ratio")
    public double getRoomsWithNumberRatio() {
        int labelBlocks = pairedWithNumber + nameOnlyNoNumber;
        if (labelBlocks == 0) {
            return 0.0;
        }
        return (double) pairedWithNumber / labelBlocks;
    }
}
