package im.arun.planindex.rules;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Removes name candidates whose text fully matches {@code pattern}, e.g. global sheet
 * annotations that look like room names.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExcludeRule implements RulePayload {

    @JsonProperty("pattern")
    private String pattern;

    @JsonProperty("reason")
    private String reason;
}
