package im.arun.planindex.rules;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Assigns a role (e.g. {@code room_name}, {@code room_number}, {@code door_number}) to tokens
 * whose text satisfies the detection method.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TokenDetector implements RulePayload {
    public static final String METHOD_REGEX = "regex";
    public static final String METHOD_LENGTH = "length";

    @JsonProperty("role")
    @JsonAlias("token_type")
    private String role;

    @JsonProperty("method")
    @JsonAlias("detector")
    private String method;

    @JsonProperty("pattern")
    private String pattern;

    @JsonProperty("min_length")
    @JsonAlias({"min_len", "minLength"})
    private Integer minLength;

    public static TokenDetector regex(String role, String pattern) {
        return new TokenDetector(role, METHOD_REGEX, pattern, null);
    }

    public static TokenDetector length(String role, int minLength) {
        return new TokenDetector(role, METHOD_LENGTH, null, minLength);
    }
}
