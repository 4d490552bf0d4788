package im.arun.planindex.rules;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Declares that a name token and a number token combine into one label when the number
 * lies in {@code relation} to the name within {@code maxDistancePx}.
 * Its presence also means the project defines rooms as name+number pairs.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Pairing implements RulePayload {
    public static final String DEFAULT_NAME_ROLE = "room_name";
    public static final String DEFAULT_NUMBER_ROLE = "room_number";

    @JsonProperty("name_role")
    @JsonAlias({"name_token", "nameRole"})
    private String nameRole;

    @JsonProperty("number_role")
    @JsonAlias({"number_token", "numberRole"})
    private String numberRole;

    @JsonProperty("relation")
    private String relation;

    @JsonProperty("max_distance_px")
    @JsonAlias("maxDistancePx")
    private Integer maxDistancePx;

    public static Pairing of(String relation, int maxDistancePx) {
        return new Pairing(DEFAULT_NAME_ROLE, DEFAULT_NUMBER_ROLE, relation, maxDistancePx);
    }
}
