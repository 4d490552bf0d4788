package im.arun.planindex.index;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Every object matching a query. When more than one matches the result is flagged ambiguous
 * and no candidate is preferred over another.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResult {
    public static final String AMBIGUOUS_MESSAGE = "Multiple candidates found";

    @JsonProperty("project_id")
    UUID projectId;

    @JsonProperty("query")
    Map<String, String> query;

    @JsonProperty("matches")
    List<QueryMatch> matches;

    @JsonProperty("ambiguous")
    boolean ambiguous;

    @JsonProperty("message")
    String message;

    public static QueryResult of(UUID projectId, Map<String, String> query, List<QueryMatch> matches) {
        boolean ambiguous = matches.size() > 1;
        return new QueryResult(projectId, query, matches, ambiguous, ambiguous ? AMBIGUOUS_MESSAGE : null);
    }
}
