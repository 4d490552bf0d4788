package im.arun.planindex.index;

import im.arun.planindex.model.ExtractedObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves lookups against a project's index. Criteria are OR-ed: an object matches when any
 * given criterion matches, and its reasons list every criterion it satisfied.
 */
public class QueryService {
    private static final Logger logger = LoggerFactory.getLogger(QueryService.class);

    static final String ROOM_NUMBER_MATCH = "room_number_match";
    static final String ROOM_NAME_MATCH = "room_name_match";
    static final String TYPE_MATCH = "type_match";
    static final String UNIQUE_MATCH = "unique_match";

    private final ObjectRepository repository;

    public QueryService(ObjectRepository repository) {
        this.repository = repository;
    }

    /**
     * @throws IllegalArgumentException when no criterion is given
     */
    public QueryResult query(UUID projectId, String roomNumber, String roomName, String type) {
        Map<String, String> criteria = new LinkedHashMap<>();
        putIfPresent(criteria, "room_number", roomNumber);
        putIfPresent(criteria, "room_name", roomName);
        putIfPresent(criteria, "type", type);
        if (criteria.isEmpty()) {
            throw new IllegalArgumentException("At least one query parameter is required");
        }

        Optional<ProjectIndex> index = repository.findIndex(projectId);
        if (index.isEmpty()) {
            logger.warn("No index for project {}", projectId);
            return QueryResult.of(projectId, criteria, List.of());
        }

        Map<String, List<String>> reasons = new LinkedHashMap<>();
        collect(reasons, index.get().getRoomsByNumber(), criteria.get("room_number"), ROOM_NUMBER_MATCH);
        collect(reasons, index.get().getRoomsByName(), criteria.get("room_name"), ROOM_NAME_MATCH);
        collect(reasons, index.get().getObjectsByType(), criteria.get("type"), TYPE_MATCH);

        List<QueryMatch> matches = new ArrayList<>();
        for (ExtractedObject object : repository.findByProject(projectId)) {
            List<String> objectReasons = reasons.get(object.getId());
            if (objectReasons == null) {
                continue;
            }
            List<String> matchReasons = new ArrayList<>(objectReasons);
            if (reasons.size() == 1) {
                matchReasons.add(UNIQUE_MATCH);
            }
            matches.add(QueryMatch.builder()
                    .objectId(object.getId())
                    .pageId(object.getPageId())
                    .score(object.getConfidence())
                    .bbox(object.getBbox())
                    .label(object.getLabel())
                    .confidenceLevel(object.getConfidenceLevel())
                    .reasons(matchReasons)
                    .build());
        }

        QueryResult result = QueryResult.of(projectId, criteria, matches);
        logger.info("Query {} on project {}: {} matches, ambiguous={}",
                criteria, projectId, matches.size(), result.isAmbiguous());
        return result;
    }

    private static void collect(Map<String, List<String>> reasons, Map<String, List<String>> lookup,
                                String key, String reason) {
        if (key == null) {
            return;
        }
        for (String id : lookup.getOrDefault(key, List.of())) {
            List<String> objectReasons = reasons.computeIfAbsent(id, k -> new ArrayList<>());
            if (!objectReasons.contains(reason)) {
                objectReasons.add(reason);
            }
        }
    }

    private static void putIfPresent(Map<String, String> criteria, String key, String value) {
        if (value != null && !value.isBlank()) {
            criteria.put(key, value);
        }
    }
}
