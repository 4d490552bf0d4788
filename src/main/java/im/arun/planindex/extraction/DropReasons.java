package im.arun.planindex.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Insertion-ordered tally of why candidate objects were not emitted.
 */
public class DropReasons {
    public static final String NAME_ONLY_WITH_PAIRING_RULE = "name_only_with_pairing_rule";
    public static final String LOW_CONFIDENCE_DOOR = "low_confidence_door";

    private final Map<String, Integer> counts = new LinkedHashMap<>();

    public void record(String reason) {
        counts.merge(reason, 1, Integer::sum);
    }

    public void addAll(Map<String, Integer> other) {
        other.forEach((reason, count) -> counts.merge(reason, count, Integer::sum));
    }

    public int count(String reason) {
        return counts.getOrDefault(reason, 0);
    }

    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }
}
