package im.arun.planindex.index;

import im.arun.planindex.model.ExtractedObject;
import im.arun.planindex.model.ExtractedRoom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public class IndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(IndexBuilder.class);

    private final Clock clock;

    public IndexBuilder() {
        this(Clock.systemUTC());
    }

    public IndexBuilder(Clock clock) {
        this.clock = clock;
    }

    /**
     * Single pass over the objects filling the three lookups.
     */
    public ProjectIndex build(UUID projectId, Collection<? extends ExtractedObject> objects) {
        Map<String, List<String>> roomsByNumber = new LinkedHashMap<>();
        Map<String, List<String>> roomsByName = new LinkedHashMap<>();
        Map<String, List<String>> objectsByType = new LinkedHashMap<>();

        for (ExtractedObject object : objects) {
            String id = object.getId();
            objectsByType.computeIfAbsent(object.getType().getValue(), k -> new ArrayList<>()).add(id);

            if (object instanceof ExtractedRoom) {
                ExtractedRoom room = (ExtractedRoom) object;
                if (room.getRoomNumber() != null && !room.getRoomNumber().isEmpty()) {
                    roomsByNumber.computeIfAbsent(room.getRoomNumber(), k -> new ArrayList<>()).add(id);
                }
                if (room.getRoomName() != null && !room.getRoomName().isEmpty()) {
                    roomsByName.computeIfAbsent(room.getRoomName(), k -> new ArrayList<>()).add(id);
                }
            }
        }

        logger.info("Index built for project {}: {} room numbers, {} room names, {} object types",
                projectId, roomsByNumber.size(), roomsByName.size(), objectsByType.size());

        return new ProjectIndex(projectId, Instant.now(clock), roomsByNumber, roomsByName, objectsByType);
    }
}
