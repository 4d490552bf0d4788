package im.arun.planindex.extraction;

import im.arun.planindex.id.ObjectIdGenerator;
import im.arun.planindex.model.ConfidenceLevel;
import im.arun.planindex.model.DoorType;
import im.arun.planindex.model.ExtractedDoor;
import im.arun.planindex.model.ExtractionPolicy;
import im.arun.planindex.model.SyntheticBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Turns door-number blocks into doors. The swing type cannot be read from text, so every
 * door is {@link DoorType#UNKNOWN}. Low-confidence door numbers are dropped.
 */
public class DoorAssembler {
    private static final Logger logger = LoggerFactory.getLogger(DoorAssembler.class);
    public static final String DOOR_NUMBER_ROLE = "door_number";

    private final ObjectIdGenerator idGenerator;

    public DoorAssembler(ObjectIdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    public List<ExtractedDoor> assemble(UUID pageId, List<SyntheticBlock> blocks,
                                        ExtractionPolicy policy, DropReasons dropReasons) {
        List<String> sources = RoomAssembler.provenance(policy);
        List<ExtractedDoor> doors = new ArrayList<>();

        for (SyntheticBlock block : blocks) {
            if (!DOOR_NUMBER_ROLE.equals(block.getRole())) {
                continue;
            }
            if (ConfidenceLevel.fromConfidence(block.getConfidence()) == ConfidenceLevel.LOW) {
                dropReasons.record(DropReasons.LOW_CONFIDENCE_DOOR);
                continue;
            }

            String number = block.getNumberValue();
            doors.add(ExtractedDoor.builder()
                    .id(idGenerator.generateDoorId(pageId, number, block.getBbox(), number))
                    .pageId(pageId)
                    .label(number)
                    .bbox(block.getBbox())
                    .confidence(block.getConfidence())
                    .sources(sources)
                    .doorNumber(number)
                    .doorType(DoorType.UNKNOWN)
                    .build());
        }

        if (!doors.isEmpty()) {
            logger.info("Page {}: {} doors assembled", pageId, doors.size());
        }
        return doors;
    }
}
