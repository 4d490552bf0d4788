package im.arun.planindex.extraction;

import im.arun.planindex.id.ObjectIdGenerator;
import im.arun.planindex.model.ExtractedRoom;
import im.arun.planindex.model.ExtractionPolicy;
import im.arun.planindex.model.SyntheticBlock;
import im.arun.planindex.rules.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Turns name blocks into rooms.
 *
 * <p>When the rules declare a pairing, a room is a name+number pair and name-only blocks are
 * dropped. Without a pairing rule a bare name is accepted as a room.
 */
public class RoomAssembler {
    private static final Logger logger = LoggerFactory.getLogger(RoomAssembler.class);

    static final String TAG_TEXT_DETECTED = "text_detected";
    static final String TAG_SPATIAL_LABELING = "spatial_labeling";
    static final String TAG_GUIDE_PAYLOAD = "guide_payload";
    static final String TAG_RELAXED_POLICY = "extraction_policy:relaxed";
    static final String TAG_PROVISIONAL_GUIDE = "guide_source:provisional";

    private final ObjectIdGenerator idGenerator;
    private final double pairedConfidenceBoost;

    public RoomAssembler(ObjectIdGenerator idGenerator, double pairedConfidenceBoost) {
        this.idGenerator = idGenerator;
        this.pairedConfidenceBoost = pairedConfidenceBoost;
    }

    public List<ExtractedRoom> assemble(UUID pageId, List<SyntheticBlock> blocks, RuleSet rules,
                                        ExtractionPolicy policy, DropReasons dropReasons) {
        String nameRole = rules.getPairing().getNameRole();
        boolean requireNumber = rules.hasPairingRule();
        List<String> sources = provenance(policy);
        List<ExtractedRoom> rooms = new ArrayList<>();

        for (SyntheticBlock block : blocks) {
            if (!nameRole.equals(block.getRole())) {
                continue;
            }
            if (!block.isPaired() && requireNumber) {
                dropReasons.record(DropReasons.NAME_ONLY_WITH_PAIRING_RULE);
                logger.debug("Dropping name-only block '{}' on page {}", block.getNameValue(), pageId);
                continue;
            }

            String name = block.getNameValue();
            String number = block.getNumberValue();
            String label = number != null ? name + " " + number : name;
            double confidence = block.isPaired()
                    ? Math.min(1.0, block.getConfidence() + pairedConfidenceBoost)
                    : block.getConfidence();

            rooms.add(ExtractedRoom.builder()
                    .id(idGenerator.generateRoomId(pageId, label, block.getBbox(), number))
                    .pageId(pageId)
                    .label(label)
                    .bbox(block.getBbox())
                    .confidence(confidence)
                    .sources(sources)
                    .roomName(name)
                    .roomNumber(number)
                    .labelBbox(block.getBbox())
                    .build());
        }

        logger.info("Page {}: {} rooms assembled under {} policy", pageId, rooms.size(), policy.getValue());
        return rooms;
    }

    static List<String> provenance(ExtractionPolicy policy) {
        List<String> sources = new ArrayList<>(List.of(TAG_TEXT_DETECTED, TAG_SPATIAL_LABELING, TAG_GUIDE_PAYLOAD));
        if (policy == ExtractionPolicy.RELAXED) {
            sources.add(TAG_RELAXED_POLICY);
            sources.add(TAG_PROVISIONAL_GUIDE);
        }
        return sources;
    }
}
