package im.arun.planindex.extraction;

import im.arun.planindex.id.ObjectIdGenerator;
import im.arun.planindex.model.BoundingBox;
import im.arun.planindex.model.DoorType;
import im.arun.planindex.model.ExtractedDoor;
import im.arun.planindex.model.ExtractionPolicy;
import im.arun.planindex.model.SyntheticBlock;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class DoorAssemblerTest {

    private final DoorAssembler assembler = new DoorAssembler(new ObjectIdGenerator());

    private static SyntheticBlock doorBlock(String number, double confidence) {
        return SyntheticBlock.builder()
                .bbox(BoundingBox.of(200, 300, 30, 15))
                .text(number)
                .role(DoorAssembler.DOOR_NUMBER_ROLE)
                .numberValue(number)
                .confidence(confidence)
                .sourceText(number)
                .build();
    }

    @Test
    void doorNumberBlocksBecomeDoors() {
        UUID page = UUID.randomUUID();

        List<ExtractedDoor> doors = assembler.assemble(page, List.of(doorBlock("P12", 1.0)),
                ExtractionPolicy.CONSERVATIVE, new DropReasons());

        assertThat(doors).singleElement().satisfies(door -> {
            assertThat(door.getDoorNumber()).isEqualTo("P12");
            assertThat(door.getLabel()).isEqualTo("P12");
            assertThat(door.getDoorType()).isEqualTo(DoorType.UNKNOWN);
            assertThat(door.getId()).startsWith("door_");
            assertThat(door.getPageId()).isEqualTo(page);
        });
    }

    @Test
    void lowConfidenceDoorsAreDropped() {
        DropReasons drops = new DropReasons();

        List<ExtractedDoor> doors = assembler.assemble(UUID.randomUUID(),
                List.of(doorBlock("P12", 0.4), doorBlock("P13", 0.5)), ExtractionPolicy.RELAXED, drops);

        assertThat(doors).extracting(ExtractedDoor::getDoorNumber).containsExactly("P13");
        assertThat(doors.get(0).getSources()).contains("extraction_policy:relaxed");
        assertThat(drops.count(DropReasons.LOW_CONFIDENCE_DOOR)).isEqualTo(1);
    }
}
