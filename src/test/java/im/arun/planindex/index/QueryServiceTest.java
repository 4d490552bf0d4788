package im.arun.planindex.index;

import im.arun.planindex.model.BoundingBox;
import im.arun.planindex.model.ConfidenceLevel;
import im.arun.planindex.model.DoorType;
import im.arun.planindex.model.ExtractedDoor;
import im.arun.planindex.model.ExtractedRoom;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryServiceTest {

    private final UUID projectId = UUID.randomUUID();
    private final UUID pageA = UUID.randomUUID();
    private final UUID pageB = UUID.randomUUID();

    private InMemoryObjectRepository repository;
    private QueryService queryService;

    private static ExtractedRoom room(String id, UUID page, String name, String number, double confidence) {
        return ExtractedRoom.builder()
                .id(id)
                .pageId(page)
                .label(name + " " + number)
                .bbox(BoundingBox.of(100, 80, 60, 50))
                .confidence(confidence)
                .sources(List.of("text_detected"))
                .roomName(name)
                .roomNumber(number)
                .build();
    }

    @BeforeEach
    void setUp() {
        repository = new InMemoryObjectRepository();
        repository.savePageObjects(projectId, pageA, List.of(room("room_a", pageA, "CLASSE", "203", 1.0)));
        repository.savePageObjects(projectId, pageB, List.of(
                room("room_b", pageB, "BUREAU", "203", 0.7),
                ExtractedDoor.builder()
                        .id("door_c")
                        .pageId(pageB)
                        .label("P12")
                        .bbox(BoundingBox.of(10, 10, 20, 20))
                        .confidence(0.9)
                        .doorNumber("P12")
                        .doorType(DoorType.UNKNOWN)
                        .build()));
        repository.saveIndex(new IndexBuilder().build(projectId, repository.findByProject(projectId)));
        queryService = new QueryService(repository);
    }

    @Test
    void sharedNumberIsAmbiguous() {
        QueryResult result = queryService.query(projectId, "203", null, null);

        assertThat(result.isAmbiguous()).isTrue();
        assertThat(result.getMessage()).isEqualTo("Multiple candidates found");
        assertThat(result.getMatches()).extracting(QueryMatch::getObjectId).containsExactly("room_a", "room_b");
        assertThat(result.getMatches()).allSatisfy(match ->
                assertThat(match.getReasons()).containsExactly("room_number_match"));
    }

    @Test
    void singleMatchIsUnique() {
        QueryResult result = queryService.query(projectId, null, "CLASSE", null);

        assertThat(result.isAmbiguous()).isFalse();
        assertThat(result.getMessage()).isNull();
        assertThat(result.getMatches()).singleElement().satisfies(match -> {
            assertThat(match.getObjectId()).isEqualTo("room_a");
            assertThat(match.getPageId()).isEqualTo(pageA);
            assertThat(match.getScore()).isEqualTo(1.0);
            assertThat(match.getConfidenceLevel()).isEqualTo(ConfidenceLevel.HIGH);
            assertThat(match.getReasons()).containsExactly("room_name_match", "unique_match");
        });
    }

    @Test
    void criteriaAreUnionedWithEveryReason() {
        QueryResult result = queryService.query(projectId, "203", "CLASSE", "door");

        assertThat(result.getMatches()).extracting(QueryMatch::getObjectId)
                .containsExactly("room_a", "room_b", "door_c");
        assertThat(result.getMatches().get(0).getReasons()).containsExactly("room_number_match", "room_name_match");
        assertThat(result.getMatches().get(2).getReasons()).containsExactly("type_match");
        assertThat(result.getQuery()).containsOnlyKeys("room_number", "room_name", "type");
    }

    @Test
    void noMatchIsNotAnError() {
        QueryResult result = queryService.query(projectId, "999", null, null);

        assertThat(result.getMatches()).isEmpty();
        assertThat(result.isAmbiguous()).isFalse();
    }

    @Test
    void projectWithoutIndexHasNoMatches() {
        assertThat(queryService.query(UUID.randomUUID(), "203", null, null).getMatches()).isEmpty();
    }

    @Test
    void emptyQueryIsRejected() {
        assertThatThrownBy(() -> queryService.query(projectId, null, " ", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
