package im.arun.planindex.extraction;

import im.arun.planindex.config.PlanIndexConfig;
import im.arun.planindex.model.BoundingBox;
import im.arun.planindex.model.ExtractedObject;
import im.arun.planindex.model.ExtractedRoom;
import im.arun.planindex.model.ExtractionPolicy;
import im.arun.planindex.model.ObjectType;
import im.arun.planindex.model.PageRef;
import im.arun.planindex.model.TextToken;
import im.arun.planindex.model.TokenSource;
import im.arun.planindex.rules.Pairing;
import im.arun.planindex.rules.RulePayload;
import im.arun.planindex.rules.TokenDetector;
import im.arun.planindex.token.TokenService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PageExtractorTest {

    private static final List<RulePayload> RULES = List.of(
            TokenDetector.regex("door_number", "P\\d{2}"),
            TokenDetector.regex("room_number", "\\d{3}"),
            TokenDetector.length("room_name", 3),
            Pairing.of("below", 200));

    @Mock
    private TokenService tokenService;

    private PageExtractor extractor;
    private PageRef page;

    @BeforeEach
    void setUp() {
        extractor = new PageExtractor(tokenService, new PlanIndexConfig());
        page = PageRef.builder().projectId(UUID.randomUUID()).pageId(UUID.randomUUID()).pageNumber(0).build();
    }

    private TextToken vector(String text, int x, int y, int w, int h) {
        return TextToken.builder()
                .text(text)
                .bbox(BoundingBox.of(x, y, w, h))
                .confidence(1.0)
                .source(TokenSource.VECTOR)
                .pageId(page.getPageId())
                .build();
    }

    @Test
    void extractsRoomsAndDoors() {
        when(tokenService.getTokensForPage(eq(page), any())).thenReturn(List.of(
                vector("CLASSE", 100, 80, 60, 20),
                vector("203", 100, 110, 40, 20),
                vector("HALL", 600, 600, 40, 20),
                vector("P12", 300, 300, 30, 15)));

        PageExtraction result = extractor.extractPage(page, RULES, ExtractionPolicy.CONSERVATIVE);

        assertThat(result.isFailed()).isFalse();
        assertThat(result.getTokenSources()).containsEntry("vector", 4);
        assertThat(result.getObjects()).extracting(ExtractedObject::getType)
                .containsExactly(ObjectType.ROOM, ObjectType.DOOR);
        ExtractedRoom room = (ExtractedRoom) result.getObjects().get(0);
        assertThat(room.getRoomName()).isEqualTo("CLASSE");
        assertThat(room.getRoomNumber()).isEqualTo("203");
        assertThat(room.getConfidence()).isEqualTo(1.0);
        assertThat(result.getDropReasons()).containsEntry(DropReasons.NAME_ONLY_WITH_PAIRING_RULE, 1);
        assertThat(result.getAdapterMetrics().getPairedWithNumber()).isEqualTo(1);
    }

    @Test
    void noTokensGivesNoObjects() {
        when(tokenService.getTokensForPage(eq(page), any())).thenReturn(List.of());

        PageExtraction result = extractor.extractPage(page, RULES, ExtractionPolicy.CONSERVATIVE);

        assertThat(result.isFailed()).isFalse();
        assertThat(result.getObjects()).isEmpty();
    }

    @Test
    void failuresBecomeEmptyFailedResults() {
        when(tokenService.getTokensForPage(eq(page), any())).thenThrow(new IllegalStateException("storage down"));

        PageExtraction result = extractor.extractPage(page, RULES, ExtractionPolicy.CONSERVATIVE);

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getError()).contains("storage down");
        assertThat(result.getObjects()).isEmpty();
        assertThat(result.getPageId()).isEqualTo(page.getPageId());
    }

    @Test
    void sameTokensGiveSameIds() {
        List<TextToken> tokens = List.of(vector("CLASSE", 100, 80, 60, 20), vector("203", 100, 110, 40, 20));
        when(tokenService.getTokensForPage(eq(page), any())).thenReturn(tokens);

        String first = extractor.extractPage(page, RULES, ExtractionPolicy.CONSERVATIVE).getObjects().get(0).getId();
        String second = extractor.extractPage(page, RULES, ExtractionPolicy.RELAXED).getObjects().get(0).getId();

        assertThat(first).isEqualTo(second);
    }
}
