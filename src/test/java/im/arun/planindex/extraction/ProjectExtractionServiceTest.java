package im.arun.planindex.extraction;

import im.arun.planindex.config.PlanIndexConfig;
import im.arun.planindex.index.InMemoryObjectRepository;
import im.arun.planindex.index.IndexBuilder;
import im.arun.planindex.index.ProjectIndex;
import im.arun.planindex.model.BoundingBox;
import im.arun.planindex.model.ExtractionPolicy;
import im.arun.planindex.model.PageRef;
import im.arun.planindex.model.TextToken;
import im.arun.planindex.model.TokenSource;
import im.arun.planindex.rules.Pairing;
import im.arun.planindex.rules.RulePayload;
import im.arun.planindex.rules.TokenDetector;
import im.arun.planindex.token.TokenService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProjectExtractionServiceTest {

    private static final List<RulePayload> RULES = List.of(
            TokenDetector.regex("room_number", "\\d{3}"),
            TokenDetector.length("room_name", 3),
            Pairing.of("below", 200));

    private final UUID projectId = UUID.randomUUID();
    private ExecutorService executor;
    private TokenService tokenService;
    private InMemoryObjectRepository repository;
    private ProjectExtractionService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        tokenService = mock(TokenService.class);
        repository = new InMemoryObjectRepository();
        PlanIndexConfig config = new PlanIndexConfig();
        service = new ProjectExtractionService(new PageExtractor(tokenService, config), repository,
                new IndexBuilder(), config, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private PageRef page(int number) {
        return PageRef.builder().projectId(projectId).pageId(UUID.randomUUID()).pageNumber(number).build();
    }

    private static List<TextToken> room(String name, String number) {
        return List.of(
                TextToken.of(name, BoundingBox.of(100, 80, 60, 20), 1.0, TokenSource.VECTOR),
                TextToken.of(number, BoundingBox.of(100, 110, 40, 20), 1.0, TokenSource.VECTOR),
                TextToken.of("HALL", BoundingBox.of(900, 900, 40, 20), 1.0, TokenSource.VECTOR));
    }

    @Test
    void storesObjectsPerPageAndRebuildsTheIndex() {
        PageRef first = page(0);
        PageRef second = page(1);
        PageRef broken = page(2);
        when(tokenService.getTokensForPage(eq(first), any())).thenReturn(room("CLASSE", "203"));
        when(tokenService.getTokensForPage(eq(second), any())).thenReturn(room("BUREAU", "203"));
        when(tokenService.getTokensForPage(eq(broken), any())).thenThrow(new IllegalStateException("corrupt page"));

        ExtractionReport report = service.run(projectId, List.of(first, second, broken), RULES,
                ExtractionPolicy.CONSERVATIVE);

        assertThat(report.getPagesProcessed()).isEqualTo(3);
        assertThat(report.getRoomsExtracted()).isEqualTo(2);
        assertThat(report.getDoorsExtracted()).isZero();
        assertThat(report.getFailedPages()).containsExactly(broken.getPageId());
        assertThat(report.getDropReasons()).containsEntry(DropReasons.NAME_ONLY_WITH_PAIRING_RULE, 2);

        assertThat(repository.findByPage(projectId, first.getPageId())).hasSize(1);
        assertThat(repository.findByPage(projectId, broken.getPageId())).isEmpty();

        ProjectIndex index = repository.findIndex(projectId).orElseThrow();
        assertThat(index.getRoomsByNumber().get("203")).hasSize(2);
        assertThat(index.getRoomsByName()).containsOnlyKeys("CLASSE", "BUREAU");
        assertThat(index.getObjectsByType().get("room")).hasSize(2);
    }

    @Test
    void rerunningIsIdempotent() {
        PageRef first = page(0);
        when(tokenService.getTokensForPage(eq(first), any())).thenReturn(room("CLASSE", "203"));

        service.run(projectId, List.of(first), RULES, ExtractionPolicy.CONSERVATIVE);
        String firstId = repository.findByProject(projectId).get(0).getId();
        service.run(projectId, List.of(first), RULES, ExtractionPolicy.CONSERVATIVE);

        assertThat(repository.findByProject(projectId)).singleElement()
                .satisfies(object -> assertThat(object.getId()).isEqualTo(firstId));
        assertThat(repository.findIndex(projectId).orElseThrow().getRoomsByNumber().get("203"))
                .containsExactly(firstId);
    }

    @Test
    void malformedRulesAreReported() {
        PageRef first = page(0);
        when(tokenService.getTokensForPage(eq(first), any())).thenReturn(room("CLASSE", "203"));
        List<RulePayload> rules = List.of(TokenDetector.regex("room_number", "[0-9"),
                TokenDetector.regex("room_number", "\\d{3}"), TokenDetector.length("room_name", 3));

        ExtractionReport report = service.run(projectId, List.of(first), rules, ExtractionPolicy.RELAXED);

        assertThat(report.getRulesSkipped()).isEqualTo(1);
        // no pairing rule: the unpaired HALL is kept as a room
        assertThat(report.getRoomsExtracted()).isEqualTo(2);
        assertThat(report.getPolicy()).isEqualTo("relaxed");
    }
}
