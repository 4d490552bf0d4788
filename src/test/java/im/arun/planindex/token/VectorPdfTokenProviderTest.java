package im.arun.planindex.token;

import im.arun.planindex.model.PageGeometry;
import im.arun.planindex.model.PageRasterSpec;
import im.arun.planindex.model.PageRef;
import im.arun.planindex.model.TextToken;
import im.arun.planindex.model.TokenSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VectorPdfTokenProviderTest {

    @TempDir
    Path dir;

    private final VectorPdfTokenProvider provider = new VectorPdfTokenProvider();

    private PageRef page(Path pdf, int pageNumber) {
        return PageRef.builder()
                .projectId(UUID.randomUUID())
                .pageId(UUID.randomUUID())
                .pageNumber(pageNumber)
                .pdfPath(pdf)
                .build();
    }

    private static TextToken find(List<TextToken> tokens, String text) {
        return tokens.stream().filter(t -> t.getText().equals(text)).findFirst().orElseThrow();
    }

    @Test
    void extractsWordsInPointSpaceWhenRasterMatchesPageSize() throws Exception {
        PageRef page = page(PdfFixtures.classroomPlan(dir), 0);

        List<TextToken> tokens = provider.getTokens(page, new PageRasterSpec(612, 792));

        assertThat(tokens).extracting(TextToken::getText).containsExactlyInAnyOrder("CLASSE", "203", "BUREAU", "105");
        assertThat(tokens).allSatisfy(token -> {
            assertThat(token.getSource()).isEqualTo(TokenSource.VECTOR);
            assertThat(token.getConfidence()).isEqualTo(1.0);
            assertThat(token.getPageId()).isEqualTo(page.getPageId());
        });

        TextToken classe = find(tokens, "CLASSE");
        TextToken number = find(tokens, "203");
        assertThat(classe.getBbox().getX()).isBetween(99, 101);
        // baseline at 700pt from the bottom, so the top-left y is a little above 92
        assertThat(classe.getBbox().getY()).isBetween(75, 92);
        assertThat(number.getBbox().getY()).isGreaterThan(classe.getBbox().getY());
    }

    @Test
    void defaultsToPageSizeAtConfiguredDpi() throws Exception {
        PageRef page = page(PdfFixtures.classroomPlan(dir), 0);

        List<TextToken> tokens = provider.getTokens(page, null);

        // 100pt at 150 DPI
        assertThat(find(tokens, "CLASSE").getBbox().getX()).isBetween(206, 210);
    }

    @Test
    void scalesEachAxisIndependently() throws Exception {
        PageRef page = page(PdfFixtures.classroomPlan(dir), 0);
        TextToken uniform = find(provider.getTokens(page, new PageRasterSpec(612, 792)), "CLASSE");

        // twice as wide as the 612x792 page, same height
        TextToken stretched = find(provider.getTokens(page, new PageRasterSpec(1224, 792)), "CLASSE");

        assertThat(stretched.getBbox().getX()).isBetween(198, 202);
        assertThat(stretched.getBbox().getWidth()).isBetween(uniform.getBbox().getWidth() * 2 - 1,
                uniform.getBbox().getWidth() * 2 + 1);
        assertThat(stretched.getBbox().getY()).isEqualTo(uniform.getBbox().getY());
        assertThat(stretched.getBbox().getHeight()).isEqualTo(uniform.getBbox().getHeight());
    }

    @Test
    void pageSizeComesFromStorage() throws Exception {
        Path pdf = PdfFixtures.classroomPlan(dir);
        PageStorage storage = mock(PageStorage.class);
        when(storage.pdfPageGeometry(pdf, 0)).thenReturn(new PageGeometry(306, 792));
        VectorPdfTokenProvider withStorage = new VectorPdfTokenProvider(storage, 150);

        List<TextToken> tokens = withStorage.getTokens(page(pdf, 0), new PageRasterSpec(612, 792));

        // 612 px over a reported 306 pt width doubles x
        assertThat(find(tokens, "CLASSE").getBbox().getX()).isBetween(198, 202);
        verify(storage).pdfPageGeometry(pdf, 0);
    }

    @Test
    void unavailableGeometryYieldsNoTokens() throws Exception {
        Path pdf = PdfFixtures.classroomPlan(dir);
        PageStorage storage = mock(PageStorage.class);
        when(storage.pdfPageGeometry(pdf, 0)).thenThrow(new SourceUnavailableException("gone"));

        assertThat(new VectorPdfTokenProvider(storage, 150).getTokens(page(pdf, 0), null)).isEmpty();
    }

    @Test
    void unavailableSourcesYieldNoTokens() throws Exception {
        Path pdf = PdfFixtures.classroomPlan(dir);

        assertThat(provider.getTokens(page(dir.resolve("missing.pdf"), 0), null)).isEmpty();
        assertThat(provider.getTokens(page(pdf, 3), null)).isEmpty();
        assertThat(provider.getTokens(page(null, 0), null)).isEmpty();
    }

    @Test
    void unreadablePdfYieldsNoTokens() throws Exception {
        Path broken = dir.resolve("broken.pdf");
        Files.writeString(broken, "not a pdf");

        assertThat(provider.getTokens(page(broken, 0), null)).isEmpty();
    }
}
