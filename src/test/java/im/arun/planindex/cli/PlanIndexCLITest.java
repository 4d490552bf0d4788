package im.arun.planindex.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.planindex.token.PdfFixtures;
import im.arun.planindex.util.ExecutorProvider;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanIndexCLITest {

    @TempDir
    Path dir;

    @AfterEach
    void tearDown() {
        ExecutorProvider.shutdown();
    }

    private Path rulesFile() throws Exception {
        Path rules = dir.resolve("rules.json");
        try (InputStream in = Objects.requireNonNull(
                getClass().getClassLoader().getResourceAsStream("rules/classroom-rules.json"))) {
            Files.copy(in, rules);
        }
        return rules;
    }

    private static int execute(String... args) {
        return new CommandLine(new PlanIndexCLI())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }

    @Test
    void extractsAndQueriesAPlan() throws Exception {
        Path pdf = PdfFixtures.classroomPlan(dir);
        Path output = dir.resolve("out.json");

        int exitCode = execute("--pdf", pdf.toString(), "--rules", rulesFile().toString(),
                "--policy", "relaxed", "--query-room-number", "203", "--output", output.toString());

        assertThat(exitCode).isZero();
        JsonNode result = new ObjectMapper().readTree(output.toFile());
        assertThat(result.at("/report/rooms_extracted").asInt()).isEqualTo(2);
        assertThat(result.at("/report/policy").asText()).isEqualTo("relaxed");
        assertThat(result.at("/objects").size()).isEqualTo(2);
        assertThat(result.at("/objects/0/bbox").size()).isEqualTo(4);
        assertThat(result.at("/query/ambiguous").asBoolean()).isFalse();
        assertThat(result.at("/query/matches/0/label").asText()).isEqualTo("CLASSE 203");
        assertThat(result.at("/query/matches/0/reasons/1").asText()).isEqualTo("unique_match");
    }

    @Test
    void pageWithoutVectorTextGoesToTheFallbackDetector() throws Exception {
        Path pdf = PdfFixtures.rotatedBlankPage(dir);
        Path output = dir.resolve("fallback.json");
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse()
                    .setHeader("Content-Type", "application/json")
                    .setBody("{\"regions\":["
                            + "{\"bbox\":[100,80,60,20],\"text\":\"CLASSE\",\"confidence\":0.95},"
                            + "{\"bbox\":[100,110,40,20],\"text\":\"203\",\"confidence\":0.85}]}"));
            server.start();

            int exitCode = execute("--pdf", pdf.toString(), "--rules", rulesFile().toString(),
                    "--fallback-endpoint", server.url("/detect").toString(), "--output", output.toString());

            assertThat(exitCode).isZero();
            assertThat(server.getRequestCount()).isEqualTo(1);
            JsonNode body = new ObjectMapper().readTree(server.takeRequest().getBody().readUtf8());
            byte[] image = Base64.getDecoder().decode(body.get("image_base64").asText());
            assertThat(image).startsWith((byte) 0x89, (byte) 'P', (byte) 'N', (byte) 'G');
        }

        JsonNode result = new ObjectMapper().readTree(output.toFile());
        assertThat(result.at("/report/rooms_extracted").asInt()).isEqualTo(1);
        assertThat(result.at("/report/pages/0/token_sources/model").asInt()).isEqualTo(2);
        assertThat(result.at("/objects/0/label").asText()).isEqualTo("CLASSE 203");
    }

    @Test
    void missingPdfFails() throws Exception {
        assertThat(execute("--pdf", dir.resolve("none.pdf").toString(), "--rules", rulesFile().toString()))
                .isEqualTo(1);
    }

    @Test
    void unknownQueryTypeFails() throws Exception {
        Path pdf = PdfFixtures.classroomPlan(dir);

        assertThat(execute("--pdf", pdf.toString(), "--rules", rulesFile().toString(), "--query-type", "window"))
                .isEqualTo(1);
    }

    @Test
    void rasterNeedsBothDimensions() throws Exception {
        Path pdf = PdfFixtures.classroomPlan(dir);

        assertThat(execute("--pdf", pdf.toString(), "--rules", rulesFile().toString(), "--raster-width", "1000"))
                .isEqualTo(1);
    }

    @Test
    void pageSelectionIsOneBased() {
        assertThat(PlanIndexCLI.parsePages(null, 3)).containsExactly(0, 1, 2);
        assertThat(PlanIndexCLI.parsePages("1-2, 5,2", 5)).containsExactly(0, 1, 4);
        assertThatThrownBy(() -> PlanIndexCLI.parsePages("4", 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PlanIndexCLI.parsePages("a-b", 3)).isInstanceOf(IllegalArgumentException.class);
    }
}
