package im.arun.planindex.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import im.arun.planindex.config.ConfigLoader;
import im.arun.planindex.config.PlanIndexConfig;
import im.arun.planindex.extraction.ExtractionReport;
import im.arun.planindex.extraction.PageExtractor;
import im.arun.planindex.extraction.ProjectExtractionService;
import im.arun.planindex.index.InMemoryObjectRepository;
import im.arun.planindex.index.QueryResult;
import im.arun.planindex.index.QueryService;
import im.arun.planindex.model.ExtractionPolicy;
import im.arun.planindex.model.ObjectType;
import im.arun.planindex.model.PageRasterSpec;
import im.arun.planindex.model.PageRef;
import im.arun.planindex.rules.RulePayload;
import im.arun.planindex.rules.RulePayloadLoader;
import im.arun.planindex.token.FileSystemPageStorage;
import im.arun.planindex.token.HttpFallbackDetector;
import im.arun.planindex.token.ModelTokenProvider;
import im.arun.planindex.token.TokenMerger;
import im.arun.planindex.token.TokenProvider;
import im.arun.planindex.token.TokenService;
import im.arun.planindex.token.VectorPdfTokenProvider;
import im.arun.planindex.util.ExecutorProvider;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Command-line entry point: extract rooms and doors from a plan PDF and optionally query them.
 */
@Command(
    name = "planindex",
    description = "Extract rooms and doors from floor-plan PDFs using rule payloads",
    mixinStandardHelpOptions = true,
    version = "PlanIndex 1.0"
)
public class PlanIndexCLI implements Callable<Integer> {

    @Option(names = {"--pdf"}, description = "Path to the plan PDF", required = true)
    private Path pdfPath;

    @Option(names = {"--rules"}, description = "Rule payload file (.json, .yaml or .yml)", required = true)
    private Path rulesPath;

    @Option(names = {"--pages"}, description = "1-based pages to extract, e.g. 1-3,5 (default: all)")
    private String pages;

    @Option(names = {"--policy"}, description = "CONSERVATIVE or RELAXED", defaultValue = "CONSERVATIVE")
    private ExtractionPolicy policy;

    @Option(names = {"--raster-width"}, description = "Target raster width in pixels")
    private Integer rasterWidth;

    @Option(names = {"--raster-height"}, description = "Target raster height in pixels")
    private Integer rasterHeight;

    @Option(names = {"--dpi"}, description = "Raster resolution used when no raster size is given")
    private Integer dpi;

    @Option(names = {"--query-room-number"}, description = "Look up rooms by number after extraction")
    private String queryRoomNumber;

    @Option(names = {"--query-room-name"}, description = "Look up rooms by name after extraction")
    private String queryRoomName;

    @Option(names = {"--query-type"}, description = "Look up objects by type (room, door, schedule_table)")
    private String queryType;

    @Option(names = {"--fallback-endpoint"}, description = "Text region detector URL used when a page has no vector text")
    private String fallbackEndpoint;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--output"}, description = "Output JSON file path")
    private Path outputPath;

    @Override
    public Integer call() throws Exception {
        if (!Files.isRegularFile(pdfPath)) {
            System.err.println("Error: PDF file not found: " + pdfPath);
            return 1;
        }
        if (!Files.isRegularFile(rulesPath)) {
            System.err.println("Error: rules file not found: " + rulesPath);
            return 1;
        }
        if (queryType != null) {
            try {
                queryType = ObjectType.fromValue(queryType.strip()).getValue();
            } catch (IllegalArgumentException e) {
                System.err.println("Error: " + e.getMessage());
                return 1;
            }
        }
        if ((rasterWidth == null) != (rasterHeight == null)) {
            System.err.println("Error: --raster-width and --raster-height must be given together");
            return 1;
        }

        Map<String, Object> overrides = new HashMap<>();
        if (dpi != null) {
            overrides.put("dpi", dpi);
        }
        if (fallbackEndpoint != null) {
            overrides.put("fallback_endpoint", fallbackEndpoint);
        }
        PlanIndexConfig config = new ConfigLoader(configPath).load(overrides);
        ExecutorProvider.configure(config.getExtractionThreads());

        List<RulePayload> payloads = new RulePayloadLoader().load(rulesPath);
        UUID projectId = UUID.nameUUIDFromBytes(pdfPath.toAbsolutePath().normalize().toString()
                .getBytes(StandardCharsets.UTF_8));

        List<PageRef> pageRefs;
        try {
            pageRefs = pageRefs(projectId, pageCount());
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        PageRasterSpec raster = rasterWidth != null
                ? new PageRasterSpec(rasterWidth, rasterHeight, config.getDpi(), 0)
                : null;

        InMemoryObjectRepository repository = new InMemoryObjectRepository();
        ProjectExtractionService service = new ProjectExtractionService(
                new PageExtractor(tokenService(config), config), repository, config);
        ExtractionReport report = service.run(projectId, pageRefs, raster, payloads, policy);

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("report", report);
        output.put("objects", repository.findByProject(projectId));
        if (queryRoomNumber != null || queryRoomName != null || queryType != null) {
            QueryResult result = new QueryService(repository)
                    .query(projectId, queryRoomNumber, queryRoomName, queryType);
            output.put("query", result);
        }

        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        String jsonOutput = mapper.writeValueAsString(output);

        if (outputPath != null) {
            Files.writeString(outputPath, jsonOutput);
            System.err.println("Output written to: " + outputPath);
        } else {
            System.out.println(jsonOutput);
        }
        return report.getFailedPages().isEmpty() ? 0 : 2;
    }

    private TokenService tokenService(PlanIndexConfig config) {
        // pages have no stored raster here, so the fallback detector sees the PDF rendered at the configured DPI
        FileSystemPageStorage storage = new FileSystemPageStorage(config.getDpi());
        TokenProvider fallback = null;
        if (config.isUseFallback() && config.getFallbackEndpoint() != null) {
            fallback = new ModelTokenProvider(
                    new HttpFallbackDetector(config.getFallbackEndpoint(),
                            config.getFallbackTimeoutSeconds(), config.getFallbackMaxRetries()),
                    storage);
        }
        return new TokenService(new VectorPdfTokenProvider(storage, config.getDpi()), fallback,
                new TokenMerger(config.getIouThreshold()));
    }

    private int pageCount() throws IOException {
        try (PDDocument document = Loader.loadPDF(pdfPath.toFile())) {
            return document.getNumberOfPages();
        }
    }

    private List<PageRef> pageRefs(UUID projectId, int pageCount) {
        List<PageRef> refs = new ArrayList<>();
        for (int pageNumber : parsePages(pages, pageCount)) {
            refs.add(PageRef.builder()
                    .projectId(projectId)
                    .pageId(UUID.nameUUIDFromBytes((projectId + ":" + pageNumber).getBytes(StandardCharsets.UTF_8)))
                    .pageNumber(pageNumber)
                    .pdfPath(pdfPath)
                    .build());
        }
        return refs;
    }

    /**
     * Parse a 1-based page selection such as {@code 1-3,5} into sorted 0-based page numbers.
     */
    static List<Integer> parsePages(String selection, int pageCount) {
        TreeSet<Integer> selected = new TreeSet<>();
        if (selection == null || selection.isBlank()) {
            for (int i = 0; i < pageCount; i++) {
                selected.add(i);
            }
            return new ArrayList<>(selected);
        }

        for (String part : selection.split(",")) {
            String range = part.strip();
            if (range.isEmpty()) {
                continue;
            }
            int dash = range.indexOf('-');
            int from;
            int to;
            try {
                from = Integer.parseInt(dash < 0 ? range : range.substring(0, dash).strip());
                to = dash < 0 ? from : Integer.parseInt(range.substring(dash + 1).strip());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid page selection: " + range, e);
            }
            if (from < 1 || to > pageCount || from > to) {
                throw new IllegalArgumentException("Page selection " + range + " outside 1-" + pageCount);
            }
            for (int page = from; page <= to; page++) {
                selected.add(page - 1);
            }
        }
        return new ArrayList<>(selected);
    }

    public static void main(String[] args) {
        try {
            int exitCode = new CommandLine(new PlanIndexCLI())
                    .setCaseInsensitiveEnumValuesAllowed(true)
                    .execute(args);
            System.exit(exitCode);
        } finally {
            ExecutorProvider.shutdown();
        }
    }
}
