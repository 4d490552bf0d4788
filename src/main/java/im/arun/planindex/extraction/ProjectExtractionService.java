package im.arun.planindex.extraction;

import im.arun.planindex.config.PlanIndexConfig;
import im.arun.planindex.index.IndexBuilder;
import im.arun.planindex.index.ObjectRepository;
import im.arun.planindex.index.ProjectIndex;
import im.arun.planindex.model.ExtractedObject;
import im.arun.planindex.model.ExtractionPolicy;
import im.arun.planindex.model.ObjectType;
import im.arun.planindex.model.PageRasterSpec;
import im.arun.planindex.model.PageRef;
import im.arun.planindex.rules.RulePayload;
import im.arun.planindex.rules.RuleSet;
import im.arun.planindex.util.ExecutorProvider;
import im.arun.planindex.util.ExtractionRunLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Extracts every page of a project concurrently, stores the objects per page and rebuilds the
 * project index. Runs for the same project must not overlap; the index is rebuilt by a single
 * writer at the end of each run.
 */
public class ProjectExtractionService {
    private static final Logger logger = LoggerFactory.getLogger(ProjectExtractionService.class);

    private final PageExtractor pageExtractor;
    private final ObjectRepository repository;
    private final IndexBuilder indexBuilder;
    private final PlanIndexConfig config;
    private final ExecutorService executor;

    public ProjectExtractionService(PageExtractor pageExtractor, ObjectRepository repository, PlanIndexConfig config) {
        this(pageExtractor, repository, new IndexBuilder(), config, ExecutorProvider.getExecutor());
    }

    public ProjectExtractionService(PageExtractor pageExtractor, ObjectRepository repository,
                                    IndexBuilder indexBuilder, PlanIndexConfig config, ExecutorService executor) {
        this.pageExtractor = pageExtractor;
        this.repository = repository;
        this.indexBuilder = indexBuilder;
        this.config = config;
        this.executor = executor;
    }

    public ExtractionReport run(UUID projectId, List<PageRef> pages, List<? extends RulePayload> payloads,
                                ExtractionPolicy policy) {
        return run(projectId, pages, null, payloads, policy);
    }

    public ExtractionReport run(UUID projectId, List<PageRef> pages, PageRasterSpec raster,
                                List<? extends RulePayload> payloads, ExtractionPolicy policy) {
        ExtractionRunLog runLog = config.isWriteRunLog() ? new ExtractionRunLog(projectId) : null;
        RuleSet rules = RuleSet.compile(payloads, config);
        logger.info("Extracting {} pages for project {} ({} policy, {} rules skipped)",
                pages.size(), projectId, policy.getValue(), rules.getSkipped().size());
        if (runLog != null) {
            runLog.event("run_started", Map.of("pages", pages.size(), "policy", policy.getValue(),
                    "rules_skipped", rules.getSkipped().size()));
        }

        List<CompletableFuture<PageExtraction>> futures = pages.stream()
                .map(page -> CompletableFuture.supplyAsync(() ->
                        pageExtractor.extractPage(page, raster, rules, policy), executor)
                        .exceptionally(e -> PageExtraction.failed(page.getPageId(), e.getMessage())))
                .collect(Collectors.toList());

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<PageExtraction> results = futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());

        ExtractionReport.ExtractionReportBuilder report = ExtractionReport.builder()
                .projectId(projectId)
                .policy(policy.getValue())
                .pagesProcessed(results.size())
                .rulesSkipped(rules.getSkipped().size());
        DropReasons dropReasons = new DropReasons();
        int rooms = 0;
        int doors = 0;

        for (PageExtraction result : results) {
            report.page(result);
            if (result.isFailed()) {
                report.failedPage(result.getPageId());
                if (runLog != null) {
                    runLog.warn("page_failed", result.getPageId() + ": " + result.getError());
                }
                continue;
            }
            repository.savePageObjects(projectId, result.getPageId(), result.getObjects());
            dropReasons.addAll(result.getDropReasons());
            for (ExtractedObject object : result.getObjects()) {
                if (object.getType() == ObjectType.ROOM) {
                    rooms++;
                } else if (object.getType() == ObjectType.DOOR) {
                    doors++;
                }
            }
            if (runLog != null) {
                Map<String, Object> fields = new LinkedHashMap<>();
                fields.put("page_id", result.getPageId());
                fields.put("token_sources", result.getTokenSources());
                fields.put("objects", result.getObjects().size());
                fields.put("adapter_metrics", result.getAdapterMetrics());
                fields.put("drop_reasons", result.getDropReasons());
                runLog.event("page_extracted", fields);
            }
        }

        ProjectIndex index = indexBuilder.build(projectId, repository.findByProject(projectId));
        repository.saveIndex(index);

        ExtractionReport built = report
                .roomsExtracted(rooms)
                .doorsExtracted(doors)
                .dropReasons(dropReasons.asMap())
                .build();
        logger.info("Project {}: {} rooms, {} doors, {} failed pages, drops {}",
                projectId, rooms, doors, built.getFailedPages().size(), built.getDropReasons());
        if (runLog != null) {
            runLog.event("run_completed", Map.of("rooms", rooms, "doors", doors,
                    "failed_pages", built.getFailedPages().size(), "drop_reasons", built.getDropReasons()));
        }
        return built;
    }
}
