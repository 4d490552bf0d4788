package im.arun.planindex.extraction;

import im.arun.planindex.block.BlockResult;
import im.arun.planindex.block.TokenBlockAdapter;
import im.arun.planindex.config.PlanIndexConfig;
import im.arun.planindex.id.ObjectIdGenerator;
import im.arun.planindex.model.ExtractedObject;
import im.arun.planindex.model.ExtractionPolicy;
import im.arun.planindex.model.PageRasterSpec;
import im.arun.planindex.model.PageRef;
import im.arun.planindex.model.TextToken;
import im.arun.planindex.rules.RulePayload;
import im.arun.planindex.rules.RuleSet;
import im.arun.planindex.token.TokenService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs one page through tokens, blocks and assembly. Never throws: any failure is logged and
 * reported as an empty, failed {@link PageExtraction}.
 */
public class PageExtractor {
    private static final Logger logger = LoggerFactory.getLogger(PageExtractor.class);

    private final TokenService tokenService;
    private final TokenBlockAdapter blockAdapter;
    private final RoomAssembler roomAssembler;
    private final DoorAssembler doorAssembler;
    private final PlanIndexConfig config;

    public PageExtractor(TokenService tokenService, PlanIndexConfig config) {
        this(tokenService, new TokenBlockAdapter(), new ObjectIdGenerator(config.getBucketSizePx()), config);
    }

    private PageExtractor(TokenService tokenService, TokenBlockAdapter blockAdapter,
                          ObjectIdGenerator idGenerator, PlanIndexConfig config) {
        this(tokenService, blockAdapter,
                new RoomAssembler(idGenerator, config.getPairedConfidenceBoost()),
                new DoorAssembler(idGenerator), config);
    }

    public PageExtractor(TokenService tokenService, TokenBlockAdapter blockAdapter,
                         RoomAssembler roomAssembler, DoorAssembler doorAssembler, PlanIndexConfig config) {
        this.tokenService = tokenService;
        this.blockAdapter = blockAdapter;
        this.roomAssembler = roomAssembler;
        this.doorAssembler = doorAssembler;
        this.config = config;
    }

    public PageExtraction extractPage(PageRef page, List<? extends RulePayload> payloads, ExtractionPolicy policy) {
        return extractPage(page, null, RuleSet.compile(payloads, config), policy);
    }

    public PageExtraction extractPage(PageRef page, PageRasterSpec raster, RuleSet rules, ExtractionPolicy policy) {
        UUID pageId = page.getPageId();
        try {
            List<TextToken> tokens = tokenService.getTokensForPage(page, raster);
            Map<String, Integer> tokenSources = new LinkedHashMap<>();
            for (TextToken token : tokens) {
                tokenSources.merge(token.getSource().getValue(), 1, Integer::sum);
            }

            BlockResult blockResult = blockAdapter.createBlocks(tokens, rules, pageId);

            DropReasons dropReasons = new DropReasons();
            List<ExtractedObject> objects = new ArrayList<>();
            objects.addAll(roomAssembler.assemble(pageId, blockResult.getBlocks(), rules, policy, dropReasons));
            objects.addAll(doorAssembler.assemble(pageId, blockResult.getBlocks(), policy, dropReasons));

            logger.info("Page {} ({}): {} tokens, {} objects, drops {}",
                    pageId, page.getPageNumber(), tokens.size(), objects.size(), dropReasons.asMap());

            return PageExtraction.builder()
                    .pageId(pageId)
                    .tokenSources(tokenSources)
                    .objects(objects)
                    .adapterMetrics(blockResult.getMetrics())
                    .dropReasons(dropReasons.asMap())
                    .build();
        } catch (Exception e) {
            logger.error("Extraction failed for page {}: {}", pageId, e.getMessage(), e);
            return PageExtraction.failed(pageId, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
