package im.arun.planindex.token;

import im.arun.planindex.model.BoundingBox;
import im.arun.planindex.model.PageRasterSpec;
import im.arun.planindex.model.PageRef;
import im.arun.planindex.model.TextToken;
import im.arun.planindex.model.TokenSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Wraps a {@link FallbackDetector} as a token source. Regions are already in raster pixels.
 */
public class ModelTokenProvider implements TokenProvider {
    private static final Logger logger = LoggerFactory.getLogger(ModelTokenProvider.class);

    private final FallbackDetector detector;
    private final PageStorage storage;

    public ModelTokenProvider(FallbackDetector detector, PageStorage storage) {
        this.detector = detector;
        this.storage = storage;
    }

    @Override
    public List<TextToken> getTokens(PageRef page, PageRasterSpec raster) {
        byte[] imageBytes;
        try {
            imageBytes = storage.readPageBytes(page);
        } catch (SourceUnavailableException e) {
            logger.warn("Page image unavailable for {}: {}", page.getPageId(), e.getMessage());
            return List.of();
        }

        List<DetectedRegion> regions;
        try {
            regions = detector.detect(page.getPageId(), imageBytes);
        } catch (IOException | RuntimeException e) {
            logger.error("Fallback detection failed for page {}: {}", page.getPageId(), e.getMessage());
            return List.of();
        }

        List<TextToken> tokens = new ArrayList<>();
        for (DetectedRegion region : regions) {
            TextToken token = toToken(page, region);
            if (token != null) {
                tokens.add(token);
            }
        }

        logger.info("Extracted {} model tokens for page {}", tokens.size(), page.getPageId());
        return tokens;
    }

    private TextToken toToken(PageRef page, DetectedRegion region) {
        if (region.getText() == null || region.getText().isBlank()) {
            return null;
        }
        try {
            double confidence = region.getConfidence() != null ? region.getConfidence() : 0.5;
            return TextToken.builder()
                    .text(region.getText().strip())
                    .bbox(BoundingBox.fromList(region.getBbox()))
                    .confidence(Math.max(0.0, Math.min(1.0, confidence)))
                    .source(TokenSource.MODEL)
                    .pageId(page.getPageId())
                    .build();
        } catch (IllegalArgumentException e) {
            logger.warn("Skipping detected region '{}' on page {}: {}", region.getText(), page.getPageId(), e.getMessage());
            return null;
        }
    }
}
