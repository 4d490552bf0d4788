package im.arun.planindex.token;

import im.arun.planindex.model.PageRasterSpec;
import im.arun.planindex.model.PageRef;
import im.arun.planindex.model.TextToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point for page tokens. Vector text has strict priority: when the PDF yields any
 * token the fallback provider is never called. Results are not blended across sources.
 *
 * <p>The chosen source still goes through the {@link TokenMerger}. Detectors can report the
 * same word twice with overlapping boxes, and PDFs can draw a label twice (fill and outline
 * layers), so repeats within one source are collapsed before pairing sees them.
 */
public class TokenService {
    private static final Logger logger = LoggerFactory.getLogger(TokenService.class);

    private final TokenProvider vectorProvider;
    private final TokenProvider fallbackProvider;
    private final TokenMerger merger;

    /**
     * @param fallbackProvider may be {@code null} when no fallback is configured
     */
    public TokenService(TokenProvider vectorProvider, TokenProvider fallbackProvider, TokenMerger merger) {
        this.vectorProvider = vectorProvider;
        this.fallbackProvider = fallbackProvider;
        this.merger = merger;
    }

    public List<TextToken> getTokensForPage(PageRef page) {
        return getTokensForPage(page, null);
    }

    public List<TextToken> getTokensForPage(PageRef page, PageRasterSpec raster) {
        List<TextToken> vectorTokens = vectorProvider.getTokens(page, raster);
        if (!vectorTokens.isEmpty()) {
            logger.info("Page {}: {} vector tokens, fallback skipped", page.getPageId(), vectorTokens.size());
            return merger.merge(vectorTokens);
        }

        if (fallbackProvider != null) {
            List<TextToken> fallbackTokens = fallbackProvider.getTokens(page, raster);
            if (!fallbackTokens.isEmpty()) {
                logger.info("Page {}: {} fallback tokens", page.getPageId(), fallbackTokens.size());
                return merger.merge(fallbackTokens);
            }
        }

        logger.warn("No tokens found for page {} (pdf tried: {}, fallback tried: {})",
                page.getPageId(), page.getPdfPath() != null, fallbackProvider != null);
        return List.of();
    }
}
