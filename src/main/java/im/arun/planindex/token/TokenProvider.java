package im.arun.planindex.token;

import im.arun.planindex.model.PageRasterSpec;
import im.arun.planindex.model.PageRef;
import im.arun.planindex.model.TextToken;

import java.util.List;

/**
 * Extracts text tokens for a page from one source, in the page's pixel space.
 * Implementations return an empty list when their source is unavailable; they do not throw.
 */
public interface TokenProvider {

    /**
     * @param raster target pixel space; {@code null} lets the provider derive one
     */
    List<TextToken> getTokens(PageRef page, PageRasterSpec raster);
}
