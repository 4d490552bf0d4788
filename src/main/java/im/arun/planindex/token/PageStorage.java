package im.arun.planindex.token;

import im.arun.planindex.model.PageGeometry;
import im.arun.planindex.model.PageRef;

import java.nio.file.Path;

/**
 * Access to stored page artifacts. Implemented by the application's storage layer.
 */
public interface PageStorage {

    /**
     * @return the stored raster (PNG) bytes of the page
     */
    byte[] readPageBytes(PageRef page) throws SourceUnavailableException;

    /**
     * @param pageNumber 0-based page number
     * @return displayed page size in points, rotation applied
     */
    PageGeometry pdfPageGeometry(Path pdf, int pageNumber) throws SourceUnavailableException;
}
