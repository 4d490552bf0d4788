package im.arun.planindex.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Reference to one page of a project. {@code pageNumber} is 0-based within the source PDF.
 */
@Value
@Builder
public class PageRef {
    UUID projectId;
    UUID pageId;
    int pageNumber;
    Path pdfPath;
    Path imagePath;
}
