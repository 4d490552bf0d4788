package im.arun.planindex.token;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * Model-based text region detection on a page raster. Only consulted when the PDF yields
 * no vector text.
 */
public interface FallbackDetector {

    List<DetectedRegion> detect(UUID pageId, byte[] imageBytes) throws IOException;
}
