package im.arun.planindex.model;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Target pixel space of a rasterized page. Every token coordinate lives in this space.
 */
@Value
@AllArgsConstructor
public class PageRasterSpec {
    public static final int DEFAULT_DPI = 150;

    int widthPx;
    int heightPx;
    int dpi;
    int rotation;

    public PageRasterSpec(int widthPx, int heightPx) {
        this(widthPx, heightPx, DEFAULT_DPI, 0);
    }

    /**
     * Raster spec derived from the PDF page size at the given resolution.
     */
    public static PageRasterSpec forPage(PageGeometry geometry, int dpi) {
        int width = (int) (geometry.getWidthPt() * dpi / 72);
        int height = (int) (geometry.getHeightPt() * dpi / 72);
        return new PageRasterSpec(width, height, dpi, 0);
    }
}
