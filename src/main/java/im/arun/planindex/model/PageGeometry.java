package im.arun.planindex.model;

import lombok.Value;

/**
 * Page size in PDF points (1/72 inch).
 */
@Value
public class PageGeometry {
    double widthPt;
    double heightPt;
}
