package im.arun.planindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.util.List;

/**
 * Axis-aligned rectangle in page-pixel space with the origin in the top-left corner.
 * Serialized as {@code [x, y, width, height]}.
 */
@Value
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"x", "y", "width", "height"})
public class BoundingBox {
    int x;
    int y;
    int width;
    int height;

    @JsonCreator
    public BoundingBox(@JsonProperty("x") int x,
                       @JsonProperty("y") int y,
                       @JsonProperty("width") int width,
                       @JsonProperty("height") int height) {
        if (width <= 0) {
            throw new IllegalArgumentException("Bounding box width must be positive: " + width);
        }
        if (height <= 0) {
            throw new IllegalArgumentException("Bounding box height must be positive: " + height);
        }
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public static BoundingBox of(int x, int y, int width, int height) {
        return new BoundingBox(x, y, width, height);
    }

    /**
     * Build a box from a {@code [x, y, width, height]} list as produced by detectors.
     */
    public static BoundingBox fromList(List<? extends Number> values) {
        if (values == null || values.size() != 4) {
            throw new IllegalArgumentException("Bounding box needs exactly 4 values, got " + values);
        }
        return new BoundingBox(values.get(0).intValue(), values.get(1).intValue(),
                values.get(2).intValue(), values.get(3).intValue());
    }

    public int right() {
        return x + width;
    }

    public int bottom() {
        return y + height;
    }

    public double centerX() {
        return x + width / 2.0;
    }

    public double centerY() {
        return y + height / 2.0;
    }

    /**
     * Corner form {@code (x1, y1, x2, y2)}.
     */
    public int[] corners() {
        return new int[]{x, y, right(), bottom()};
    }

    public double centerDistance(BoundingBox other) {
        double dx = centerX() - other.centerX();
        double dy = centerY() - other.centerY();
        return Math.sqrt(dx * dx + dy * dy);
    }

    public BoundingBox union(BoundingBox other) {
        int minX = Math.min(x, other.x);
        int minY = Math.min(y, other.y);
        int maxX = Math.max(right(), other.right());
        int maxY = Math.max(bottom(), other.bottom());
        return new BoundingBox(minX, minY, maxX - minX, maxY - minY);
    }

    /**
     * Intersection over union; 0.0 when the boxes do not overlap.
     */
    public double iou(BoundingBox other) {
        int xi = Math.max(x, other.x);
        int yi = Math.max(y, other.y);
        int xiMax = Math.min(right(), other.right());
        int yiMax = Math.min(bottom(), other.bottom());

        if (xi >= xiMax || yi >= yiMax) {
            return 0.0;
        }

        long intersection = (long) (xiMax - xi) * (yiMax - yi);
        long union = (long) width * height + (long) other.width * other.height - intersection;
        if (union <= 0) {
            return 0.0;
        }
        return (double) intersection / union;
    }

    @Override
    public String toString() {
        return "[" + x + ", " + y + ", " + width + ", " + height + "]";
    }
}
