package im.arun.planindex.id;

import im.arun.planindex.model.BoundingBox;
import im.arun.planindex.model.ObjectType;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.UUID;

/**
 * Content-addressed identifiers for extracted objects.
 *
 * <p>The id is a pure function of page, type, normalized label, bucketed box corners and an
 * optional qualifier. Re-extracting the same object yields the same id, so results can be
 * upserted without an allocator. Box corners are floored to a coarse grid, so rendering
 * jitter that keeps every corner within its grid cell does not change the id. A corner that
 * crosses a grid line (149 to 151 with the default 50 px cells) yields a different id.
 */
public class ObjectIdGenerator {
    public static final int DEFAULT_BUCKET_SIZE = 50;
    private static final int ID_BYTES = 8;

    private final int bucketSize;

    public ObjectIdGenerator() {
        this(DEFAULT_BUCKET_SIZE);
    }

    public ObjectIdGenerator(int bucketSize) {
        if (bucketSize <= 0) {
            throw new IllegalArgumentException("Bucket size must be positive: " + bucketSize);
        }
        this.bucketSize = bucketSize;
    }

    /**
     * Lower-case, drop everything that is neither a letter, digit nor whitespace,
     * then trim and collapse whitespace.
     */
    public static String normalizeLabel(String label) {
        if (label == null || label.isEmpty()) {
            return "";
        }
        String lower = label.toLowerCase(Locale.ROOT).strip();
        StringBuilder kept = new StringBuilder(lower.length());
        lower.codePoints()
                .filter(cp -> Character.isLetterOrDigit(cp) || Character.isWhitespace(cp))
                .forEach(kept::appendCodePoint);
        return String.join(" ", kept.toString().strip().split("\\s+"));
    }

    public int bucket(int value) {
        return Math.floorDiv(value, bucketSize) * bucketSize;
    }

    /**
     * Bucketed corners rendered as {@code (x1, y1, x2, y2)}.
     */
    String bucketedCorners(BoundingBox bbox) {
        int[] corners = bbox.corners();
        return "(" + bucket(corners[0]) + ", " + bucket(corners[1]) + ", "
                + bucket(corners[2]) + ", " + bucket(corners[3]) + ")";
    }

    public String generate(UUID pageId, ObjectType type, String label, BoundingBox bbox, String qualifier) {
        StringBuilder input = new StringBuilder()
                .append(pageId)
                .append('|').append(type.getValue())
                .append('|').append(normalizeLabel(label))
                .append('|').append(bucketedCorners(bbox));
        if (qualifier != null && !qualifier.isEmpty()) {
            input.append('|').append(qualifier);
        }

        byte[] digest = sha256(input.toString());
        return type.getValue() + "_" + HexFormat.of().formatHex(digest, 0, ID_BYTES);
    }

    public String generateRoomId(UUID pageId, String label, BoundingBox bbox, String roomNumber) {
        return generate(pageId, ObjectType.ROOM, label, bbox, roomNumber);
    }

    public String generateDoorId(UUID pageId, String label, BoundingBox bbox, String doorNumber) {
        return generate(pageId, ObjectType.DOOR, label, bbox, doorNumber);
    }

    public String generateScheduleId(UUID pageId, String label, BoundingBox bbox, String scheduleType) {
        return generate(pageId, ObjectType.SCHEDULE_TABLE, label, bbox, scheduleType);
    }

    private static byte[] sha256(String input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
