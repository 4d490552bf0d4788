package im.arun.planindex.rules;

import im.arun.planindex.model.BoundingBox;

import java.util.Locale;

/**
 * Spatial relation of a number token to its name token. Each direction compares the
 * leading edges on one axis, allowing {@code tolerance} pixels of overlap the wrong way.
 */
public enum Relation {
    BELOW {
        @Override
        public boolean accepts(BoundingBox name, BoundingBox candidate, double tolerance) {
            return candidate.getY() >= name.getY() - tolerance;
        }
    },
    ABOVE {
        @Override
        public boolean accepts(BoundingBox name, BoundingBox candidate, double tolerance) {
            return candidate.getY() <= name.getY() + tolerance;
        }
    },
    RIGHT {
        @Override
        public boolean accepts(BoundingBox name, BoundingBox candidate, double tolerance) {
            return candidate.getX() >= name.getX() - tolerance;
        }
    },
    LEFT {
        @Override
        public boolean accepts(BoundingBox name, BoundingBox candidate, double tolerance) {
            return candidate.getX() <= name.getX() + tolerance;
        }
    },
    NEAREST {
        @Override
        public boolean accepts(BoundingBox name, BoundingBox candidate, double tolerance) {
            return true;
        }
    };

    public abstract boolean accepts(BoundingBox name, BoundingBox candidate, double tolerance);

    /**
     * @return the relation, or {@code null} if the value is not a known relation
     */
    public static Relation parse(String value) {
        if (value == null || value.isBlank()) {
            return BELOW;
        }
        String normalized = value.strip().toUpperCase(Locale.ROOT);
        if ("RIGHT_OF".equals(normalized)) {
            return RIGHT;
        }
        if ("LEFT_OF".equals(normalized)) {
            return LEFT;
        }
        for (Relation relation : values()) {
            if (relation.name().equals(normalized)) {
                return relation;
            }
        }
        return null;
    }
}
