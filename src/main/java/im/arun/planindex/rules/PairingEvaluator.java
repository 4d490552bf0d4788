package im.arun.planindex.rules;

import im.arun.planindex.model.BoundingBox;

import java.util.OptionalDouble;

/**
 * Compiled form of a {@link Pairing}: decides whether a number box may pair with a name box.
 */
public final class PairingEvaluator {
    private final Pairing pairing;
    private final String nameRole;
    private final String numberRole;
    private final Relation relation;
    private final double maxDistancePx;
    private final double tolerancePx;

    public PairingEvaluator(Pairing pairing, String nameRole, String numberRole, Relation relation,
                            double maxDistancePx, double tolerancePx) {
        this.pairing = pairing;
        this.nameRole = nameRole;
        this.numberRole = numberRole;
        this.relation = relation;
        this.maxDistancePx = maxDistancePx;
        this.tolerancePx = tolerancePx;
    }

    public static PairingEvaluator compile(Pairing pairing, double defaultMaxDistancePx, double tolerancePx)
            throws MalformedRuleException {
        Relation relation = Relation.parse(pairing.getRelation());
        if (relation == null) {
            throw new MalformedRuleException("Unknown pairing relation '" + pairing.getRelation() + "'", pairing);
        }
        double maxDistance = defaultMaxDistancePx;
        if (pairing.getMaxDistancePx() != null) {
            if (pairing.getMaxDistancePx() <= 0) {
                throw new MalformedRuleException("Pairing max_distance_px must be positive", pairing);
            }
            maxDistance = pairing.getMaxDistancePx();
        }
        String nameRole = blankToDefault(pairing.getNameRole(), Pairing.DEFAULT_NAME_ROLE);
        String numberRole = blankToDefault(pairing.getNumberRole(), Pairing.DEFAULT_NUMBER_ROLE);
        return new PairingEvaluator(pairing, nameRole, numberRole, relation, maxDistance, tolerancePx);
    }

    /**
     * Pairing used when the rule set declares none: default roles, relation and distance.
     */
    public static PairingEvaluator defaults(double maxDistancePx, double tolerancePx) {
        return new PairingEvaluator(null, Pairing.DEFAULT_NAME_ROLE, Pairing.DEFAULT_NUMBER_ROLE,
                Relation.BELOW, maxDistancePx, tolerancePx);
    }

    /**
     * @return the centre distance if the candidate is acceptable, empty otherwise
     */
    public OptionalDouble acceptDistance(BoundingBox name, BoundingBox candidate) {
        double distance = name.centerDistance(candidate);
        if (distance > maxDistancePx || !relation.accepts(name, candidate, tolerancePx)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(distance);
    }

    public boolean isDeclared() {
        return pairing != null;
    }

    public String getNameRole() {
        return nameRole;
    }

    public String getNumberRole() {
        return numberRole;
    }

    public Relation getRelation() {
        return relation;
    }

    public double getMaxDistancePx() {
        return maxDistancePx;
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.strip();
    }
}
