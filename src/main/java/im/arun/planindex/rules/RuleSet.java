package im.arun.planindex.rules;

import im.arun.planindex.config.PlanIndexConfig;
import im.arun.planindex.model.TextToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Validated, compiled view of a project's ordered rule payloads. Malformed payloads are
 * dropped here with a warning so that extraction can proceed with whatever remains.
 */
public final class RuleSet {
    private static final Logger logger = LoggerFactory.getLogger(RuleSet.class);

    private final List<DetectorEvaluator> detectors;
    private final List<ExclusionEvaluator> exclusions;
    private final PairingEvaluator pairing;
    private final List<MalformedRuleException> skipped;

    private RuleSet(List<DetectorEvaluator> detectors, List<ExclusionEvaluator> exclusions,
                    PairingEvaluator pairing, List<MalformedRuleException> skipped) {
        this.detectors = Collections.unmodifiableList(detectors);
        this.exclusions = Collections.unmodifiableList(exclusions);
        this.pairing = pairing;
        this.skipped = Collections.unmodifiableList(skipped);
    }

    public static RuleSet compile(List<? extends RulePayload> payloads) {
        return compile(payloads, new PlanIndexConfig());
    }

    public static RuleSet compile(List<? extends RulePayload> payloads, PlanIndexConfig config) {
        List<DetectorEvaluator> detectors = new ArrayList<>();
        List<ExclusionEvaluator> exclusions = new ArrayList<>();
        List<MalformedRuleException> skipped = new ArrayList<>();
        PairingEvaluator pairing = null;

        if (payloads != null) {
            for (RulePayload payload : payloads) {
                try {
                    if (payload instanceof TokenDetector) {
                        detectors.add(DetectorEvaluator.compile((TokenDetector) payload));
                    } else if (payload instanceof Pairing) {
                        // Later pairing payloads override earlier ones
                        pairing = PairingEvaluator.compile((Pairing) payload,
                                config.getMaxPairingDistancePx(), config.getRelationTolerancePx());
                    } else if (payload instanceof ExcludeRule) {
                        exclusions.add(ExclusionEvaluator.compile((ExcludeRule) payload));
                    } else if (payload == null) {
                        throw new MalformedRuleException("Null rule payload", null);
                    }
                } catch (MalformedRuleException e) {
                    logger.warn("Skipping malformed rule {}: {}", payload, e.getMessage());
                    skipped.add(e);
                }
            }
        }

        if (pairing == null) {
            pairing = PairingEvaluator.defaults(config.getMaxPairingDistancePx(), config.getRelationTolerancePx());
        }

        return new RuleSet(detectors, exclusions, pairing, skipped);
    }

    /**
     * Role of the first detector, in payload order, that matches the token.
     */
    public Optional<String> classify(TextToken token) {
        String text = token.strippedText();
        for (DetectorEvaluator detector : detectors) {
            if (detector.matches(text)) {
                return Optional.of(detector.getRole());
            }
        }
        return Optional.empty();
    }

    public Optional<String> exclusionReason(TextToken token) {
        String text = token.strippedText();
        for (ExclusionEvaluator exclusion : exclusions) {
            Optional<String> reason = exclusion.reasonFor(text);
            if (reason.isPresent()) {
                return reason;
            }
        }
        return Optional.empty();
    }

    public boolean hasDetectors() {
        return !detectors.isEmpty();
    }

    /**
     * True when the payloads declare a pairing rule, i.e. rooms are defined as name+number pairs.
     */
    public boolean hasPairingRule() {
        return pairing.isDeclared();
    }

    public PairingEvaluator getPairing() {
        return pairing;
    }

    public List<DetectorEvaluator> getDetectors() {
        return detectors;
    }

    public List<MalformedRuleException> getSkipped() {
        return skipped;
    }
}
