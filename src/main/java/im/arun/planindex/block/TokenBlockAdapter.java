package im.arun.planindex.block;

import im.arun.planindex.model.BoundingBox;
import im.arun.planindex.model.SyntheticBlock;
import im.arun.planindex.model.TextToken;
import im.arun.planindex.rules.PairingEvaluator;
import im.arun.planindex.rules.RulePayload;
import im.arun.planindex.rules.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * Groups word-level tokens into labeled blocks.
 *
 * <p>Tokens are classified by the rule set's detectors. Name candidates are then visited in
 * reading order and each takes the nearest unconsumed number candidate that satisfies the
 * pairing relation within the maximum distance. A consumed number is never re-paired, so the
 * output depends only on the input tokens and rules. Names left without a number still
 * produce a name-only block; whether that block becomes a room is decided during assembly.
 * Numbers left without a name produce number-only blocks carrying the number role.
 *
 * <p>Tokens whose role is neither the name nor the number role (for example
 * {@code door_number}) become single-token blocks carrying their role.
 */
public class TokenBlockAdapter {
    private static final Logger logger = LoggerFactory.getLogger(TokenBlockAdapter.class);

    static final Comparator<TextToken> READING_ORDER = Comparator
            .comparingInt((TextToken t) -> t.getBbox().getY())
            .thenComparingInt(t -> t.getBbox().getX());

    public BlockResult createBlocks(List<TextToken> tokens, List<? extends RulePayload> payloads) {
        return createBlocks(tokens, RuleSet.compile(payloads), null);
    }

    public BlockResult createBlocks(List<TextToken> tokens, RuleSet rules) {
        return createBlocks(tokens, rules, null);
    }

    public BlockResult createBlocks(List<TextToken> tokens, RuleSet rules, UUID pageId) {
        AdapterMetrics metrics = new AdapterMetrics();
        metrics.setTokensInput(tokens.size());

        if (!rules.hasDetectors()) {
            logger.info("No token detectors for page {}, {} tokens ignored", pageId, tokens.size());
            return new BlockResult(List.of(), metrics);
        }

        PairingEvaluator pairing = rules.getPairing();
        List<TextToken> names = new ArrayList<>();
        List<TextToken> numbers = new ArrayList<>();
        List<RoleToken> others = new ArrayList<>();

        // Step 1: classify
        for (TextToken token : tokens) {
            Optional<String> role = rules.classify(token);
            if (role.isEmpty()) {
                continue;
            }
            String r = role.get();
            if (r.equals(pairing.getNameRole())) {
                Optional<String> excluded = rules.exclusionReason(token);
                if (excluded.isPresent()) {
                    metrics.recordExclusion(excluded.get());
                    logger.debug("Token '{}' excluded on page {}: {}", token.getText(), pageId, excluded.get());
                } else {
                    names.add(token);
                }
            } else if (r.equals(pairing.getNumberRole())) {
                numbers.add(token);
            } else {
                others.add(new RoleToken(r, token));
            }
        }

        names.sort(READING_ORDER);
        numbers.sort(READING_ORDER);
        metrics.setNameTokens(names.size());
        metrics.setNumberTokens(numbers.size());
        metrics.setOtherRoleTokens(others.size());

        logger.info("Page {}: {} name tokens, {} number tokens, {} excluded",
                pageId, names.size(), numbers.size(), metrics.getExcludedByRule());

        // Step 2: greedy nearest-neighbour pairing
        List<SyntheticBlock> blocks = new ArrayList<>();
        boolean[] consumed = new boolean[numbers.size()];

        for (TextToken name : names) {
            int bestIndex = -1;
            double bestDistance = Double.POSITIVE_INFINITY;

            for (int i = 0; i < numbers.size(); i++) {
                if (consumed[i]) {
                    continue;
                }
                OptionalDouble distance = pairing.acceptDistance(name.getBbox(), numbers.get(i).getBbox());
                if (distance.isPresent() && distance.getAsDouble() < bestDistance) {
                    bestDistance = distance.getAsDouble();
                    bestIndex = i;
                }
            }

            if (bestIndex >= 0) {
                consumed[bestIndex] = true;
                TextToken number = numbers.get(bestIndex);
                blocks.add(pairedBlock(pairing.getNameRole(), name, number));
                metrics.setPairedWithNumber(metrics.getPairedWithNumber() + 1);
                logger.debug("Paired '{}' with '{}' at {}px", name.getText(), number.getText(),
                        Math.round(bestDistance));
            } else {
                blocks.add(singleBlock(pairing.getNameRole(), name, true));
                metrics.setNameOnlyNoNumber(metrics.getNameOnlyNoNumber() + 1);
                logger.debug("Name '{}' has no number within {}px", name.getText(), pairing.getMaxDistancePx());
            }
        }

        for (int i = 0; i < numbers.size(); i++) {
            if (!consumed[i]) {
                blocks.add(singleBlock(pairing.getNumberRole(), numbers.get(i), false));
                metrics.setNumberOnlyNoName(metrics.getNumberOnlyNoName() + 1);
            }
        }

        others.sort((a, b) -> READING_ORDER.compare(a.token, b.token));
        for (RoleToken other : others) {
            blocks.add(singleBlock(other.role, other.token, false));
        }

        metrics.setBlocksCreated(blocks.size());
        logger.info("Page {}: {} blocks ({} paired, {} name-only, {} number-only), ratio {}",
                pageId, blocks.size(), metrics.getPairedWithNumber(), metrics.getNameOnlyNoNumber(),
                metrics.getNumberOnlyNoName(),
                String.format("%.3f", metrics.getRoomsWithNumberRatio()));

        return new BlockResult(blocks, metrics);
    }

    private SyntheticBlock pairedBlock(String role, TextToken name, TextToken number) {
        BoundingBox union = name.getBbox().union(number.getBbox());
        return SyntheticBlock.builder()
                .bbox(union)
                .text(name.getText() + "\n" + number.getText())
                .role(role)
                .nameValue(name.strippedText())
                .numberValue(number.strippedText())
                .confidence(Math.min(name.getConfidence(), number.getConfidence()))
                .sourceText(name.getText())
                .sourceText(number.getText())
                .build();
    }

    private SyntheticBlock singleBlock(String role, TextToken token, boolean isName) {
        return SyntheticBlock.builder()
                .bbox(token.getBbox())
                .text(token.getText())
                .role(role)
                .nameValue(isName ? token.strippedText() : null)
                .numberValue(isName ? null : token.strippedText())
                .confidence(token.getConfidence())
                .sourceText(token.getText())
                .build();
    }

    private static final class RoleToken {
        final String role;
        final TextToken token;

        RoleToken(String role, TextToken token) {
            this.role = role;
            this.token = token;
        }
    }
}
