package im.arun.planindex.token;

import im.arun.planindex.model.TextToken;
import im.arun.planindex.model.TokenSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Unifies tokens from several sources. Tokens are ordered by source priority
 * (vector, model, ocr; stable within a source) and a token is dropped when it overlaps an
 * already kept token with IoU above the threshold and carries the same or contained text.
 */
public class TokenMerger {
    private static final Logger logger = LoggerFactory.getLogger(TokenMerger.class);

    private final double iouThreshold;

    public TokenMerger() {
        this(0.5);
    }

    public TokenMerger(double iouThreshold) {
        this.iouThreshold = iouThreshold;
    }

    @SafeVarargs
    public final List<TextToken> merge(List<TextToken>... tokenLists) {
        List<TextToken> all = new ArrayList<>();
        for (List<TextToken> tokens : tokenLists) {
            if (tokens != null) {
                all.addAll(tokens);
            }
        }
        if (all.isEmpty()) {
            return List.of();
        }

        all.sort(Comparator.comparingInt(t -> t.getSource().getPriority()));

        List<TextToken> merged = new ArrayList<>();
        for (TextToken token : all) {
            if (!isDuplicate(token, merged)) {
                merged.add(token);
            }
        }

        Map<TokenSource, Integer> bySource = new EnumMap<>(TokenSource.class);
        for (TextToken token : merged) {
            bySource.merge(token.getSource(), 1, Integer::sum);
        }
        logger.info("Merged {} tokens into {} (by source: {})", all.size(), merged.size(), bySource);

        return merged;
    }

    private boolean isDuplicate(TextToken token, List<TextToken> kept) {
        for (TextToken existing : kept) {
            if (token.getBbox().iou(existing.getBbox()) > iouThreshold
                    && textSimilar(token.getText(), existing.getText())) {
                return true;
            }
        }
        return false;
    }

    static boolean textSimilar(String first, String second) {
        String a = first.strip().toUpperCase(Locale.ROOT);
        String b = second.strip().toUpperCase(Locale.ROOT);
        return a.equals(b) || a.contains(b) || b.contains(a);
    }
}
