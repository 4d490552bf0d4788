package im.arun.planindex.rules;

import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled form of an {@link ExcludeRule}.
 */
public final class ExclusionEvaluator {
    static final String DEFAULT_REASON = "excluded_by_pattern";

    private final Pattern pattern;
    private final String reason;

    private ExclusionEvaluator(Pattern pattern, String reason) {
        this.pattern = pattern;
        this.reason = reason;
    }

    public static ExclusionEvaluator compile(ExcludeRule rule) throws MalformedRuleException {
        if (rule.getPattern() == null || rule.getPattern().isEmpty()) {
            throw new MalformedRuleException("Exclude rule has no pattern", rule);
        }
        try {
            Pattern compiled = Pattern.compile(rule.getPattern(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            String reason = rule.getReason() == null || rule.getReason().isBlank() ? DEFAULT_REASON : rule.getReason();
            return new ExclusionEvaluator(compiled, reason);
        } catch (PatternSyntaxException e) {
            throw new MalformedRuleException("Invalid exclude regex: " + e.getDescription(), rule, e);
        }
    }

    public Optional<String> reasonFor(String strippedText) {
        return pattern.matcher(strippedText).matches() ? Optional.of(reason) : Optional.empty();
    }
}
