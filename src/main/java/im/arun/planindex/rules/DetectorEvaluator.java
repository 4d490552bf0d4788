package im.arun.planindex.rules;

import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled form of a {@link TokenDetector}. Contains no project vocabulary: everything it
 * knows comes from the payload.
 */
public final class DetectorEvaluator {
    private final String role;
    private final Pattern pattern;
    private final int minLength;

    private DetectorEvaluator(String role, Pattern pattern, int minLength) {
        this.role = role;
        this.pattern = pattern;
        this.minLength = minLength;
    }

    public static DetectorEvaluator compile(TokenDetector detector) throws MalformedRuleException {
        if (detector.getRole() == null || detector.getRole().isBlank()) {
            throw new MalformedRuleException("Token detector has no role", detector);
        }
        String method = detector.getMethod() == null ? "" : detector.getMethod().strip().toLowerCase(Locale.ROOT);
        String role = detector.getRole().strip();

        switch (method) {
            case TokenDetector.METHOD_REGEX:
                if (detector.getPattern() == null || detector.getPattern().isEmpty()) {
                    throw new MalformedRuleException("Regex detector for role " + role + " has no pattern", detector);
                }
                try {
                    Pattern compiled = Pattern.compile(detector.getPattern(),
                            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
                    return new DetectorEvaluator(role, compiled, 0);
                } catch (PatternSyntaxException e) {
                    throw new MalformedRuleException("Invalid regex for role " + role + ": " + e.getDescription(),
                            detector, e);
                }
            case TokenDetector.METHOD_LENGTH:
                if (detector.getMinLength() == null || detector.getMinLength() < 1) {
                    throw new MalformedRuleException("Length detector for role " + role + " needs min_length >= 1",
                            detector);
                }
                return new DetectorEvaluator(role, null, detector.getMinLength());
            default:
                throw new MalformedRuleException("Unknown detection method '" + detector.getMethod() + "'", detector);
        }
    }

    boolean matches(String strippedText) {
        if (pattern != null) {
            return pattern.matcher(strippedText).matches();
        }
        if (strippedText.length() < minLength) {
            return false;
        }
        return !isNameRole(role) || isUpperCaseWord(strippedText);
    }

    public String getRole() {
        return role;
    }

    /**
     * Name-type roles ({@code room_name}, {@code space_name}...) get the upper-case word check.
     */
    static boolean isNameRole(String role) {
        return role.toLowerCase(Locale.ROOT).endsWith("name");
    }

    static boolean isUpperCaseWord(String text) {
        boolean hasUpper = false;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            if (!Character.isLetter(cp) || Character.isLowerCase(cp)) {
                return false;
            }
            if (Character.isUpperCase(cp)) {
                hasUpper = true;
            }
            i += Character.charCount(cp);
        }
        return hasUpper;
    }
}
