package im.arun.planindex.rules;

/**
 * A rule payload that cannot be evaluated (bad regex, missing fields, unknown method).
 * Callers skip the rule and keep going.
 */
public class MalformedRuleException extends Exception {

    private final transient RulePayload payload;

    public MalformedRuleException(String message, RulePayload payload) {
        super(message);
        this.payload = payload;
    }

    public MalformedRuleException(String message, RulePayload payload, Throwable cause) {
        super(message, cause);
        this.payload = payload;
    }

    public RulePayload getPayload() {
        return payload;
    }
}
