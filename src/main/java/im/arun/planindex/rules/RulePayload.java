package im.arun.planindex.rules;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Machine-executable matching rule supplied per project by the guide negotiation.
 * The set of variants is closed; each has exactly one evaluator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TokenDetector.class, name = "token_detector"),
    @JsonSubTypes.Type(value = Pairing.class, name = "pairing"),
    @JsonSubTypes.Type(value = ExcludeRule.class, name = "exclude")
})
public sealed interface RulePayload permits TokenDetector, Pairing, ExcludeRule {
}
