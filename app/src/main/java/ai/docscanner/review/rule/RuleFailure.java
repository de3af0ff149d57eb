package ai.docscanner.review.rule;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Records a rule invocation that produced no issues because it failed.
 */
public record RuleFailure(String ruleId,
                          IssueScope scope,
                          OptionalInt sentenceIndex,
                          FailureReason reason,
                          String detail) {

    public RuleFailure {
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(sentenceIndex, "sentenceIndex");
        Objects.requireNonNull(reason, "reason");
        detail = detail == null ? "" : detail;
    }
}
