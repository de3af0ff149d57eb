package ai.docscanner.review.rule;

import java.util.List;
import java.util.Objects;

public record RuleRunResult(List<Issue> issues, List<RuleFailure> failures) {

    public RuleRunResult {
        issues = List.copyOf(Objects.requireNonNull(issues, "issues"));
        failures = List.copyOf(Objects.requireNonNull(failures, "failures"));
    }
}
