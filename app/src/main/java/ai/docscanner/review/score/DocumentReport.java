package ai.docscanner.review.score;

import ai.docscanner.review.rule.Issue;
import ai.docscanner.review.rule.RuleFailure;
import java.util.List;
import java.util.Objects;

/**
 * Result of one analysis run. Recomputed from scratch on every run and never mutated. {@code content} is the
 * normalized body markup the sentence fragments were cut from, for display next to the findings.
 */
public record DocumentReport(List<SentenceReport> sentences,
                             List<Issue> unassigned,
                             ReportSummary summary,
                             List<RuleFailure> ruleFailures,
                             String content) {

    public DocumentReport {
        sentences = List.copyOf(Objects.requireNonNull(sentences, "sentences"));
        unassigned = List.copyOf(Objects.requireNonNull(unassigned, "unassigned"));
        Objects.requireNonNull(summary, "summary");
        ruleFailures = List.copyOf(Objects.requireNonNull(ruleFailures, "ruleFailures"));
        content = content == null ? "" : content;
    }

    public boolean hasRuleFailures() {
        return !ruleFailures.isEmpty();
    }
}
