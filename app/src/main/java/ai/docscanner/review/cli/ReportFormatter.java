package ai.docscanner.review.cli;

import ai.docscanner.review.rule.Issue;
import ai.docscanner.review.rule.RuleFailure;
import ai.docscanner.review.score.DocumentReport;
import ai.docscanner.review.score.Readability;
import ai.docscanner.review.score.ReportSummary;
import ai.docscanner.review.score.SentenceReport;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a report as plain text for the terminal. Only sentences with issues are listed.
 */
public class ReportFormatter {

    public String format(DocumentReport report) {
        return format(report, Map.of());
    }

    public String format(DocumentReport report, Map<Issue, String> suggestions) {
        Objects.requireNonNull(report, "report");
        Map<Issue, String> rewrites = suggestions == null ? Map.of() : suggestions;
        String nl = System.lineSeparator();
        ReportSummary summary = report.summary();
        StringBuilder builder = new StringBuilder();
        builder.append("Quality score: ").append(summary.qualityScore()).append("/100").append(nl);
        builder.append("Sentences: ").append(summary.totalSentences())
                .append(", issues: ").append(summary.totalIssues())
                .append(", words: ").append(summary.totalWords()).append(nl);

        for (SentenceReport sentence : report.sentences()) {
            if (sentence.issueCount() == 0) {
                continue;
            }
            builder.append(nl);
            builder.append('[').append(sentence.sentence().index() + 1).append("] ")
                    .append(sentence.sentence().plainText()).append(nl);
            appendReadability(builder, sentence.readability());
            for (Issue issue : sentence.issues()) {
                appendIssue(builder, issue, rewrites.get(issue));
            }
        }

        if (!report.unassigned().isEmpty()) {
            builder.append(nl).append("Document-level issues:").append(nl);
            for (Issue issue : report.unassigned()) {
                appendIssue(builder, issue, null);
            }
        }

        if (report.hasRuleFailures()) {
            builder.append(nl).append("Rule failures:").append(nl);
            for (RuleFailure failure : report.ruleFailures()) {
                builder.append("  - ").append(failure.ruleId()).append(" (").append(failure.reason());
                failure.sentenceIndex().ifPresent(index -> builder.append(", sentence ").append(index + 1));
                builder.append(')');
                if (!failure.detail().isBlank()) {
                    builder.append(": ").append(failure.detail());
                }
                builder.append(nl);
            }
        }
        return builder.toString();
    }

    private void appendReadability(StringBuilder builder, Readability readability) {
        builder.append(String.format(Locale.ROOT, "    Readability: Flesch %.1f, Fog %.1f, SMOG %.1f, ARI %.1f",
                readability.fleschReadingEase(), readability.gunningFog(), readability.smogIndex(),
                readability.automatedReadabilityIndex()));
        builder.append(System.lineSeparator());
    }

    private void appendIssue(StringBuilder builder, Issue issue, String suggestion) {
        String nl = System.lineSeparator();
        builder.append("  - ").append(issue.ruleId()).append(": ").append(issue.message());
        if (!issue.matchedText().isBlank()) {
            builder.append(" (\"").append(issue.matchedText()).append("\")");
        }
        builder.append(nl);
        if (suggestion != null && !suggestion.isBlank()) {
            builder.append("    Suggestion: ").append(suggestion).append(nl);
        }
    }
}
