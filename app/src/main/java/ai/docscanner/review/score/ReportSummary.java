package ai.docscanner.review.score;

/**
 * Document level figures. {@code qualityScore} is within {@code [0, 100]}.
 */
public record ReportSummary(int totalSentences, int totalIssues, int qualityScore, int totalWords) {

    public ReportSummary {
        if (totalSentences < 0 || totalIssues < 0 || totalWords < 0) {
            throw new IllegalArgumentException("Counts must not be negative");
        }
        if (qualityScore < 0 || qualityScore > 100) {
            throw new IllegalArgumentException("qualityScore must be within [0, 100]: " + qualityScore);
        }
    }
}
