package ai.docscanner.review.score;

import ai.docscanner.review.markup.PlainText;
import ai.docscanner.review.normalize.FlattenedDocument;
import ai.docscanner.review.resolve.SentenceIssueMap;
import ai.docscanner.review.rule.RuleFailure;
import ai.docscanner.review.segment.Sentence;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Folds the sentence to issue association into per-sentence and document level results.
 */
public class ScoreAggregator {

    private final ReadabilityCalculator readability;

    public ScoreAggregator() {
        this(new ReadabilityCalculator());
    }

    public ScoreAggregator(ReadabilityCalculator readability) {
        this.readability = Objects.requireNonNull(readability, "readability");
    }

    public DocumentReport aggregate(FlattenedDocument document,
                                    List<Sentence> sentences,
                                    SentenceIssueMap issueMap,
                                    List<RuleFailure> ruleFailures,
                                    String content) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(issueMap, "issueMap");
        List<Sentence> all = sentences == null ? List.of() : sentences;
        if (issueMap.sentenceCount() != all.size()) {
            throw new IllegalArgumentException("Issue map covers " + issueMap.sentenceCount()
                    + " sentences but " + all.size() + " were given");
        }
        List<SentenceReport> reports = new ArrayList<>(all.size());
        for (Sentence sentence : all) {
            reports.add(new SentenceReport(sentence, issueMap.issuesFor(sentence.index()),
                    readability.measure(sentence.plainText())));
        }
        int totalIssues = issueMap.totalIssues();
        ReportSummary summary = new ReportSummary(all.size(), totalIssues, qualityScore(totalIssues, all.size()),
                PlainText.tokenCount(document.text()));
        return new DocumentReport(reports, issueMap.unassigned(), summary,
                ruleFailures == null ? List.of() : ruleFailures, content);
    }

    /**
     * {@code max(0, round(100 * (1 - issues / sentences)))}, ties rounded to the even neighbour. A document
     * without sentences scores 0.
     */
    public static int qualityScore(int totalIssues, int totalSentences) {
        if (totalSentences <= 0) {
            return 0;
        }
        double raw = 100d * (1d - (double) totalIssues / totalSentences);
        return (int) Math.max(0d, Math.rint(raw));
    }
}
