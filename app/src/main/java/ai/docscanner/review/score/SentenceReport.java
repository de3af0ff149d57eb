package ai.docscanner.review.score;

import ai.docscanner.review.rule.Issue;
import ai.docscanner.review.segment.Sentence;
import java.util.List;
import java.util.Objects;

public record SentenceReport(Sentence sentence, List<Issue> issues, Readability readability) {

    public SentenceReport {
        Objects.requireNonNull(sentence, "sentence");
        issues = List.copyOf(Objects.requireNonNull(issues, "issues"));
        Objects.requireNonNull(readability, "readability");
    }

    public int issueCount() {
        return issues.size();
    }
}
