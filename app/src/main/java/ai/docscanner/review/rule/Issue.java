package ai.docscanner.review.rule;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * A finding attributed to the rule that produced it. Offsets are document offsets for {@link IssueScope#DOCUMENT}
 * and sentence offsets for {@link IssueScope#SENTENCE}, where {@code sentenceHint} names the sentence.
 */
public record Issue(String ruleId,
                    String category,
                    String message,
                    String matchedText,
                    int start,
                    int end,
                    IssueScope scope,
                    OptionalInt sentenceHint) {

    public Issue {
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(sentenceHint, "sentenceHint");
        category = category == null || category.isBlank() ? ruleId : category;
        matchedText = matchedText == null ? "" : matchedText;
        if (scope == IssueScope.SENTENCE && sentenceHint.isEmpty()) {
            throw new IllegalArgumentException("Sentence scoped issue requires a sentence hint");
        }
    }

    public static Issue document(String ruleId, String category, RuleFinding finding) {
        return new Issue(ruleId, category, finding.message(), finding.text(), finding.start(), finding.end(),
                IssueScope.DOCUMENT, OptionalInt.empty());
    }

    public static Issue sentence(String ruleId, String category, RuleFinding finding, int sentenceIndex) {
        return new Issue(ruleId, category, finding.message(), finding.text(), finding.start(), finding.end(),
                IssueScope.SENTENCE, OptionalInt.of(sentenceIndex));
    }

    /**
     * {@code start == end == 0} with empty text is the "no position" marker of legacy rules.
     */
    public boolean isPositionless() {
        return start == 0 && end == 0 && matchedText.isEmpty();
    }
}
