package ai.docscanner.review.rule.builtin;

import ai.docscanner.review.markup.PlainText;
import ai.docscanner.review.rule.Rule;
import ai.docscanner.review.rule.RuleFinding;
import ai.docscanner.review.segment.RegexBoundaryDetector;
import ai.docscanner.review.segment.SentenceBoundaryDetector;
import ai.docscanner.review.segment.TextSpan;
import java.util.ArrayList;
import java.util.List;

/**
 * Flags sentences longer than a word limit. Works on a single sentence as well as on the whole document.
 */
public final class LongSentenceRule implements Rule {

    public static final String ID = "long-sentence";
    public static final String CATEGORY = "readability";
    public static final int DEFAULT_MAX_WORDS = 25;

    private final SentenceBoundaryDetector detector = new RegexBoundaryDetector();
    private final int maxWords;

    public LongSentenceRule() {
        this(DEFAULT_MAX_WORDS);
    }

    public LongSentenceRule(int maxWords) {
        if (maxWords < 1) {
            throw new IllegalArgumentException("maxWords must be at least 1");
        }
        this.maxWords = maxWords;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String category() {
        return CATEGORY;
    }

    @Override
    public List<RuleFinding> run(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<RuleFinding> findings = new ArrayList<>();
        for (TextSpan span : detector.detect(text)) {
            String sentence = span.slice(text);
            int words = PlainText.tokenCount(sentence);
            if (words > maxWords) {
                findings.add(new RuleFinding(sentence, span.start(), span.end(),
                        "Sentence has " + words + " words. Consider breaking it into shorter sentences (aim for 15-20 words)."));
            }
        }
        return findings;
    }
}
