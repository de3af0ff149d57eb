package ai.docscanner.review.segment;

import ai.docscanner.review.markup.Block;
import ai.docscanner.review.markup.PlainText;
import org.jsoup.nodes.Entities;

/**
 * Best-effort recovery of a sentence's formatted markup.
 *
 * <p>Heuristics, first match wins:</p>
 * <ol>
 *   <li>the block holds a single sentence candidate or is shorter than the threshold: the whole block fragment;</li>
 *   <li>the sentence is a prefix or suffix of the block text, trailing punctuation ignored: the whole block
 *   fragment, so formatting of a neighbouring sentence in the same block can show up;</li>
 *   <li>otherwise the escaped plain text in a bare container, inline formatting lost.</li>
 * </ol>
 */
public class MarkupFragmentResolver {

    static final int DEFAULT_FRAGMENT_THRESHOLD_CHARS = 150;

    private final int fragmentThresholdChars;

    public MarkupFragmentResolver() {
        this(DEFAULT_FRAGMENT_THRESHOLD_CHARS);
    }

    public MarkupFragmentResolver(int fragmentThresholdChars) {
        if (fragmentThresholdChars < 0) {
            throw new IllegalArgumentException("fragmentThresholdChars must be zero or greater");
        }
        this.fragmentThresholdChars = fragmentThresholdChars;
    }

    public String resolve(Block block, String sentenceText, int candidatesInBlock) {
        if (candidatesInBlock <= 1 || block.length() < fragmentThresholdChars) {
            return block.markupFragment();
        }
        String sentenceCore = PlainText.stripTrailingPunctuation(sentenceText);
        String blockCore = PlainText.stripTrailingPunctuation(block.plainText());
        if (!sentenceCore.isEmpty() && (blockCore.startsWith(sentenceCore) || blockCore.endsWith(sentenceCore))) {
            return block.markupFragment();
        }
        return wrapPlain(sentenceText);
    }

    static String wrapPlain(String sentenceText) {
        return "<span class=\"sentence\">" + Entities.escape(sentenceText) + "</span>";
    }
}
