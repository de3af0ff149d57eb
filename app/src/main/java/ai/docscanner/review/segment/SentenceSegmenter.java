package ai.docscanner.review.segment;

import ai.docscanner.review.markup.Block;
import ai.docscanner.review.markup.PlainText;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits blocks into sentence drafts, discarding degenerate fragments such as a lone article that a
 * boundary detector cut off as its own sentence.
 */
public class SentenceSegmenter {

    private static final Logger LOGGER = LoggerFactory.getLogger(SentenceSegmenter.class);

    static final int DEFAULT_MIN_SENTENCE_CHARS = 3;
    static final int DEFAULT_MIN_SENTENCE_TOKENS = 2;

    private final SentenceBoundaryDetector detector;
    private final MarkupFragmentResolver fragmentResolver;
    private final int minSentenceChars;
    private final int minSentenceTokens;

    public SentenceSegmenter(SentenceBoundaryDetector detector) {
        this(detector, new MarkupFragmentResolver(), DEFAULT_MIN_SENTENCE_CHARS, DEFAULT_MIN_SENTENCE_TOKENS);
    }

    public SentenceSegmenter(SentenceBoundaryDetector detector,
                             MarkupFragmentResolver fragmentResolver,
                             int minSentenceChars,
                             int minSentenceTokens) {
        this.detector = Objects.requireNonNull(detector, "detector");
        this.fragmentResolver = Objects.requireNonNull(fragmentResolver, "fragmentResolver");
        if (minSentenceChars < 0) {
            throw new IllegalArgumentException("minSentenceChars must be zero or greater");
        }
        if (minSentenceTokens < 1) {
            throw new IllegalArgumentException("minSentenceTokens must be at least 1");
        }
        this.minSentenceChars = minSentenceChars;
        this.minSentenceTokens = minSentenceTokens;
    }

    public List<SentenceDraft> segment(Block block) {
        Objects.requireNonNull(block, "block");
        List<TextSpan> candidates = detector.detect(block.plainText());
        if (candidates.isEmpty()) {
            return List.of();
        }
        List<SentenceDraft> drafts = new ArrayList<>(candidates.size());
        for (TextSpan candidate : candidates) {
            TextSpan span = candidate.trimmed(block.plainText());
            String text = span.slice(block.plainText());
            if (!isAcceptable(text)) {
                LOGGER.debug("Discarding degenerate sentence candidate '{}' in block {}", text, block.order());
                continue;
            }
            String fragment = fragmentResolver.resolve(block, text, candidates.size());
            drafts.add(new SentenceDraft(block.order(), text, fragment, span));
        }
        return drafts;
    }

    public List<SentenceDraft> segmentAll(List<Block> blocks) {
        if (blocks == null || blocks.isEmpty()) {
            return List.of();
        }
        List<SentenceDraft> drafts = new ArrayList<>();
        for (Block block : blocks) {
            drafts.addAll(segment(block));
        }
        return List.copyOf(drafts);
    }

    boolean isAcceptable(String candidate) {
        String trimmed = candidate == null ? "" : candidate.trim();
        return trimmed.length() > minSentenceChars
                && PlainText.tokenCount(trimmed) >= minSentenceTokens
                && !PlainText.isPunctuationOnly(trimmed);
    }
}
