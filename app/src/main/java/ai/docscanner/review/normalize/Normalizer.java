package ai.docscanner.review.normalize;

import ai.docscanner.review.markup.Block;
import ai.docscanner.review.segment.Sentence;
import ai.docscanner.review.segment.SentenceDraft;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the flattened document text and maps sentence drafts from block coordinates into it.
 */
public class Normalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Normalizer.class);

    static final String BLOCK_SEPARATOR = " ";

    public FlattenedDocument flatten(List<Block> blocks) {
        if (blocks == null || blocks.isEmpty()) {
            return new FlattenedDocument("", BlockOffsetMap.empty());
        }
        int[] orders = new int[blocks.size()];
        int[] starts = new int[blocks.size()];
        int[] lengths = new int[blocks.size()];
        StringBuilder text = new StringBuilder();
        int previousOrder = -1;
        for (int i = 0; i < blocks.size(); i++) {
            Block block = Objects.requireNonNull(blocks.get(i), "block");
            if (block.order() <= previousOrder) {
                throw new IllegalArgumentException("Blocks must be sorted by order, found " + block.order()
                        + " after " + previousOrder);
            }
            if (i > 0) {
                text.append(BLOCK_SEPARATOR);
            }
            orders[i] = block.order();
            starts[i] = text.length();
            lengths[i] = block.length();
            text.append(block.plainText());
            previousOrder = block.order();
        }
        return new FlattenedDocument(text.toString(), new BlockOffsetMap(orders, starts, lengths));
    }

    /**
     * Assigns document offsets to the drafts in order. The search cursor only moves forward, so a sentence
     * repeated verbatim later in the document is never anchored onto an earlier occurrence.
     */
    public List<Sentence> anchor(FlattenedDocument document, List<SentenceDraft> drafts) {
        Objects.requireNonNull(document, "document");
        if (drafts == null || drafts.isEmpty()) {
            return List.of();
        }
        String text = document.text();
        List<Sentence> sentences = new ArrayList<>(drafts.size());
        int previousEnd = 0;
        for (SentenceDraft draft : drafts) {
            int blockStart = document.offsets().blockStart(draft.blockOrder());
            int cursor = Math.max(previousEnd, blockStart);
            int start = locate(text, draft, blockStart, cursor);
            int end;
            if (start < 0) {
                LOGGER.warn("Could not anchor sentence '{}' of block {} after offset {}; using an empty range",
                        draft.plainText(), draft.blockOrder(), cursor);
                start = Math.min(cursor, text.length());
                end = start;
            } else {
                end = start + draft.plainText().length();
            }
            sentences.add(new Sentence(sentences.size(), draft.plainText(), draft.markupFragment(),
                    start, end, draft.blockOrder()));
            previousEnd = end;
        }
        return List.copyOf(sentences);
    }

    private int locate(String text, SentenceDraft draft, int blockStart, int cursor) {
        String sentence = draft.plainText();
        int expected = blockStart + draft.blockSpan().start();
        if (expected >= cursor && text.startsWith(sentence, expected)) {
            return expected;
        }
        return text.indexOf(sentence, cursor);
    }
}
