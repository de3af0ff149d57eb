package ai.docscanner.review.segment;

import java.util.Objects;

/**
 * A sentence produced by segmentation, still in block coordinates. The normalizer anchors drafts into
 * the flattened document text.
 */
public record SentenceDraft(int blockOrder, String plainText, String markupFragment, TextSpan blockSpan) {

    public SentenceDraft {
        Objects.requireNonNull(plainText, "plainText");
        Objects.requireNonNull(markupFragment, "markupFragment");
        Objects.requireNonNull(blockSpan, "blockSpan");
        if (blockOrder < 0) {
            throw new IllegalArgumentException("blockOrder must be greater than or equal to zero");
        }
    }
}
