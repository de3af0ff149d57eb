package ai.docscanner.review.segment;

import java.util.Objects;

/**
 * A sentence anchored in the flattened document text. {@code [documentStart, documentEnd)} ranges of the
 * sentences of one document are sorted and never overlap.
 */
public record Sentence(int index,
                       String plainText,
                       String markupFragment,
                       int documentStart,
                       int documentEnd,
                       int blockOrder) {

    public Sentence {
        Objects.requireNonNull(plainText, "plainText");
        Objects.requireNonNull(markupFragment, "markupFragment");
        if (index < 0) {
            throw new IllegalArgumentException("index must be greater than or equal to zero");
        }
        if (documentStart < 0 || documentEnd < documentStart) {
            throw new IllegalArgumentException("Invalid document range [" + documentStart + ", " + documentEnd + ")");
        }
    }

    public boolean overlaps(int start, int end) {
        return start < documentEnd && documentStart < end;
    }

    public boolean contains(int offset) {
        return offset >= documentStart && offset < documentEnd;
    }
}
