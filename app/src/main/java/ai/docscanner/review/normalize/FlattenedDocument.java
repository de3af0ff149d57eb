package ai.docscanner.review.normalize;

import java.util.Objects;

/**
 * The whole document as one plain string, block texts joined by a single space.
 */
public record FlattenedDocument(String text, BlockOffsetMap offsets) {

    public FlattenedDocument {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(offsets, "offsets");
    }

    public int length() {
        return text.length();
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }
}
