package ai.docscanner.review.markup;

import java.util.Objects;

/**
 * A top-level text-bearing markup element with both its flattened text and its original fragment.
 */
public record Block(String plainText, String markupFragment, int order, BlockKind kind) {

    public Block {
        Objects.requireNonNull(plainText, "plainText");
        Objects.requireNonNull(markupFragment, "markupFragment");
        Objects.requireNonNull(kind, "kind");
        if (order < 0) {
            throw new IllegalArgumentException("order must be greater than or equal to zero");
        }
    }

    public int length() {
        return plainText.length();
    }
}
