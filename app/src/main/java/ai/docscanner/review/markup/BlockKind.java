package ai.docscanner.review.markup;

import java.util.Locale;
import java.util.Optional;

/**
 * Block-level element families that qualify as a unit of sentence segmentation.
 */
public enum BlockKind {
    PARAGRAPH,
    HEADING,
    LIST_ITEM,
    QUOTE,
    CONTAINER;

    public static Optional<BlockKind> fromTag(String tagName) {
        if (tagName == null) {
            return Optional.empty();
        }
        return switch (tagName.toLowerCase(Locale.ROOT)) {
            case "p" -> Optional.of(PARAGRAPH);
            case "h1", "h2", "h3", "h4", "h5", "h6" -> Optional.of(HEADING);
            case "li" -> Optional.of(LIST_ITEM);
            case "blockquote" -> Optional.of(QUOTE);
            case "div", "section", "article", "td", "th", "dd", "dt", "figcaption" -> Optional.of(CONTAINER);
            default -> Optional.empty();
        };
    }

    public boolean isGenericContainer() {
        return this == CONTAINER;
    }
}
