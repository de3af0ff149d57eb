package ai.docscanner.review.segment;

import java.util.List;

/**
 * Finds sentence boundaries in a block of plain text. Returned spans are ordered, non-overlapping
 * and expressed in block coordinates.
 */
public interface SentenceBoundaryDetector {

    String name();

    List<TextSpan> detect(String text);

    default boolean isAvailable() {
        return true;
    }
}
