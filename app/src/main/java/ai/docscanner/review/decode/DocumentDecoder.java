package ai.docscanner.review.decode;

import ai.docscanner.review.markup.MarkupDocument;

/**
 * Turns the raw content of one input format into the normalized markup tree.
 */
public interface DocumentDecoder {

    String name();

    MarkupDocument decode(String content);
}
