package ai.docscanner.review.markup;

import java.util.List;

/**
 * Decomposes a markup tree into the ordered blocks used as units of sentence segmentation.
 */
public interface BlockExtractor {

    List<Block> extract(MarkupDocument document);
}
