package ai.docscanner.review.markup;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default extractor walking the body depth-first. A selected element's subtree is never visited again,
 * so nested block structure (a paragraph inside a list item, a list inside a quote) is counted once.
 * Text sitting directly in the body or in a container next to nested blocks is kept as well: each run of
 * such loose inline content becomes a {@link BlockKind#CONTAINER} block at its place in document order.
 */
public class DefaultBlockExtractor implements BlockExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultBlockExtractor.class);
    private static final Set<String> IGNORED_TAGS = Set.of("script", "style", "template", "noscript");

    @Override
    public List<Block> extract(MarkupDocument document) {
        if (document == null) {
            return List.of();
        }
        List<Block> blocks = new ArrayList<>();
        collectBlocks(document.body(), blocks);
        LOGGER.debug("Extracted {} blocks", blocks.size());
        return List.copyOf(blocks);
    }

    private static void collectBlocks(Element parent, List<Block> blocks) {
        List<Node> looseRun = new ArrayList<>();
        for (Node child : parent.childNodes()) {
            if (child instanceof Element element) {
                if (IGNORED_TAGS.contains(element.normalName())) {
                    continue;
                }
                Optional<BlockKind> kind = BlockKind.fromTag(element.normalName());
                boolean holdsBlocks = containsBlockDescendant(element);
                if (kind.isPresent() && !(kind.get().isGenericContainer() && holdsBlocks)) {
                    flushLooseRun(looseRun, blocks);
                    addBlock(flattenText(element), element.outerHtml(), kind.get(), blocks);
                    continue;
                }
                if (holdsBlocks) {
                    flushLooseRun(looseRun, blocks);
                    collectBlocks(element, blocks);
                    continue;
                }
                looseRun.add(element);
            } else if (child instanceof TextNode) {
                looseRun.add(child);
            }
        }
        flushLooseRun(looseRun, blocks);
    }

    private static void flushLooseRun(List<Node> looseRun, List<Block> blocks) {
        if (looseRun.isEmpty()) {
            return;
        }
        StringJoiner joiner = new StringJoiner(" ");
        StringBuilder fragment = new StringBuilder();
        for (Node node : looseRun) {
            collectText(node, joiner);
            fragment.append(node.outerHtml());
        }
        looseRun.clear();
        String text = PlainText.normalize(joiner.toString());
        // whitespace between sibling blocks
        if (!text.isEmpty()) {
            addBlock(text, fragment.toString().trim(), BlockKind.CONTAINER, blocks);
        }
    }

    private static void addBlock(String text, String fragment, BlockKind kind, List<Block> blocks) {
        if (text.isEmpty() || PlainText.isPunctuationOnly(text)) {
            LOGGER.debug("Dropping empty {} block", kind);
            return;
        }
        blocks.add(new Block(text, fragment, blocks.size(), kind));
    }

    /**
     * Joins every descendant text node with a single space so inline elements never run together.
     */
    static String flattenText(Element element) {
        StringJoiner joiner = new StringJoiner(" ");
        collectText(element, joiner);
        return PlainText.normalize(joiner.toString());
    }

    private static void collectText(Node node, StringJoiner joiner) {
        if (node instanceof TextNode textNode) {
            String text = textNode.text();
            if (!text.isBlank()) {
                joiner.add(text);
            }
        } else if (node instanceof Element element && !IGNORED_TAGS.contains(element.normalName())) {
            for (Node child : element.childNodes()) {
                collectText(child, joiner);
            }
        }
    }

    private static boolean containsBlockDescendant(Element element) {
        for (Element descendant : element.getAllElements()) {
            if (descendant != element && BlockKind.fromTag(descendant.normalName()).isPresent()) {
                return true;
            }
        }
        return false;
    }
}
