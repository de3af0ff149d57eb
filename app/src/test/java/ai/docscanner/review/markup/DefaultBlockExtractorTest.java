package ai.docscanner.review.markup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DefaultBlockExtractorTest {

    private final DefaultBlockExtractor extractor = new DefaultBlockExtractor();

    @Test
    void extractsBlocksInDocumentOrderWithKinds() {
        MarkupDocument document = MarkupDocument.parse("""
                <h1>Getting started</h1>
                <p>Install the <b>agent</b> first.</p>
                <ul><li>Open the console.</li><li>Click Save.</li></ul>
                <blockquote>Read the notes twice.</blockquote>
                """);

        List<Block> blocks = extractor.extract(document);

        assertThat(blocks)
                .extracting(Block::order, Block::kind, Block::plainText)
                .containsExactly(
                        tuple(0, BlockKind.HEADING, "Getting started"),
                        tuple(1, BlockKind.PARAGRAPH, "Install the agent first."),
                        tuple(2, BlockKind.LIST_ITEM, "Open the console."),
                        tuple(3, BlockKind.LIST_ITEM, "Click Save."),
                        tuple(4, BlockKind.QUOTE, "Read the notes twice."));
    }

    @Test
    @DisplayName("Keeps the verbatim element markup as the fragment")
    void keepsOuterHtmlAsFragment() {
        MarkupDocument document = MarkupDocument.parse("<p>Press <kbd>Ctrl</kbd> and <em>wait</em>.</p>");

        Block block = extractor.extract(document).get(0);

        assertThat(block.markupFragment()).isEqualTo("<p>Press <kbd>Ctrl</kbd> and <em>wait</em>.</p>");
        assertThat(block.plainText()).isEqualTo("Press Ctrl and wait.");
    }

    @Test
    @DisplayName("Never counts an element nested inside a selected block twice")
    void skipsNestedBlocks() {
        MarkupDocument document = MarkupDocument.parse("""
                <div><p>First paragraph here.</p><p>Second paragraph here.</p></div>
                <li><p>Nested paragraph in item.</p></li>
                <blockquote><p>Quoted paragraph text.</p></blockquote>
                """);

        List<Block> blocks = extractor.extract(document);

        assertThat(blocks).extracting(Block::plainText).containsExactly(
                "First paragraph here.",
                "Second paragraph here.",
                "Nested paragraph in item.",
                "Quoted paragraph text.");
        assertThat(blocks).extracting(Block::kind).containsExactly(
                BlockKind.PARAGRAPH, BlockKind.PARAGRAPH, BlockKind.LIST_ITEM, BlockKind.QUOTE);
    }

    @Test
    void treatsLeafContainersAsBlocks() {
        MarkupDocument document = MarkupDocument.parse(
                "<table><tr><td>Cell text one.</td><td>Cell text two.</td></tr></table><div>Loose text in a div.</div>");

        List<Block> blocks = extractor.extract(document);

        assertThat(blocks).extracting(Block::plainText)
                .containsExactly("Cell text one.", "Cell text two.", "Loose text in a div.");
        assertThat(blocks).allSatisfy(block -> assertThat(block.kind()).isEqualTo(BlockKind.CONTAINER));
    }

    @Test
    @DisplayName("Text beside a nested paragraph in a container keeps its place in document order")
    void keepsLooseTextAroundNestedBlocks() {
        MarkupDocument document = MarkupDocument.parse(
                "<div>Read this introduction first. <p>Then follow the steps.</p> Finally restart.</div>");

        List<Block> blocks = extractor.extract(document);

        assertThat(blocks)
                .extracting(Block::order, Block::kind, Block::plainText)
                .containsExactly(
                        tuple(0, BlockKind.CONTAINER, "Read this introduction first."),
                        tuple(1, BlockKind.PARAGRAPH, "Then follow the steps."),
                        tuple(2, BlockKind.CONTAINER, "Finally restart."));
        assertThat(blocks.get(0).markupFragment()).isEqualTo("Read this introduction first.");
    }

    @Test
    void groupsInlineSiblingsIntoOneLooseBlock() {
        MarkupDocument document = MarkupDocument.parse(
                "<section>Press <b>Save</b> before leaving.<h2>Next steps</h2><!-- note --></section>Body text.");

        List<Block> blocks = extractor.extract(document);

        assertThat(blocks).extracting(Block::plainText)
                .containsExactly("Press Save before leaving.", "Next steps", "Body text.");
        assertThat(blocks.get(0).markupFragment()).isEqualTo("Press <b>Save</b> before leaving.");
        assertThat(blocks.get(2).kind()).isEqualTo(BlockKind.CONTAINER);
    }

    @Test
    void dropsEmptyAndPunctuationOnlyBlocksAndScripts() {
        MarkupDocument document = MarkupDocument.parse("""
                <p>   </p>
                <p>...</p>
                <p>Real content stays.<script>var x = 1;</script></p>
                <script>document.write('no');</script>
                """);

        List<Block> blocks = extractor.extract(document);

        assertThat(blocks).extracting(Block::plainText).containsExactly("Real content stays.");
        assertThat(blocks.get(0).order()).isZero();
    }

    @Test
    void returnsNoBlocksForEmptyDocument() {
        assertThat(extractor.extract(MarkupDocument.parse(""))).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }
}
