package ai.docscanner.review.segment;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docscanner.review.markup.Block;
import ai.docscanner.review.markup.BlockKind;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SentenceSegmenterTest {

    private final SentenceSegmenter regexSegmenter = new SentenceSegmenter(new RegexBoundaryDetector());
    private final SentenceSegmenter defaultSegmenter =
            new SentenceSegmenter(SegmentationStrategy.AUTO.createDetector(java.util.Locale.ENGLISH));

    @Test
    @DisplayName("A lone article cut off by the detector never becomes a sentence")
    void dropsDegenerateLeadingFragment() {
        Block block = paragraph("The. Document follows.");

        List<SentenceDraft> regexDrafts = regexSegmenter.segment(block);
        List<SentenceDraft> defaultDrafts = defaultSegmenter.segment(block);

        assertThat(regexDrafts).extracting(SentenceDraft::plainText).containsExactly("Document follows.");
        assertThat(defaultDrafts).extracting(SentenceDraft::plainText)
                .isNotEmpty()
                .noneMatch(text -> text.equals("The") || text.equals("The."));
    }

    @Test
    void keepsShortTwoWordSentence() {
        List<SentenceDraft> drafts = defaultSegmenter.segment(paragraph("Enable autostart."));

        assertThat(drafts).singleElement().satisfies(draft -> {
            assertThat(draft.plainText()).isEqualTo("Enable autostart.");
            assertThat(draft.blockSpan()).isEqualTo(new TextSpan(0, 17));
            assertThat(draft.markupFragment()).isEqualTo("<p>Enable autostart.</p>");
        });
    }

    @Test
    void dropsSingleTokenBlock() {
        assertThat(defaultSegmenter.segment(paragraph("The."))).isEmpty();
        assertThat(defaultSegmenter.segment(paragraph("Go!"))).isEmpty();
    }

    @Test
    void reportsSpansInBlockCoordinates() {
        Block block = paragraph("Open the console. Click Save to continue.");

        List<SentenceDraft> drafts = regexSegmenter.segment(block);

        assertThat(drafts).extracting(SentenceDraft::blockSpan)
                .containsExactly(new TextSpan(0, 17), new TextSpan(18, 41));
        assertThat(drafts).allSatisfy(draft ->
                assertThat(draft.blockSpan().slice(block.plainText())).isEqualTo(draft.plainText()));
    }

    @Test
    @DisplayName("Middle sentences of long blocks fall back to escaped plain text")
    void wrapsMiddleSentenceOfLongBlock() {
        String first = "The installer copies every required library into the program folder.";
        String middle = "Afterwards the service registers itself with the R&D scheduler daemon.";
        String last = "Restart the machine once the progress bar reaches the final step.";
        String text = first + " " + middle + " " + last;
        Block block = new Block(text, "<p><b>" + first + "</b> " + middle + " " + last + "</p>", 0, BlockKind.PARAGRAPH);

        List<SentenceDraft> drafts = regexSegmenter.segment(block);

        assertThat(drafts).hasSize(3);
        assertThat(drafts.get(0).markupFragment()).isEqualTo(block.markupFragment());
        assertThat(drafts.get(1).markupFragment()).isEqualTo(
                "<span class=\"sentence\">Afterwards the service registers itself with the R&amp;D scheduler daemon.</span>");
        assertThat(drafts.get(2).markupFragment()).isEqualTo(block.markupFragment());
    }

    @Test
    void keepsFullFragmentForShortMultiSentenceBlock() {
        Block block = new Block("Open it. Close it now.", "<p>Open it. <i>Close</i> it now.</p>", 0, BlockKind.PARAGRAPH);

        List<SentenceDraft> drafts = regexSegmenter.segment(block);

        assertThat(drafts).extracting(SentenceDraft::markupFragment)
                .containsOnly("<p>Open it. <i>Close</i> it now.</p>");
    }

    @Test
    void segmentAllPreservesBlockOrder() {
        List<SentenceDraft> drafts = regexSegmenter.segmentAll(List.of(
                new Block("First block text.", "<p>First block text.</p>", 0, BlockKind.PARAGRAPH),
                new Block("Second block text.", "<p>Second block text.</p>", 1, BlockKind.PARAGRAPH)));

        assertThat(drafts).extracting(SentenceDraft::blockOrder).containsExactly(0, 1);
        assertThat(regexSegmenter.segmentAll(List.of())).isEmpty();
    }

    private static Block paragraph(String text) {
        return new Block(text, "<p>" + text + "</p>", 0, BlockKind.PARAGRAPH);
    }
}
