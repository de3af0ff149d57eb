package ai.docscanner.review.normalize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.docscanner.review.markup.Block;
import ai.docscanner.review.markup.BlockKind;
import ai.docscanner.review.segment.RegexBoundaryDetector;
import ai.docscanner.review.segment.Sentence;
import ai.docscanner.review.segment.SentenceDraft;
import ai.docscanner.review.segment.SentenceSegmenter;
import ai.docscanner.review.segment.TextSpan;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NormalizerTest {

    private final Normalizer normalizer = new Normalizer();
    private final SentenceSegmenter segmenter = new SentenceSegmenter(new RegexBoundaryDetector());

    @Test
    void flattensBlocksWithSingleSpaceSeparator() {
        List<Block> blocks = List.of(block("Intro text here.", 0), block("Second block.", 1));

        FlattenedDocument document = normalizer.flatten(blocks);

        assertThat(document.text()).isEqualTo("Intro text here. Second block.");
        assertThat(document.offsets().blockStart(0)).isZero();
        assertThat(document.offsets().blockStart(1)).isEqualTo(17);
        assertThat(document.offsets().blockEnd(1)).isEqualTo(30);
        assertThat(document.offsets().toDocumentOffset(1, 7)).isEqualTo(24);
    }

    @Test
    void knowsWhetherARangeStaysInsideOneBlock() {
        BlockOffsetMap offsets = normalizer.flatten(
                List.of(block("Intro text here.", 0), block("Second block.", 1))).offsets();

        assertThat(offsets.withinSingleBlock(0, 16)).isTrue();
        assertThat(offsets.withinSingleBlock(17, 23)).isTrue();
        assertThat(offsets.withinSingleBlock(11, 23)).isFalse();
        assertThat(offsets.withinSingleBlock(16, 17)).isFalse();
        assertThat(offsets.withinSingleBlock(25, 31)).isFalse();
        assertThat(BlockOffsetMap.empty().withinSingleBlock(0, 1)).isFalse();
    }

    @Test
    @DisplayName("Identical sentences in different blocks anchor to increasing offsets")
    void anchorsRepeatedSentencesForward() {
        List<Block> blocks = List.of(block("Click Save to continue.", 0), block("Click Save to continue.", 1));
        FlattenedDocument document = normalizer.flatten(blocks);

        List<Sentence> sentences = normalizer.anchor(document, segmenter.segmentAll(blocks));

        assertThat(sentences).hasSize(2);
        assertThat(sentences.get(0).documentStart()).isZero();
        assertThat(sentences.get(0).documentEnd()).isEqualTo(23);
        assertThat(sentences.get(1).documentStart()).isEqualTo(24);
        assertThat(sentences.get(1).documentEnd()).isEqualTo(47);
        assertThat(sentences).extracting(Sentence::index).containsExactly(0, 1);
        assertThat(sentences).extracting(Sentence::blockOrder).containsExactly(0, 1);
    }

    @Test
    void sentencesNeverOverlapAndMatchTheFlattenedText() {
        List<Block> blocks = List.of(
                block("Open the console. Open the console. Then wait.", 0),
                block("Open the console.", 1));
        FlattenedDocument document = normalizer.flatten(blocks);

        List<Sentence> sentences = normalizer.anchor(document, segmenter.segmentAll(blocks));

        assertThat(sentences).hasSize(4);
        for (int i = 0; i < sentences.size(); i++) {
            Sentence sentence = sentences.get(i);
            assertThat(document.text().substring(sentence.documentStart(), sentence.documentEnd()))
                    .isEqualTo(sentence.plainText());
            if (i > 0) {
                assertThat(sentence.documentStart()).isGreaterThanOrEqualTo(sentences.get(i - 1).documentEnd());
            }
        }
    }

    @Test
    @DisplayName("A sentence that cannot be found gets an empty range at the cursor")
    void assignsEmptyRangeWhenTextIsMissing() {
        List<Block> blocks = List.of(block("Real text in block.", 0));
        FlattenedDocument document = normalizer.flatten(blocks);
        SentenceDraft stray = new SentenceDraft(0, "Text that is absent.", "<p>x</p>", new TextSpan(0, 20));

        List<Sentence> sentences = normalizer.anchor(document, List.of(stray));

        assertThat(sentences).singleElement().satisfies(sentence -> {
            assertThat(sentence.documentStart()).isZero();
            assertThat(sentence.documentEnd()).isZero();
        });
    }

    @Test
    void rejectsUnsortedBlocks() {
        Throwable thrown = catchThrowable(() -> normalizer.flatten(List.of(block("Later block.", 2), block("Earlier block.", 1))));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyInputYieldsEmptyDocument() {
        FlattenedDocument document = normalizer.flatten(List.of());

        assertThat(document.isEmpty()).isTrue();
        assertThat(normalizer.anchor(document, List.of())).isEmpty();
    }

    private static Block block(String text, int order) {
        return new Block(text, "<p>" + text + "</p>", order, BlockKind.PARAGRAPH);
    }
}
