package ai.docscanner.review.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

import ai.docscanner.review.decode.DocumentDecoder;
import ai.docscanner.review.decode.DocumentDecodingException;
import ai.docscanner.review.decode.MarkdownDocumentDecoder;
import ai.docscanner.review.markup.MarkupDocument;
import ai.docscanner.review.rule.Issue;
import ai.docscanner.review.rule.RuleRegistry;
import ai.docscanner.review.rule.Rules;
import ai.docscanner.review.rule.builtin.BuiltInRules;
import ai.docscanner.review.score.DocumentReport;
import ai.docscanner.review.score.SentenceReport;
import ai.docscanner.review.segment.SegmentationStrategy;
import ai.docscanner.review.segment.Sentence;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AnalysisPipelineTest {

    private static final String HTML = """
            <h1>Setup Guide</h1>
            <p>The file was created by the installer. Open the the settings page.</p>
            <ul><li>Enable autostart.</li></ul>
            """;

    private final AnalysisSettings settings = AnalysisSettings.defaults()
            .withSegmentationStrategy(SegmentationStrategy.REGEX)
            .withRuleThreads(2);

    @Test
    void producesReportForHtmlDocument() {
        DocumentReport report;
        try (AnalysisPipeline pipeline = new AnalysisPipeline(settings, BuiltInRules.registry())) {
            report = pipeline.analyze(MarkupDocument.parse(HTML));
        }

        assertThat(report.sentences())
                .extracting(sentence -> sentence.sentence().plainText())
                .containsExactly("Setup Guide", "The file was created by the installer.",
                        "Open the the settings page.", "Enable autostart.");
        assertThat(report.sentences())
                .flatExtracting(SentenceReport::issues)
                .extracting(Issue::ruleId, Issue::matchedText)
                .containsExactly(tuple("passive-voice", "was created"), tuple("repeated-words", "the the"));
        assertThat(report.sentences().get(3).sentence().markupFragment()).isEqualTo("<li>Enable autostart.</li>");
        assertThat(report.unassigned()).isEmpty();
        assertThat(report.summary().totalSentences()).isEqualTo(4);
        assertThat(report.summary().totalIssues()).isEqualTo(2);
        assertThat(report.summary().qualityScore()).isEqualTo(50);
        assertThat(report.hasRuleFailures()).isFalse();
    }

    @Test
    @DisplayName("A word ending a heading and the same word opening the next paragraph are not a repetition")
    void noRepeatedWordAcrossHeadingAndParagraph() {
        DocumentReport report;
        try (AnalysisPipeline pipeline = new AnalysisPipeline(settings, BuiltInRules.registry())) {
            report = pipeline.analyze(MarkupDocument.parse(
                    "<h2>Configure the server</h2><p>Server settings live in one file.</p>"));
        }

        assertThat(report.sentences()).hasSize(2);
        assertThat(report.sentences()).allSatisfy(sentence -> assertThat(sentence.issues()).isEmpty());
        assertThat(report.unassigned()).isEmpty();
        assertThat(report.summary().qualityScore()).isEqualTo(100);
    }

    @Test
    void reportCarriesNormalizedMarkupAndReadability() {
        DocumentReport report;
        try (AnalysisPipeline pipeline = new AnalysisPipeline(settings, BuiltInRules.registry())) {
            report = pipeline.analyze("run-4", "# Title here\n\nThe cat sat on the mat.", new MarkdownDocumentDecoder(),
                    CancellationToken.create(), ProgressWriter.NONE);
        }

        assertThat(report.content()).contains("<h1>Title here</h1>").contains("<p>The cat sat on the mat.</p>");
        assertThat(report.sentences().get(1).readability().gunningFog()).isCloseTo(2.4, within(0.01));
    }

    @Test
    void sentenceRangesAreSortedAndDisjoint() {
        DocumentReport report;
        try (AnalysisPipeline pipeline = new AnalysisPipeline(settings, BuiltInRules.registry())) {
            report = pipeline.analyze(MarkupDocument.parse(
                    "<p>Click Save to continue. Click Save to continue.</p><p>Click Save to continue.</p>"));
        }

        List<Sentence> sentences = new ArrayList<>();
        report.sentences().forEach(sentence -> sentences.add(sentence.sentence()));
        assertThat(sentences).hasSize(3);
        for (int i = 1; i < sentences.size(); i++) {
            assertThat(sentences.get(i).documentStart()).isGreaterThanOrEqualTo(sentences.get(i - 1).documentEnd());
        }
    }

    @Test
    void analyzingTwiceGivesEqualReports() {
        try (AnalysisPipeline pipeline = new AnalysisPipeline(settings, BuiltInRules.registry())) {
            DocumentReport first = pipeline.analyze(MarkupDocument.parse(HTML));
            DocumentReport second = pipeline.analyze(MarkupDocument.parse(HTML));

            assertThat(second).isEqualTo(first);
        }
    }

    @Test
    void reportsStagesUpToComplete() {
        List<AnalysisStage> stages = new ArrayList<>();
        try (AnalysisPipeline pipeline = new AnalysisPipeline(settings, BuiltInRules.registry())) {
            pipeline.analyze("run-1", "# Title here\n\nThe build was started twice.", new MarkdownDocumentDecoder(),
                    CancellationToken.create(), (stage, message) -> stages.add(stage));
        }

        assertThat(stages).containsExactly(AnalysisStage.PARSING, AnalysisStage.SEGMENTATION,
                AnalysisStage.RULE_EXECUTION, AnalysisStage.SCORING, AnalysisStage.COMPLETE);
    }

    @Test
    @DisplayName("A decoding failure ends the run as failed")
    void decodingFailureRaisesAnalysisException() {
        DocumentDecoder broken = new DocumentDecoder() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public MarkupDocument decode(String content) {
                throw new DocumentDecodingException("unreadable");
            }
        };
        List<AnalysisStage> stages = new ArrayList<>();

        Throwable thrown;
        try (AnalysisPipeline pipeline = new AnalysisPipeline(settings, BuiltInRules.registry())) {
            thrown = catchThrowable(() -> pipeline.analyze("run-2", "content", broken, CancellationToken.create(),
                    (stage, message) -> stages.add(stage)));
        }

        assertThat(thrown).isInstanceOf(AnalysisException.class).hasMessageContaining("unreadable");
        assertThat(stages).containsExactly(AnalysisStage.PARSING, AnalysisStage.FAILED);
    }

    @Test
    void cancelledTokenReportsCancelledStage() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        List<AnalysisStage> stages = new ArrayList<>();

        Throwable thrown;
        try (AnalysisPipeline pipeline = new AnalysisPipeline(settings, BuiltInRules.registry())) {
            thrown = catchThrowable(() -> pipeline.analyze("run-3", MarkupDocument.parse(HTML), token,
                    (stage, message) -> stages.add(stage)));
        }

        assertThat(thrown).isInstanceOf(AnalysisCancelledException.class);
        assertThat(stages).containsExactly(AnalysisStage.CANCELLED);
    }

    @Test
    void failingRuleShowsUpAsRuleFailure() {
        RuleRegistry registry = RuleRegistry.of(Rules.of("broken", null, text -> {
            throw new IllegalStateException("bad rule");
        }));

        DocumentReport report;
        try (AnalysisPipeline pipeline = new AnalysisPipeline(settings, registry)) {
            report = pipeline.analyze(MarkupDocument.parse(HTML));
        }

        assertThat(report.hasRuleFailures()).isTrue();
        assertThat(report.ruleFailures()).hasSize(5);
        assertThat(report.summary().qualityScore()).isEqualTo(100);
    }

    @Test
    void emptyDocumentProducesEmptyReport() {
        DocumentReport report;
        try (AnalysisPipeline pipeline = new AnalysisPipeline(settings, BuiltInRules.registry())) {
            report = pipeline.analyze(MarkupDocument.parse(""));
        }

        assertThat(report.sentences()).isEmpty();
        assertThat(report.summary().qualityScore()).isZero();
    }
}
