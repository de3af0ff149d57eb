package ai.docscanner.review.pipeline;

import ai.docscanner.review.decode.DocumentDecoder;
import ai.docscanner.review.decode.DocumentDecodingException;
import ai.docscanner.review.markup.Block;
import ai.docscanner.review.markup.BlockExtractor;
import ai.docscanner.review.markup.DefaultBlockExtractor;
import ai.docscanner.review.markup.MarkupDocument;
import ai.docscanner.review.normalize.FlattenedDocument;
import ai.docscanner.review.normalize.Normalizer;
import ai.docscanner.review.resolve.PositionResolver;
import ai.docscanner.review.resolve.SentenceIssueMap;
import ai.docscanner.review.rule.RuleRegistry;
import ai.docscanner.review.rule.RuleRunResult;
import ai.docscanner.review.rule.RuleRunner;
import ai.docscanner.review.score.DocumentReport;
import ai.docscanner.review.score.ScoreAggregator;
import ai.docscanner.review.segment.MarkupFragmentResolver;
import ai.docscanner.review.segment.Sentence;
import ai.docscanner.review.segment.SentenceDraft;
import ai.docscanner.review.segment.SentenceSegmenter;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs one document through extraction, segmentation, rule execution, position resolution and scoring.
 * Runs share no mutable state, so one pipeline may serve several concurrent runs.
 */
public class AnalysisPipeline implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisPipeline.class);

    static final String RUN_ID_KEY = "runId";

    private final BlockExtractor blockExtractor;
    private final SentenceSegmenter segmenter;
    private final Normalizer normalizer;
    private final RuleRunner ruleRunner;
    private final PositionResolver positionResolver;
    private final ScoreAggregator scoreAggregator;

    public AnalysisPipeline(AnalysisSettings settings, RuleRegistry registry) {
        this(new DefaultBlockExtractor(),
                new SentenceSegmenter(settings.segmentationStrategy().createDetector(settings.locale()),
                        new MarkupFragmentResolver(settings.fragmentThresholdChars()),
                        settings.minSentenceChars(),
                        settings.minSentenceTokens()),
                new Normalizer(),
                new RuleRunner(registry, settings.ruleScope(), settings.ruleTimeout(), settings.ruleThreads()),
                new PositionResolver(settings.dedupOverlapRatio()),
                new ScoreAggregator());
    }

    public AnalysisPipeline(BlockExtractor blockExtractor,
                            SentenceSegmenter segmenter,
                            Normalizer normalizer,
                            RuleRunner ruleRunner,
                            PositionResolver positionResolver,
                            ScoreAggregator scoreAggregator) {
        this.blockExtractor = Objects.requireNonNull(blockExtractor, "blockExtractor");
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.ruleRunner = Objects.requireNonNull(ruleRunner, "ruleRunner");
        this.positionResolver = Objects.requireNonNull(positionResolver, "positionResolver");
        this.scoreAggregator = Objects.requireNonNull(scoreAggregator, "scoreAggregator");
    }

    public DocumentReport analyze(MarkupDocument document) {
        return analyze(newRunId(), document, CancellationToken.create(), ProgressWriter.NONE);
    }

    /**
     * Decodes {@code content} first; a decoding failure ends the run with {@link AnalysisException}.
     */
    public DocumentReport analyze(String runId,
                                  String content,
                                  DocumentDecoder decoder,
                                  CancellationToken cancellation,
                                  ProgressWriter progress) {
        Objects.requireNonNull(decoder, "decoder");
        return execute(runId, cancellation, progress, () -> {
            try {
                return decoder.decode(content);
            } catch (DocumentDecodingException ex) {
                throw new AnalysisException("Failed to decode " + decoder.name() + " document: " + ex.getMessage(), ex);
            }
        });
    }

    public DocumentReport analyze(String runId,
                                  MarkupDocument document,
                                  CancellationToken cancellation,
                                  ProgressWriter progress) {
        return execute(runId, cancellation, progress, () -> {
            if (document == null) {
                throw new AnalysisException("No markup document to analyze");
            }
            return document;
        });
    }

    private DocumentReport execute(String runId,
                                   CancellationToken cancellation,
                                   ProgressWriter progress,
                                   DocumentSource source) {
        Objects.requireNonNull(cancellation, "cancellation");
        ProgressWriter writer = progress == null ? ProgressWriter.NONE : progress;
        MDC.put(RUN_ID_KEY, runId == null ? newRunId() : runId);
        try {
            DocumentReport report = runStages(source, cancellation, writer);
            writer.report(AnalysisStage.COMPLETE, "Analysis complete");
            LOGGER.info("Analysis complete: {} sentences, {} issues, score {}",
                    report.summary().totalSentences(), report.summary().totalIssues(),
                    report.summary().qualityScore());
            return report;
        } catch (AnalysisCancelledException ex) {
            LOGGER.info("Analysis cancelled");
            writer.report(AnalysisStage.CANCELLED, ex.getMessage());
            throw ex;
        } catch (RuntimeException ex) {
            LOGGER.error("Analysis failed: {}", ex.getMessage(), ex);
            writer.report(AnalysisStage.FAILED, ex.getMessage());
            throw ex;
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }

    private DocumentReport runStages(DocumentSource source, CancellationToken cancellation, ProgressWriter progress) {
        cancellation.throwIfCancellationRequested();
        progress.report(AnalysisStage.PARSING, "Extracting blocks");
        MarkupDocument document = source.load();
        List<Block> blocks = extractBlocks(document);
        LOGGER.debug("Extracted {} blocks", blocks.size());

        cancellation.throwIfCancellationRequested();
        progress.report(AnalysisStage.SEGMENTATION, "Splitting sentences");
        FlattenedDocument flattened = normalizer.flatten(blocks);
        List<SentenceDraft> drafts = segmenter.segmentAll(blocks);
        List<Sentence> sentences = normalizer.anchor(flattened, drafts);
        LOGGER.debug("Segmented {} sentences", sentences.size());

        cancellation.throwIfCancellationRequested();
        progress.report(AnalysisStage.RULE_EXECUTION, "Running rules");
        RuleRunResult ruleResult = ruleRunner.run(flattened, sentences, cancellation);

        cancellation.throwIfCancellationRequested();
        progress.report(AnalysisStage.SCORING, "Scoring");
        SentenceIssueMap issueMap = positionResolver.resolve(flattened, sentences, ruleResult.issues());
        return scoreAggregator.aggregate(flattened, sentences, issueMap, ruleResult.failures(),
                document == null ? "" : document.html());
    }

    private List<Block> extractBlocks(MarkupDocument document) {
        try {
            return blockExtractor.extract(document);
        } catch (AnalysisException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new AnalysisException("Failed to read markup: " + ex.getMessage(), ex);
        }
    }

    @Override
    public void close() {
        ruleRunner.close();
    }

    static String newRunId() {
        return UUID.randomUUID().toString();
    }

    @FunctionalInterface
    private interface DocumentSource {
        MarkupDocument load();
    }
}
