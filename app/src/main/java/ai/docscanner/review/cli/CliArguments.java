package ai.docscanner.review.cli;

import ai.docscanner.review.config.LogFormat;
import ai.docscanner.review.rule.RuleScope;
import ai.docscanner.review.segment.SegmentationStrategy;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "review", mixinStandardHelpOptions = true,
        description = "Reviews a document for writing-quality issues and reports them per sentence")
public class CliArguments {

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "FILE",
            description = "Document to review (.html, .htm, .md, .markdown, .txt, .adoc)")
    private Path file;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json",
            converter = OptionConverters.LogFormats.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"},
            description = "Log engine diagnostics such as dropped sentences and unplaced issues")
    private boolean verbose;

    @CommandLine.Option(names = "--segmentation", description = "Sentence boundary detection: auto, break-iterator or regex",
            converter = OptionConverters.SegmentationStrategies.class)
    private SegmentationStrategy segmentationStrategy;

    @CommandLine.Option(names = "--rule-scope", description = "Rule granularity: both, document or sentence",
            converter = OptionConverters.RuleScopes.class)
    private RuleScope ruleScope;

    @CommandLine.Option(names = "--rule-timeout", description = "Time budget of a single rule invocation in milliseconds",
            paramLabel = "MILLIS")
    private Long ruleTimeoutMillis;

    @CommandLine.Option(names = "--threads", description = "Number of rule worker threads", paramLabel = "COUNT")
    private Integer threads;

    @CommandLine.Option(names = "--suggest", description = "Ask the configured language model for a rewrite of each flagged sentence")
    private boolean suggest;

    @CommandLine.Option(names = "--document-type", description = "Document type used for suggestions, e.g. technical or business",
            paramLabel = "TYPE")
    private String documentType;

    public Path file() {
        return file;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }

    public SegmentationStrategy segmentationStrategy() {
        return segmentationStrategy;
    }

    public RuleScope ruleScope() {
        return ruleScope;
    }

    public Long ruleTimeoutMillis() {
        return ruleTimeoutMillis;
    }

    public Integer threads() {
        return threads;
    }

    public boolean suggest() {
        return suggest;
    }

    public String documentType() {
        return documentType;
    }
}
