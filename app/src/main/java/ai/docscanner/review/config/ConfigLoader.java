package ai.docscanner.review.config;

import ai.docscanner.review.cli.CliArguments;
import ai.docscanner.review.pipeline.AnalysisSettings;
import ai.docscanner.review.rule.RuleRunner;
import ai.docscanner.review.rule.RuleScope;
import ai.docscanner.review.segment.SegmentationStrategy;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LOG_VERBOSE = "LOG_VERBOSE";
    static final String ENV_SEGMENTATION_STRATEGY = "SEGMENTATION_STRATEGY";
    static final String ENV_MIN_SENTENCE_CHARS = "MIN_SENTENCE_CHARS";
    static final String ENV_MIN_SENTENCE_TOKENS = "MIN_SENTENCE_TOKENS";
    static final String ENV_FRAGMENT_THRESHOLD_CHARS = "FRAGMENT_THRESHOLD_CHARS";
    static final String ENV_RULE_TIMEOUT_MILLIS = "RULE_TIMEOUT_MILLIS";
    static final String ENV_RULE_THREADS = "RULE_THREADS";
    static final String ENV_RULE_SCOPE = "RULE_SCOPE";
    static final String ENV_DEDUP_OVERLAP_RATIO = "DEDUP_OVERLAP_RATIO";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_DOCUMENT_TYPE = "DOCUMENT_TYPE";

    private static final String DEFAULT_DOCUMENT_TYPE = "general";
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        if (arguments.file() == null) {
            throw new IllegalArgumentException("An input file must be provided");
        }
        LogFormat logFormat = arguments.logFormat() != null
                ? arguments.logFormat()
                : environmentReader.text(ENV_LOG_FORMAT).map(LogFormat::from).orElse(LogFormat.TEXT);
        boolean verbose = arguments.verbose() || environmentReader.flag(ENV_LOG_VERBOSE);
        AnalysisSettings settings = resolveAnalysisSettings(arguments);

        Optional<String> geminiApiKey = environmentReader.text(ENV_GEMINI_API_KEY);

        LlmProvider provider = environmentReader.text(ENV_LLM_PROVIDER)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OLLAMA);

        String modelName = environmentReader.text(ENV_LLM_MODEL).orElse(defaultModelFor(provider));

        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            baseUrl = Optional.of(environmentReader.text(ENV_OLLAMA_BASE_URL).orElse(DEFAULT_OLLAMA_BASE_URL));
        }

        String documentType = arguments.documentType() != null && !arguments.documentType().isBlank()
                ? arguments.documentType().trim()
                : environmentReader.text(ENV_DOCUMENT_TYPE).orElse(DEFAULT_DOCUMENT_TYPE);

        return new Config(arguments.file(), logFormat, verbose, settings, arguments.suggest(),
                documentType.toLowerCase(Locale.ROOT), new SuggestionConfig(provider, modelName, baseUrl),
                new Secrets(geminiApiKey));
    }

    private AnalysisSettings resolveAnalysisSettings(CliArguments arguments) {
        AnalysisSettings defaults = AnalysisSettings.defaults();

        SegmentationStrategy strategy = arguments.segmentationStrategy() != null
                ? arguments.segmentationStrategy()
                : environmentReader.text(ENV_SEGMENTATION_STRATEGY)
                .map(SegmentationStrategy::from)
                .orElse(defaults.segmentationStrategy());

        RuleScope ruleScope = arguments.ruleScope() != null
                ? arguments.ruleScope()
                : environmentReader.text(ENV_RULE_SCOPE)
                .map(RuleScope::from)
                .orElse(defaults.ruleScope());

        long timeoutMillis = arguments.ruleTimeoutMillis() != null
                ? requirePositive(arguments.ruleTimeoutMillis(), "--rule-timeout")
                : environmentReader.integer(ENV_RULE_TIMEOUT_MILLIS, 1).orElse((int) defaults.ruleTimeout().toMillis());

        int threads = arguments.threads() != null
                ? (int) requirePositive(arguments.threads(), "--threads")
                : environmentReader.integer(ENV_RULE_THREADS, 1).orElse(RuleRunner.defaultThreads());

        int minChars = environmentReader.integer(ENV_MIN_SENTENCE_CHARS, 0).orElse(defaults.minSentenceChars());
        int minTokens = environmentReader.integer(ENV_MIN_SENTENCE_TOKENS, 1).orElse(defaults.minSentenceTokens());
        int fragmentThreshold = environmentReader.integer(ENV_FRAGMENT_THRESHOLD_CHARS, 0)
                .orElse(defaults.fragmentThresholdChars());
        double overlapRatio = environmentReader.ratio(ENV_DEDUP_OVERLAP_RATIO).orElse(defaults.dedupOverlapRatio());

        return new AnalysisSettings(strategy, defaults.locale(), minChars, minTokens, fragmentThreshold,
                Duration.ofMillis(timeoutMillis), threads, ruleScope, overlapRatio);
    }

    private String defaultModelFor(LlmProvider provider) {
        return switch (provider) {
            case GEMINI -> "models/gemini-1.5-pro-latest";
            case OLLAMA -> "llama3.1";
        };
    }

    private static long requirePositive(long value, String option) {
        if (value < 1) {
            throw new IllegalArgumentException(option + " must be greater than zero");
        }
        return value;
    }
}
