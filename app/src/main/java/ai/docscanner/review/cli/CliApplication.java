package ai.docscanner.review.cli;

import ai.docscanner.review.config.Config;
import ai.docscanner.review.config.ConfigLoader;
import ai.docscanner.review.config.EnvironmentReader;
import ai.docscanner.review.config.Secrets;
import ai.docscanner.review.config.SuggestionConfig;
import ai.docscanner.review.decode.DocumentDecoder;
import ai.docscanner.review.decode.DocumentDecoders;
import ai.docscanner.review.decode.DocumentDecodingException;
import ai.docscanner.review.logging.LoggingConfigurator;
import ai.docscanner.review.pipeline.AnalysisException;
import ai.docscanner.review.pipeline.AnalysisPipeline;
import ai.docscanner.review.pipeline.CancellationToken;
import ai.docscanner.review.rule.Issue;
import ai.docscanner.review.rule.builtin.BuiltInRules;
import ai.docscanner.review.score.DocumentReport;
import ai.docscanner.review.score.SentenceReport;
import ai.docscanner.review.suggest.ChatModelSuggestionProvider;
import ai.docscanner.review.suggest.SuggestionException;
import ai.docscanner.review.suggest.SuggestionProvider;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and analysis pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final Function<Config, SuggestionProvider> suggestionProviderFactory;
    private final ReportFormatter reportFormatter;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), CliApplication::createSuggestionProvider,
                new ReportFormatter());
    }

    CliApplication(ConfigLoader configLoader,
                   Function<Config, SuggestionProvider> suggestionProviderFactory,
                   ReportFormatter reportFormatter) {
        this.configLoader = configLoader;
        this.suggestionProviderFactory = suggestionProviderFactory;
        this.reportFormatter = reportFormatter;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CommandLine commandLine = new CommandLine(new CliArguments());
        return run(args, commandLine);
    }

    int run(String[] args, CommandLine commandLine) {
        CliArguments cliArguments = commandLine.getCommand();
        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.info("Reviewing {} (segmentation={}, ruleScope={}, timeout={} ms, threads={})",
                config.inputFile(), config.analysisSettings().segmentationStrategy(),
                config.analysisSettings().ruleScope(), config.analysisSettings().ruleTimeout().toMillis(),
                config.analysisSettings().ruleThreads());

        PrintWriter out = commandLine.getOut();
        PrintWriter err = commandLine.getErr();
        DocumentReport report;
        try {
            report = analyze(config);
        } catch (AnalysisException | DocumentDecodingException ex) {
            err.println("Analysis failed: " + ex.getMessage());
            return EXIT_FAILURE;
        } catch (IOException ex) {
            err.println("Cannot read " + config.inputFile() + ": " + ex.getMessage());
            return EXIT_FAILURE;
        }

        Map<Issue, String> suggestions = config.suggestionsEnabled()
                ? collectSuggestions(config, report)
                : Map.of();
        out.print(reportFormatter.format(report, suggestions));
        out.flush();
        if (report.hasRuleFailures()) {
            LOGGER.warn("{} rule invocation(s) failed; their findings are missing from the report",
                    report.ruleFailures().size());
        }
        return EXIT_OK;
    }

    private DocumentReport analyze(Config config) throws IOException {
        Path input = config.inputFile();
        DocumentDecoder decoder = DocumentDecoders.forFileName(input.getFileName().toString());
        String content = Files.readString(input, StandardCharsets.UTF_8);
        try (AnalysisPipeline pipeline = new AnalysisPipeline(config.analysisSettings(), BuiltInRules.registry())) {
            return pipeline.analyze(UUID.randomUUID().toString(), content, decoder, CancellationToken.create(),
                    (stage, message) -> LOGGER.debug("{}% {} {}", stage.percent(), stage, message));
        }
    }

    private Map<Issue, String> collectSuggestions(Config config, DocumentReport report) {
        SuggestionProvider provider;
        try {
            provider = suggestionProviderFactory.apply(config);
        } catch (IllegalStateException ex) {
            LOGGER.warn("Suggestions disabled: {}", ex.getMessage());
            return Map.of();
        }
        Map<Issue, String> suggestions = new LinkedHashMap<>();
        for (SentenceReport sentence : report.sentences()) {
            for (Issue issue : sentence.issues()) {
                try {
                    suggestions.put(issue, provider.suggest(issue.message(), sentence.sentence().plainText(),
                            config.documentType()));
                } catch (SuggestionException ex) {
                    LOGGER.warn("No suggestion for sentence {}: {}", sentence.sentence().index() + 1, ex.getMessage());
                }
            }
        }
        return suggestions;
    }

    private static SuggestionProvider createSuggestionProvider(Config config) {
        SuggestionConfig suggestionConfig = config.suggestionConfig();
        ChatModel chatModel = switch (suggestionConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(suggestionConfig);
            case GEMINI -> createGeminiChatModel(suggestionConfig, config.secrets());
        };
        return new ChatModelSuggestionProvider(chatModel, suggestionConfig.provider().name(), suggestionConfig.modelName());
    }

    private static ChatModel createOllamaChatModel(SuggestionConfig suggestionConfig) {
        try {
            String baseUrl = suggestionConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", suggestionConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(suggestionConfig.modelName())
                    .temperature(0.2)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private static ChatModel createGeminiChatModel(SuggestionConfig suggestionConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", suggestionConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(suggestionConfig.modelName())
                    .temperature(0.2)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
