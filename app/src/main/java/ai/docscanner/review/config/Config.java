package ai.docscanner.review.config;

import ai.docscanner.review.pipeline.AnalysisSettings;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path inputFile,
        LogFormat logFormat,
        boolean verbose,
        AnalysisSettings analysisSettings,
        boolean suggestionsEnabled,
        String documentType,
        SuggestionConfig suggestionConfig,
        Secrets secrets
) {

    public Config {
        Objects.requireNonNull(inputFile, "inputFile");
        Objects.requireNonNull(logFormat, "logFormat");
        Objects.requireNonNull(analysisSettings, "analysisSettings");
        Objects.requireNonNull(suggestionConfig, "suggestionConfig");
        secrets = secrets == null ? Secrets.none() : secrets;
        if (documentType == null || documentType.isBlank()) {
            throw new IllegalArgumentException("documentType must not be blank");
        }
    }
}
