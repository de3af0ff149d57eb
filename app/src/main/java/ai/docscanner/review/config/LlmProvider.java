package ai.docscanner.review.config;

import java.util.Locale;

/**
 * Supported large language model providers for writing suggestions.
 */
public enum LlmProvider {
    GEMINI,
    OLLAMA;

    public static LlmProvider from(String value) {
        if (value == null) {
            return OLLAMA;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "gemini" -> GEMINI;
            case "ollama", "" -> OLLAMA;
            default -> throw new IllegalArgumentException("Unsupported LLM provider: " + value);
        };
    }
}
