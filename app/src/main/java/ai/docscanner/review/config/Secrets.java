package ai.docscanner.review.config;

import java.util.Optional;

/**
 * Holds credentials for external model providers.
 */
public record Secrets(Optional<String> geminiApiKey) {

    public Secrets {
        geminiApiKey = geminiApiKey == null ? Optional.empty() : geminiApiKey;
    }

    public static Secrets none() {
        return new Secrets(Optional.empty());
    }

    @Override
    public String toString() {
        return "Secrets[geminiApiKey=" + (geminiApiKey.isPresent() ? "***" : "<unset>") + "]";
    }
}
