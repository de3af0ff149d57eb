package ai.docscanner.review.rule;

import java.util.Locale;

/**
 * Which granularities the runner invokes rules at.
 */
public enum RuleScope {
    BOTH,
    DOCUMENT,
    SENTENCE;

    public static RuleScope from(String raw) {
        if (raw == null || raw.isBlank()) {
            return BOTH;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (RuleScope scope : values()) {
            if (scope.name().equals(normalized)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unsupported rule scope: " + raw);
    }

    public boolean includesDocument() {
        return this != SENTENCE;
    }

    public boolean includesSentences() {
        return this != DOCUMENT;
    }
}
