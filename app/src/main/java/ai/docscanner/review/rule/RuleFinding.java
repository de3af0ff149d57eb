package ai.docscanner.review.rule;

import java.util.Objects;

/**
 * A single finding of a rule. Offsets are relative to the text the rule was invoked with. Legacy findings carry
 * only a message and report {@code start == end == 0} with empty text.
 */
public record RuleFinding(String text, int start, int end, String message) {

    public RuleFinding {
        text = text == null ? "" : text;
        Objects.requireNonNull(message, "message");
        if (message.isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid finding range [" + start + ", " + end + ")");
        }
    }

    public static RuleFinding legacy(String message) {
        return new RuleFinding("", 0, 0, message);
    }

    public boolean hasPosition() {
        return end > start;
    }
}
