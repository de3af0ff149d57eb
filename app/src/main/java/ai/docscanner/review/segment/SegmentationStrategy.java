package ai.docscanner.review.segment;

import java.util.Locale;

/**
 * Selects which sentence boundary detector the segmenter uses.
 */
public enum SegmentationStrategy {
    AUTO,
    BREAK_ITERATOR,
    REGEX;

    public static SegmentationStrategy from(String raw) {
        if (raw == null || raw.isBlank()) {
            return AUTO;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (SegmentationStrategy strategy : values()) {
            if (strategy.name().equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unsupported segmentation strategy: " + raw);
    }

    public SentenceBoundaryDetector createDetector(Locale locale) {
        return switch (this) {
            case AUTO -> new FallbackBoundaryDetector(new BreakIteratorBoundaryDetector(locale), new RegexBoundaryDetector());
            case BREAK_ITERATOR -> new BreakIteratorBoundaryDetector(locale);
            case REGEX -> new RegexBoundaryDetector();
        };
    }
}
