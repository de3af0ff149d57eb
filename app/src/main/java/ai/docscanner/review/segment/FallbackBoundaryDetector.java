package ai.docscanner.review.segment;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uses the primary detector while it is available and working, the fallback otherwise.
 */
public class FallbackBoundaryDetector implements SentenceBoundaryDetector {

    private static final Logger LOGGER = LoggerFactory.getLogger(FallbackBoundaryDetector.class);

    private final SentenceBoundaryDetector primary;
    private final SentenceBoundaryDetector fallback;
    private final boolean primaryAvailable;

    public FallbackBoundaryDetector(SentenceBoundaryDetector primary, SentenceBoundaryDetector fallback) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        this.primaryAvailable = primary.isAvailable();
        if (!primaryAvailable) {
            LOGGER.warn("Sentence detector '{}' is unavailable; using '{}'", primary.name(), fallback.name());
        }
    }

    @Override
    public String name() {
        return primary.name() + "+" + fallback.name();
    }

    @Override
    public List<TextSpan> detect(String text) {
        if (!primaryAvailable) {
            return fallback.detect(text);
        }
        try {
            return primary.detect(text);
        } catch (RuntimeException ex) {
            LOGGER.warn("Sentence detector '{}' failed ({}); using '{}'", primary.name(), ex.getMessage(), fallback.name());
            return fallback.detect(text);
        }
    }
}
