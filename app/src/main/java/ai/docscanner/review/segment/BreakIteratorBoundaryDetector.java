package ai.docscanner.review.segment;

import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Dictionary and rule based sentence detection backed by the JDK {@link BreakIterator}.
 */
public class BreakIteratorBoundaryDetector implements SentenceBoundaryDetector {

    private final Locale locale;

    public BreakIteratorBoundaryDetector() {
        this(Locale.ENGLISH);
    }

    public BreakIteratorBoundaryDetector(Locale locale) {
        this.locale = Objects.requireNonNull(locale, "locale");
    }

    @Override
    public String name() {
        return "break-iterator";
    }

    @Override
    public boolean isAvailable() {
        return Arrays.stream(BreakIterator.getAvailableLocales())
                .anyMatch(available -> available.getLanguage().equals(locale.getLanguage()));
    }

    @Override
    public List<TextSpan> detect(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        // BreakIterator instances are stateful, one per call
        BreakIterator iterator = BreakIterator.getSentenceInstance(locale);
        iterator.setText(text);
        List<TextSpan> spans = new ArrayList<>();
        int start = iterator.first();
        for (int end = iterator.next(); end != BreakIterator.DONE; start = end, end = iterator.next()) {
            TextSpan span = new TextSpan(start, end).trimmed(text);
            if (span.length() > 0) {
                spans.add(span);
            }
        }
        return spans;
    }
}
