package ai.docscanner.review.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Punctuation based fallback: a boundary follows a run of {@code .!?} when whitespace and an uppercase
 * letter or digit come next.
 */
public class RegexBoundaryDetector implements SentenceBoundaryDetector {

    private static final Pattern BOUNDARY = Pattern.compile("[.!?]+(?=\\s+[\\p{Lu}\\d])");

    @Override
    public String name() {
        return "regex";
    }

    @Override
    public List<TextSpan> detect(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<TextSpan> spans = new ArrayList<>();
        Matcher matcher = BOUNDARY.matcher(text);
        int start = 0;
        while (matcher.find()) {
            addTrimmed(spans, text, start, matcher.end());
            start = matcher.end();
        }
        addTrimmed(spans, text, start, text.length());
        return spans;
    }

    private void addTrimmed(List<TextSpan> spans, String text, int start, int end) {
        TextSpan span = new TextSpan(start, end).trimmed(text);
        if (span.length() > 0) {
            spans.add(span);
        }
    }
}
