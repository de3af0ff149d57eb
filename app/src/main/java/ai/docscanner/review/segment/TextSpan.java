package ai.docscanner.review.segment;

/**
 * Half-open character range {@code [start, end)} within a block's plain text.
 */
public record TextSpan(int start, int end) {

    public TextSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid text span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    /**
     * Narrows the span so it neither starts nor ends with whitespace.
     */
    public TextSpan trimmed(String text) {
        int s = start;
        int e = Math.min(end, text.length());
        while (s < e && Character.isWhitespace(text.charAt(s))) {
            s++;
        }
        while (e > s && Character.isWhitespace(text.charAt(e - 1))) {
            e--;
        }
        return new TextSpan(s, e);
    }

    public String slice(String text) {
        return text.substring(start, end);
    }
}
