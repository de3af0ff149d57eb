package ai.docscanner.review.markup;

import java.util.regex.Pattern;

/**
 * Small text predicates shared by block extraction and sentence filtering.
 */
public final class PlainText {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");
    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile("[\\s\\u00A0]+([.,!?;:])");
    private static final Pattern PUNCTUATION_ONLY = Pattern.compile("[\\p{P}\\p{S}\\s\\u00A0]*");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\p{P}\\s\\u00A0]+$");

    private PlainText() {
    }

    /**
     * Collapses whitespace runs into single spaces, removes whitespace in front of closing punctuation and trims.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(text).replaceAll(" ");
        return SPACE_BEFORE_PUNCTUATION.matcher(collapsed).replaceAll("$1").trim();
    }

    public static boolean isPunctuationOnly(String text) {
        return text == null || PUNCTUATION_ONLY.matcher(text).matches();
    }

    public static int tokenCount(String text) {
        if (text == null) {
            return 0;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        return WHITESPACE.split(trimmed).length;
    }

    public static String stripTrailingPunctuation(String text) {
        if (text == null) {
            return "";
        }
        return TRAILING_PUNCTUATION.matcher(text).replaceAll("");
    }
}
