package ai.docscanner.review.rule.builtin;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags a word written twice in a row, such as "the the".
 */
public final class RepeatedWordRule extends PatternRule {

    public static final String ID = "repeated-words";

    private static final Pattern REPEATED = Pattern.compile("\\b(\\w+)\\s+\\1\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    // Short words that are almost always typos when doubled.
    private static final Set<String> COMMON_MISTAKES = Set.of(
            "is", "it", "in", "on", "to", "of", "or", "at", "be", "we", "he", "me");
    private static final Set<String> INTENTIONAL = Set.of(
            "very", "so", "no", "yes", "well", "now", "oh", "ah", "ha");

    public RepeatedWordRule() {
        super(REPEATED);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    boolean accept(Matcher match, String text) {
        String word = match.group(1).toLowerCase(Locale.ROOT);
        if (word.length() <= 2 && !COMMON_MISTAKES.contains(word)) {
            return false;
        }
        return !INTENTIONAL.contains(word);
    }

    @Override
    String message(Matcher match) {
        return "Repeated word detected: remove the duplicate '" + match.group(1).toLowerCase(Locale.ROOT)
                + "' for clarity.";
    }
}
