package ai.docscanner.review.rule.builtin;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Flags wordy stock phrases that have a shorter equivalent.
 */
public final class RedundantPhraseRule extends PatternRule {

    public static final String ID = "redundant-phrases";
    public static final String CATEGORY = "conciseness";

    private static final Map<String, String> REPLACEMENTS = replacements();

    private static final Pattern PHRASES = Pattern.compile(REPLACEMENTS.keySet().stream()
            .map(phrase -> phrase.replace(" ", "\\s+"))
            .collect(Collectors.joining("|", "\\b(?:", ")\\b")), Pattern.CASE_INSENSITIVE);

    public RedundantPhraseRule() {
        super(PHRASES);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String category() {
        return CATEGORY;
    }

    @Override
    String message(Matcher match) {
        String phrase = match.group();
        String key = phrase.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        return "Redundant phrase: replace '" + phrase + "' with '" + REPLACEMENTS.get(key) + "' for conciseness.";
    }

    private static Map<String, String> replacements() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("in order to", "to");
        map.put("in the process of", "while");
        map.put("for the purpose of", "to");
        map.put("in the event that", "if");
        map.put("due to the fact that", "because");
        map.put("by means of", "by");
        map.put("with regard to", "about");
        map.put("with respect to", "about");
        map.put("in relation to", "about");
        map.put("at the present time", "now");
        map.put("at this point in time", "now");
        map.put("in the near future", "soon");
        map.put("utilize", "use");
        return map;
    }
}
