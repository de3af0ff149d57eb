package ai.docscanner.review.rule.builtin;

import ai.docscanner.review.rule.Rule;
import ai.docscanner.review.rule.RuleFinding;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base for rules that report each match of a single pattern.
 */
abstract class PatternRule implements Rule {

    private final Pattern pattern;

    PatternRule(Pattern pattern) {
        this.pattern = pattern;
    }

    @Override
    public List<RuleFinding> run(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<RuleFinding> findings = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            if (accept(matcher, text)) {
                findings.add(new RuleFinding(matcher.group(), matcher.start(), matcher.end(), message(matcher)));
            }
        }
        return findings;
    }

    boolean accept(Matcher match, String text) {
        return true;
    }

    abstract String message(Matcher match);
}
