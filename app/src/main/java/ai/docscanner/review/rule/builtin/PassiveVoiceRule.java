package ai.docscanner.review.rule.builtin;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags a form of "to be" followed by a regular past participle, e.g. "was created" or "needs to be converted".
 */
public final class PassiveVoiceRule extends PatternRule {

    public static final String ID = "passive-voice";

    private static final Pattern PASSIVE = Pattern.compile(
            "\\b(?:is|are|was|were|be|been|being)\\s+\\w+ed\\b|\\bit\\s+is\\s+used\\b",
            Pattern.CASE_INSENSITIVE);

    public PassiveVoiceRule() {
        super(PASSIVE);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    String message(Matcher match) {
        return "Passive voice detected: convert to active voice for clearer, more direct communication.";
    }
}
