package ai.docscanner.review.rule.builtin;

import ai.docscanner.review.rule.RuleRegistry;

/**
 * The rule set registered at startup.
 */
public final class BuiltInRules {

    private BuiltInRules() {
    }

    public static RuleRegistry registry() {
        return RuleRegistry.of(
                new LongSentenceRule(),
                new PassiveVoiceRule(),
                new RepeatedWordRule(),
                new RedundantPhraseRule());
    }
}
