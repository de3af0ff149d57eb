package ai.docscanner.review.pipeline;

import ai.docscanner.review.rule.RuleRunner;
import ai.docscanner.review.rule.RuleScope;
import ai.docscanner.review.segment.SegmentationStrategy;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Tunables of the analysis engine.
 */
public record AnalysisSettings(SegmentationStrategy segmentationStrategy,
                               Locale locale,
                               int minSentenceChars,
                               int minSentenceTokens,
                               int fragmentThresholdChars,
                               Duration ruleTimeout,
                               int ruleThreads,
                               RuleScope ruleScope,
                               double dedupOverlapRatio) {

    public static final int DEFAULT_MIN_SENTENCE_CHARS = 3;
    public static final int DEFAULT_MIN_SENTENCE_TOKENS = 2;
    public static final int DEFAULT_FRAGMENT_THRESHOLD_CHARS = 150;
    public static final double DEFAULT_DEDUP_OVERLAP_RATIO = 0.8d;

    public AnalysisSettings {
        Objects.requireNonNull(segmentationStrategy, "segmentationStrategy");
        Objects.requireNonNull(locale, "locale");
        Objects.requireNonNull(ruleTimeout, "ruleTimeout");
        Objects.requireNonNull(ruleScope, "ruleScope");
        if (minSentenceChars < 0) {
            throw new IllegalArgumentException("minSentenceChars must be zero or greater");
        }
        if (minSentenceTokens < 1) {
            throw new IllegalArgumentException("minSentenceTokens must be at least 1");
        }
        if (fragmentThresholdChars < 0) {
            throw new IllegalArgumentException("fragmentThresholdChars must be zero or greater");
        }
        if (ruleTimeout.isZero() || ruleTimeout.isNegative()) {
            throw new IllegalArgumentException("ruleTimeout must be positive");
        }
        if (ruleThreads < 1) {
            throw new IllegalArgumentException("ruleThreads must be at least 1");
        }
        if (dedupOverlapRatio <= 0d || dedupOverlapRatio > 1d) {
            throw new IllegalArgumentException("dedupOverlapRatio must be within (0, 1]");
        }
    }

    public static AnalysisSettings defaults() {
        return new AnalysisSettings(SegmentationStrategy.AUTO,
                Locale.ENGLISH,
                DEFAULT_MIN_SENTENCE_CHARS,
                DEFAULT_MIN_SENTENCE_TOKENS,
                DEFAULT_FRAGMENT_THRESHOLD_CHARS,
                RuleRunner.DEFAULT_TIMEOUT,
                RuleRunner.defaultThreads(),
                RuleScope.BOTH,
                DEFAULT_DEDUP_OVERLAP_RATIO);
    }

    public AnalysisSettings withRuleTimeout(Duration timeout) {
        return new AnalysisSettings(segmentationStrategy, locale, minSentenceChars, minSentenceTokens,
                fragmentThresholdChars, timeout, ruleThreads, ruleScope, dedupOverlapRatio);
    }

    public AnalysisSettings withRuleScope(RuleScope scope) {
        return new AnalysisSettings(segmentationStrategy, locale, minSentenceChars, minSentenceTokens,
                fragmentThresholdChars, ruleTimeout, ruleThreads, scope, dedupOverlapRatio);
    }

    public AnalysisSettings withRuleThreads(int threads) {
        return new AnalysisSettings(segmentationStrategy, locale, minSentenceChars, minSentenceTokens,
                fragmentThresholdChars, ruleTimeout, threads, ruleScope, dedupOverlapRatio);
    }

    public AnalysisSettings withSegmentationStrategy(SegmentationStrategy strategy) {
        return new AnalysisSettings(strategy, locale, minSentenceChars, minSentenceTokens,
                fragmentThresholdChars, ruleTimeout, ruleThreads, ruleScope, dedupOverlapRatio);
    }
}
