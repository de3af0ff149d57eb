package ai.docscanner.review.rule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import ai.docscanner.review.markup.Block;
import ai.docscanner.review.markup.BlockKind;
import ai.docscanner.review.normalize.FlattenedDocument;
import ai.docscanner.review.normalize.Normalizer;
import ai.docscanner.review.pipeline.AnalysisCancelledException;
import ai.docscanner.review.pipeline.CancellationToken;
import ai.docscanner.review.segment.RegexBoundaryDetector;
import ai.docscanner.review.segment.Sentence;
import ai.docscanner.review.segment.SentenceSegmenter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RuleRunnerTest {

    private static final Duration SHORT_TIMEOUT = Duration.ofMillis(200);

    @Test
    @DisplayName("A throwing or hanging rule yields no issues but does not affect the other rules")
    void isolatesFailingRules() {
        Rule boom = Rules.of("boom", null, text -> {
            throw new IllegalStateException("broken rule");
        });
        Rule slow = Rules.of("slow", null, text -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return List.of();
        });
        Rule ok = Rules.of("ok", null, text -> List.of(new RuleFinding("Click", 0, 5, "found")));
        Analyzed analyzed = analyze("Click Save to continue.");

        RuleRunResult result;
        try (RuleRunner runner = new RuleRunner(RuleRegistry.of(boom, slow, ok), RuleScope.DOCUMENT, SHORT_TIMEOUT, 3)) {
            result = runner.run(analyzed.document(), analyzed.sentences(), CancellationToken.create());
        }

        assertThat(result.issues()).extracting(Issue::ruleId, Issue::message).containsExactly(tuple("ok", "found"));
        assertThat(result.failures())
                .extracting(RuleFailure::ruleId, RuleFailure::reason)
                .containsExactly(tuple("boom", FailureReason.ERROR), tuple("slow", FailureReason.TIMEOUT));
    }

    @Test
    void workerRecoversAfterTimeout() {
        AtomicInteger calls = new AtomicInteger();
        Rule sometimesSlow = Rules.of("sometimes-slow", null, text -> {
            if (calls.getAndIncrement() == 0) {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            }
            return List.of(RuleFinding.legacy("checked"));
        });
        Analyzed analyzed = analyze("First sentence here. Second sentence here.");

        RuleRunResult result;
        try (RuleRunner runner = new RuleRunner(RuleRegistry.of(sometimesSlow), RuleScope.SENTENCE, SHORT_TIMEOUT, 1)) {
            result = runner.run(analyzed.document(), analyzed.sentences(), CancellationToken.create());
        }

        assertThat(result.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.reason()).isEqualTo(FailureReason.TIMEOUT);
            assertThat(failure.sentenceIndex()).isEqualTo(OptionalInt.of(0));
        });
        assertThat(result.issues()).singleElement().satisfies(issue ->
                assertThat(issue.sentenceHint()).isEqualTo(OptionalInt.of(1)));
    }

    @Test
    @DisplayName("A rule that ignores interrupts does not keep queued invocations from starting")
    void stuckWorkerIsReplacedSoQueuedRulesStillRun() {
        AtomicBoolean released = new AtomicBoolean();
        Rule spinning = Rules.of("spinning", null, text -> {
            while (!released.get()) {
                Thread.onSpinWait();
            }
            return List.of();
        });
        Rule after = Rules.of("after", null, text -> List.of(new RuleFinding("Click", 0, 5, "found")));
        Analyzed analyzed = analyze("Click Save to continue.");

        try (RuleRunner runner = new RuleRunner(RuleRegistry.of(spinning, after), RuleScope.DOCUMENT, SHORT_TIMEOUT, 1)) {
            RuleRunResult result = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> runner.run(analyzed.document(), analyzed.sentences(), CancellationToken.create()));

            assertThat(result.issues()).extracting(Issue::ruleId).containsExactly("after");
            assertThat(result.failures())
                    .extracting(RuleFailure::ruleId, RuleFailure::reason)
                    .containsExactly(tuple("spinning", FailureReason.TIMEOUT));
            assertThat(runner.poolSize()).isEqualTo(2);
        } finally {
            released.set(true);
        }
    }

    @Test
    @DisplayName("Document findings that join the end of one block with the start of the next are dropped")
    void dropsDocumentFindingsAcrossBlockBoundaries() {
        Rule pairs = Rules.of("pairs", null, text -> List.of(
                new RuleFinding("server Server", 14, 27, "across"),
                new RuleFinding("Server settings", 21, 36, "inside")));
        Analyzed analyzed = analyze(List.of("Configure the server", "Server settings live in one file."));

        RuleRunResult result;
        try (RuleRunner runner = new RuleRunner(RuleRegistry.of(pairs), RuleScope.DOCUMENT, SHORT_TIMEOUT, 1)) {
            result = runner.run(analyzed.document(), analyzed.sentences(), CancellationToken.create());
        }

        assertThat(analyzed.document().text()).startsWith("Configure the server Server settings");
        assertThat(result.issues()).extracting(Issue::message).containsExactly("inside");
        assertThat(result.failures()).isEmpty();
    }

    @Test
    void reportsMalformedOutput() {
        Rule nullList = Rules.of("null-list", null, text -> null);
        Rule nullEntry = Rules.of("null-entry", null, text -> Arrays.asList(RuleFinding.legacy("kept?"), null));
        Analyzed analyzed = analyze("Click Save to continue.");

        RuleRunResult result;
        try (RuleRunner runner = new RuleRunner(RuleRegistry.of(nullList, nullEntry), RuleScope.DOCUMENT, SHORT_TIMEOUT, 2)) {
            result = runner.run(analyzed.document(), analyzed.sentences(), CancellationToken.create());
        }

        assertThat(result.issues()).isEmpty();
        assertThat(result.failures()).extracting(RuleFailure::ruleId, RuleFailure::reason).containsExactly(
                tuple("null-list", FailureReason.MALFORMED),
                tuple("null-entry", FailureReason.MALFORMED));
    }

    @Test
    @DisplayName("Merge order is document scope first, then rule order, then sentence order, regardless of scheduling")
    void mergesInStableOrder() {
        Rule alpha = labelled("alpha");
        Rule beta = labelled("beta");
        Analyzed analyzed = analyze("One is here. Two is here. Three is here. Four is here. Five is here.");

        List<String> labels = new ArrayList<>();
        try (RuleRunner runner = new RuleRunner(RuleRegistry.of(alpha, beta), RuleScope.BOTH, Duration.ofSeconds(5), 4)) {
            RuleRunResult result = runner.run(analyzed.document(), analyzed.sentences(), CancellationToken.create());
            for (Issue issue : result.issues()) {
                labels.add(issue.ruleId() + ":" + issue.scope() + ":"
                        + (issue.sentenceHint().isPresent() ? issue.sentenceHint().getAsInt() : "-"));
            }
        }

        assertThat(labels).containsExactly(
                "alpha:DOCUMENT:-", "beta:DOCUMENT:-",
                "alpha:SENTENCE:0", "alpha:SENTENCE:1", "alpha:SENTENCE:2", "alpha:SENTENCE:3", "alpha:SENTENCE:4",
                "beta:SENTENCE:0", "beta:SENTENCE:1", "beta:SENTENCE:2", "beta:SENTENCE:3", "beta:SENTENCE:4");
    }

    @Test
    void legacyRulesProducePositionlessIssues() {
        Rule legacy = Rules.legacy("legacy", "style", text -> List.of("Consider rewording."));
        Analyzed analyzed = analyze("Click Save to continue.");

        RuleRunResult result;
        try (RuleRunner runner = new RuleRunner(RuleRegistry.of(legacy))) {
            result = runner.run(analyzed.document(), analyzed.sentences(), CancellationToken.create());
        }

        assertThat(result.failures()).isEmpty();
        assertThat(result.issues()).hasSize(2).allSatisfy(issue -> {
            assertThat(issue.isPositionless()).isTrue();
            assertThat(issue.category()).isEqualTo("style");
        });
        assertThat(result.issues()).extracting(Issue::scope).containsExactly(IssueScope.DOCUMENT, IssueScope.SENTENCE);
    }

    @Test
    void cancelledRunRaisesCancellation() {
        Analyzed analyzed = analyze("Click Save to continue. Open the console.");
        CancellationToken token = CancellationToken.create();
        Rule cancelling = Rules.of("cancelling", null, text -> {
            token.cancel();
            return List.of();
        });

        Throwable thrown;
        try (RuleRunner runner = new RuleRunner(RuleRegistry.of(cancelling), RuleScope.BOTH, SHORT_TIMEOUT, 1)) {
            thrown = catchThrowable(() -> runner.run(analyzed.document(), analyzed.sentences(), token));
        }

        assertThat(thrown).isInstanceOf(AnalysisCancelledException.class);
    }

    @Test
    void alreadyCancelledTokenStopsBeforeAnyInvocation() {
        AtomicInteger calls = new AtomicInteger();
        Rule counting = Rules.of("counting", null, text -> {
            calls.incrementAndGet();
            return List.of();
        });
        Analyzed analyzed = analyze("Click Save to continue.");
        CancellationToken token = CancellationToken.create();
        token.cancel();

        Throwable thrown;
        try (RuleRunner runner = new RuleRunner(RuleRegistry.of(counting))) {
            thrown = catchThrowable(() -> runner.run(analyzed.document(), analyzed.sentences(), token));
        }

        assertThat(thrown).isInstanceOf(AnalysisCancelledException.class);
        assertThat(calls).hasValue(0);
    }

    @Test
    void registryRejectsDuplicateIds() {
        Rule first = Rules.legacy("dup", null, text -> List.of());
        Rule second = Rules.legacy("dup", null, text -> List.of());

        Throwable thrown = catchThrowable(() -> RuleRegistry.of(first, second));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("dup");
    }

    private static Rule labelled(String id) {
        return Rules.of(id, null, text -> {
            try {
                // Vary the run time so completion order differs from submission order.
                Thread.sleep((long) (Math.abs(text.hashCode()) % 20));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return List.of(RuleFinding.legacy(id));
        });
    }

    private static Analyzed analyze(String text) {
        return analyze(List.of(text));
    }

    private static Analyzed analyze(List<String> texts) {
        Normalizer normalizer = new Normalizer();
        List<Block> blocks = new ArrayList<>();
        for (String text : texts) {
            blocks.add(new Block(text, "<p>" + text + "</p>", blocks.size(), BlockKind.PARAGRAPH));
        }
        FlattenedDocument document = normalizer.flatten(blocks);
        List<Sentence> sentences = normalizer.anchor(document,
                new SentenceSegmenter(new RegexBoundaryDetector()).segmentAll(blocks));
        return new Analyzed(document, sentences);
    }

    private record Analyzed(FlattenedDocument document, List<Sentence> sentences) {
    }
}
