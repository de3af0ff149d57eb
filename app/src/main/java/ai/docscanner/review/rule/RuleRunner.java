package ai.docscanner.review.rule;

import ai.docscanner.review.normalize.BlockOffsetMap;
import ai.docscanner.review.normalize.FlattenedDocument;
import ai.docscanner.review.pipeline.AnalysisCancelledException;
import ai.docscanner.review.pipeline.CancellationToken;
import ai.docscanner.review.segment.Sentence;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every registered rule against the flattened document and against each sentence on a bounded pool.
 *
 * <p>Each invocation gets its own time budget measured from the moment it starts. Failures of any kind are
 * isolated to the invocation that caused them. Results are merged in a stable order independent of scheduling:
 * document scope by registration order, then sentence scope by registration order and sentence order.</p>
 *
 * <p>A timed-out rule is interrupted. A rule that ignores the interrupt keeps its worker thread until it returns,
 * so the pool gets one extra worker for as long as that thread stays stuck and queued invocations still start.</p>
 */
public final class RuleRunner implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RuleRunner.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    public static final int MAX_DEFAULT_THREADS = 8;

    private final RuleRegistry registry;
    private final RuleScope ruleScope;
    private final long timeoutMillis;
    private final int baseThreads;
    private final AtomicInteger stuckWorkers = new AtomicInteger();
    private final ThreadPoolExecutor workers;
    private final ScheduledExecutorService watchdog;

    public RuleRunner(RuleRegistry registry) {
        this(registry, RuleScope.BOTH, DEFAULT_TIMEOUT, defaultThreads());
    }

    public RuleRunner(RuleRegistry registry, RuleScope ruleScope, Duration timeout, int threads) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.ruleScope = Objects.requireNonNull(ruleScope, "ruleScope");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1");
        }
        this.timeoutMillis = timeout.toMillis();
        this.baseThreads = threads;
        this.workers = new ThreadPoolExecutor(threads, threads, 30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), daemonThreads("rule-worker"));
        this.workers.allowCoreThreadTimeOut(true);
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, daemonThreads("rule-watchdog"));
        scheduler.setRemoveOnCancelPolicy(true);
        this.watchdog = scheduler;
    }

    public static int defaultThreads() {
        return Math.max(1, Math.min(MAX_DEFAULT_THREADS, Runtime.getRuntime().availableProcessors()));
    }

    public RuleRunResult run(FlattenedDocument document, List<Sentence> sentences, CancellationToken cancellation) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(cancellation, "cancellation");
        List<Sentence> targets = sentences == null ? List.of() : sentences;
        cancellation.throwIfCancellationRequested();

        List<Invocation> invocations = plan(document, targets);
        List<CompletableFuture<List<RuleFinding>>> pending = new ArrayList<>(invocations.size());
        for (Invocation invocation : invocations) {
            pending.add(submit(invocation, cancellation));
        }
        LOGGER.debug("Submitted {} rule invocations ({} rules, {} sentences)",
                invocations.size(), registry.size(), targets.size());

        List<Issue> issues = new ArrayList<>();
        List<RuleFailure> failures = new ArrayList<>();
        for (int i = 0; i < invocations.size(); i++) {
            collect(invocations.get(i), pending.get(i), issues, failures);
        }
        cancellation.throwIfCancellationRequested();
        return new RuleRunResult(issues, failures);
    }

    private List<Invocation> plan(FlattenedDocument document, List<Sentence> sentences) {
        List<Invocation> invocations = new ArrayList<>();
        if (ruleScope.includesDocument()) {
            for (Rule rule : registry.rules()) {
                invocations.add(new Invocation(rule, IssueScope.DOCUMENT, OptionalInt.empty(), document.text(),
                        document.offsets()));
            }
        }
        if (ruleScope.includesSentences()) {
            for (Rule rule : registry.rules()) {
                for (Sentence sentence : sentences) {
                    invocations.add(new Invocation(rule, IssueScope.SENTENCE, OptionalInt.of(sentence.index()),
                            sentence.plainText(), null));
                }
            }
        }
        return invocations;
    }

    private CompletableFuture<List<RuleFinding>> submit(Invocation invocation, CancellationToken cancellation) {
        CompletableFuture<List<RuleFinding>> result = new CompletableFuture<>();
        workers.execute(() -> execute(invocation, result, cancellation));
        return result;
    }

    private void execute(Invocation invocation,
                         CompletableFuture<List<RuleFinding>> result,
                         CancellationToken cancellation) {
        if (cancellation.isCancellationRequested()) {
            result.completeExceptionally(new AnalysisCancelledException("Skipped after cancellation"));
            return;
        }
        Thread worker = Thread.currentThread();
        Object lock = new Object();
        AtomicBoolean timedOut = new AtomicBoolean();
        ScheduledFuture<?> timer = watchdog.schedule(() -> {
            synchronized (lock) {
                if (!result.isDone()) {
                    result.completeExceptionally(new TimeoutException("Exceeded " + timeoutMillis + " ms"));
                    timedOut.set(true);
                    worker.interrupt();
                    addReplacementWorker(invocation);
                }
            }
        }, timeoutMillis, TimeUnit.MILLISECONDS);
        try {
            List<RuleFinding> findings = invocation.rule().run(invocation.text());
            synchronized (lock) {
                result.complete(findings);
            }
        } catch (RuntimeException ex) {
            synchronized (lock) {
                result.completeExceptionally(ex);
            }
        } finally {
            timer.cancel(false);
            synchronized (lock) {
                if (!result.isDone()) {
                    result.completeExceptionally(new IllegalStateException("Rule terminated abnormally"));
                }
                if (timedOut.get()) {
                    releaseReplacementWorker();
                }
            }
            // A late watchdog interrupt must not leak into the next task on this worker.
            Thread.interrupted();
        }
    }

    private void addReplacementWorker(Invocation invocation) {
        int size;
        synchronized (workers) {
            size = baseThreads + stuckWorkers.incrementAndGet();
            workers.setMaximumPoolSize(size);
            workers.setCorePoolSize(size);
        }
        LOGGER.warn("Rule {} is still running past its time budget; rule pool grown to {} threads",
                invocation.rule().id(), size);
    }

    private void releaseReplacementWorker() {
        synchronized (workers) {
            int size = baseThreads + stuckWorkers.decrementAndGet();
            workers.setCorePoolSize(size);
            workers.setMaximumPoolSize(size);
        }
    }

    int poolSize() {
        synchronized (workers) {
            return workers.getMaximumPoolSize();
        }
    }

    private void collect(Invocation invocation,
                         CompletableFuture<List<RuleFinding>> pending,
                         List<Issue> issues,
                         List<RuleFailure> failures) {
        List<RuleFinding> findings;
        try {
            findings = pending.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AnalysisCancelledException("Interrupted while waiting for rule results", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof AnalysisCancelledException) {
                return;
            }
            if (cause instanceof TimeoutException) {
                failures.add(fail(invocation, FailureReason.TIMEOUT, cause.getMessage()));
            } else {
                LOGGER.debug("Rule {} failure detail", invocation.rule().id(), cause);
                failures.add(fail(invocation, FailureReason.ERROR, String.valueOf(cause)));
            }
            return;
        }
        if (findings == null) {
            failures.add(fail(invocation, FailureReason.MALFORMED, "Rule returned no finding list"));
            return;
        }
        for (RuleFinding finding : findings) {
            if (finding == null) {
                failures.add(fail(invocation, FailureReason.MALFORMED, "Rule returned a null finding"));
                return;
            }
        }
        Rule rule = invocation.rule();
        for (RuleFinding finding : findings) {
            if (invocation.scope() == IssueScope.DOCUMENT) {
                if (spansBlockBoundary(invocation, finding)) {
                    LOGGER.debug("Dropping finding of rule {} at [{}, {}) that crosses a block boundary",
                            rule.id(), finding.start(), finding.end());
                    continue;
                }
                issues.add(Issue.document(rule.id(), rule.category(), finding));
            } else {
                issues.add(Issue.sentence(rule.id(), rule.category(), finding, invocation.sentenceIndex().getAsInt()));
            }
        }
    }

    /**
     * Block texts are joined by a plain space in the flattened document, so a document-scope match across that
     * join pairs words from two different elements.
     */
    private static boolean spansBlockBoundary(Invocation invocation, RuleFinding finding) {
        return finding.hasPosition()
                && finding.end() <= invocation.text().length()
                && !invocation.blocks().withinSingleBlock(finding.start(), finding.end());
    }

    private RuleFailure fail(Invocation invocation, FailureReason reason, String detail) {
        if (invocation.sentenceIndex().isPresent()) {
            LOGGER.warn("Rule {} failed on sentence {} ({}): {}", invocation.rule().id(),
                    invocation.sentenceIndex().getAsInt(), reason, detail);
        } else {
            LOGGER.warn("Rule {} failed on document ({}): {}", invocation.rule().id(), reason, detail);
        }
        return new RuleFailure(invocation.rule().id(), invocation.scope(), invocation.sentenceIndex(), reason, detail);
    }

    @Override
    public void close() {
        workers.shutdownNow();
        watchdog.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record Invocation(Rule rule,
                              IssueScope scope,
                              OptionalInt sentenceIndex,
                              String text,
                              BlockOffsetMap blocks) {
    }
}
