package ai.docscanner.review.pipeline;

import ai.docscanner.review.decode.DocumentDecoder;
import ai.docscanner.review.markup.MarkupDocument;
import ai.docscanner.review.score.DocumentReport;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs analyses in the background. Callers poll progress and outcome by run id and may cancel a run.
 * Only the most recent finished runs stay queryable; older ones are evicted once the retention limit is passed.
 */
public final class AnalysisService implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisService.class);

    public static final int DEFAULT_RETAINED_RUNS = 256;

    private final AnalysisPipeline pipeline;
    private final ExecutorService executor;
    private final int retainedRuns;
    private final Map<String, Run> runs = new ConcurrentHashMap<>();
    private final Deque<String> finished = new ArrayDeque<>();

    public AnalysisService(AnalysisPipeline pipeline, int concurrentRuns) {
        this(pipeline, Executors.newFixedThreadPool(concurrentRuns, analysisThreads()), DEFAULT_RETAINED_RUNS);
    }

    public AnalysisService(AnalysisPipeline pipeline, ExecutorService executor, int retainedRuns) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.executor = Objects.requireNonNull(executor, "executor");
        if (retainedRuns < 1) {
            throw new IllegalArgumentException("retainedRuns must be at least 1");
        }
        this.retainedRuns = retainedRuns;
    }

    public String submit(MarkupDocument document) {
        return start((runId, token, writer) -> pipeline.analyze(runId, document, token, writer));
    }

    public String submit(String content, DocumentDecoder decoder) {
        return start((runId, token, writer) -> pipeline.analyze(runId, content, decoder, token, writer));
    }

    public Optional<AnalysisProgress> progress(String runId) {
        return Optional.ofNullable(runs.get(runId)).map(run -> run.channel().view().current());
    }

    public Optional<ProgressView> view(String runId) {
        return Optional.ofNullable(runs.get(runId)).map(run -> run.channel().view());
    }

    public Optional<AnalysisOutcome> outcome(String runId) {
        return Optional.ofNullable(runs.get(runId)).map(run -> snapshot(runId, run));
    }

    /**
     * Requests cancellation. Returns {@code false} for unknown or already finished runs.
     */
    public boolean cancel(String runId) {
        Run run = runs.get(runId);
        if (run == null || run.result().isDone()) {
            return false;
        }
        LOGGER.info("Cancellation requested for run {}", runId);
        run.cancellation().cancel();
        return true;
    }

    /**
     * Blocks until the run finishes or the timeout elapses and returns its outcome at that point.
     */
    public AnalysisOutcome await(String runId, Duration timeout) throws InterruptedException {
        Run run = runs.get(runId);
        if (run == null) {
            throw new IllegalArgumentException("Unknown run: " + runId);
        }
        try {
            run.result().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException | CancellationException | TimeoutException ex) {
            LOGGER.debug("Run {} did not complete normally: {}", runId, ex.toString());
        }
        return snapshot(runId, run);
    }

    public void forget(String runId) {
        runs.remove(runId);
        synchronized (finished) {
            finished.remove(runId);
        }
    }

    private String start(RunTask task) {
        String runId = AnalysisPipeline.newRunId();
        ProgressChannel channel = new ProgressChannel();
        ProgressWriter writer = channel.writer();
        CancellationToken cancellation = CancellationToken.create();
        CompletableFuture<DocumentReport> result = new CompletableFuture<>();
        runs.put(runId, new Run(channel, cancellation, result));
        executor.execute(() -> {
            try {
                DocumentReport report = task.run(runId, cancellation, writer);
                retire(runId);
                result.complete(report);
            } catch (Throwable ex) {
                if (!(ex instanceof RuntimeException)) {
                    LOGGER.error("Run {} aborted", runId, ex);
                    writer.report(AnalysisStage.FAILED, String.valueOf(ex));
                }
                retire(runId);
                result.completeExceptionally(ex);
            }
        });
        LOGGER.debug("Submitted run {}", runId);
        return runId;
    }

    /**
     * Records a finished run and evicts the oldest finished runs past the retention limit. Runs still in
     * progress are never evicted.
     */
    private void retire(String runId) {
        synchronized (finished) {
            finished.addLast(runId);
            while (finished.size() > retainedRuns) {
                String evicted = finished.removeFirst();
                runs.remove(evicted);
                LOGGER.debug("Evicted finished run {}", evicted);
            }
        }
    }

    private AnalysisOutcome snapshot(String runId, Run run) {
        CompletableFuture<DocumentReport> result = run.result();
        if (!result.isDone()) {
            return AnalysisOutcome.pending(runId, run.channel().view().current().stage());
        }
        try {
            return AnalysisOutcome.completed(runId, result.join());
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof AnalysisCancelledException) {
                return AnalysisOutcome.cancelled(runId);
            }
            return AnalysisOutcome.failed(runId, cause == null ? ex.getMessage() : cause.getMessage());
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static ThreadFactory analysisThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "analysis-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @FunctionalInterface
    private interface RunTask {
        DocumentReport run(String runId, CancellationToken cancellation, ProgressWriter writer);
    }

    private record Run(ProgressChannel channel, CancellationToken cancellation, CompletableFuture<DocumentReport> result) {
    }
}
