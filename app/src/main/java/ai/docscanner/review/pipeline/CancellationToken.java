package ai.docscanner.review.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between the caller and a running analysis.
 */
public final class CancellationToken {

    private final AtomicBoolean requested = new AtomicBoolean();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        requested.set(true);
    }

    public boolean isCancellationRequested() {
        return requested.get();
    }

    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new AnalysisCancelledException("Analysis was cancelled");
        }
    }
}
