package ai.docscanner.review.pipeline;

import java.util.function.Consumer;

/**
 * Read side of a progress channel. Readers see the latest value only.
 */
public interface ProgressView {

    AnalysisProgress current();

    void subscribe(Consumer<AnalysisProgress> listener);
}
