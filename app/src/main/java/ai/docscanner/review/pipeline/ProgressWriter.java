package ai.docscanner.review.pipeline;

/**
 * Write side of a progress channel. Held by the worker running the analysis only.
 */
public interface ProgressWriter {

    ProgressWriter NONE = (stage, message) -> { };

    void report(AnalysisStage stage, String message);

    default void report(AnalysisStage stage) {
        report(stage, "");
    }
}
