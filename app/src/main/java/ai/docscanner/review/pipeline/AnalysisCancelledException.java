package ai.docscanner.review.pipeline;

/**
 * Raised when a run observes a cancellation request. No partial report is produced.
 */
public class AnalysisCancelledException extends RuntimeException {

    public AnalysisCancelledException(String message) {
        super(message);
    }

    public AnalysisCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
