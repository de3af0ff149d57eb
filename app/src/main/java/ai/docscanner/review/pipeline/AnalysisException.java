package ai.docscanner.review.pipeline;

/**
 * Fatal analysis failure, raised when the input cannot be turned into a document.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
