package ai.docscanner.review.rule;

public enum FailureReason {
    ERROR,
    TIMEOUT,
    MALFORMED
}
