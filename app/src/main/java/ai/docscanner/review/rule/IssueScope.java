package ai.docscanner.review.rule;

/**
 * Coordinate space of an issue's offsets.
 */
public enum IssueScope {
    DOCUMENT,
    SENTENCE
}
