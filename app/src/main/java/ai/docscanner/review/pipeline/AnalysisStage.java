package ai.docscanner.review.pipeline;

/**
 * Coarse phases of a run with the percentage reported when a phase starts.
 */
public enum AnalysisStage {
    QUEUED(0),
    PARSING(10),
    SEGMENTATION(30),
    RULE_EXECUTION(50),
    SCORING(80),
    COMPLETE(100),
    CANCELLED(100),
    FAILED(100);

    private final int percent;

    AnalysisStage(int percent) {
        this.percent = percent;
    }

    public int percent() {
        return percent;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == CANCELLED || this == FAILED;
    }
}
