package ai.docscanner.review.pipeline;

import ai.docscanner.review.score.DocumentReport;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of a submitted run. A report is present only once the run reached {@link AnalysisStage#COMPLETE}.
 */
public record AnalysisOutcome(String runId, AnalysisStage stage, Optional<DocumentReport> report, Optional<String> error) {

    public AnalysisOutcome {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(stage, "stage");
        report = report == null ? Optional.empty() : report;
        error = error == null ? Optional.empty() : error;
    }

    static AnalysisOutcome pending(String runId, AnalysisStage stage) {
        return new AnalysisOutcome(runId, stage, Optional.empty(), Optional.empty());
    }

    static AnalysisOutcome completed(String runId, DocumentReport report) {
        return new AnalysisOutcome(runId, AnalysisStage.COMPLETE, Optional.of(report), Optional.empty());
    }

    static AnalysisOutcome cancelled(String runId) {
        return new AnalysisOutcome(runId, AnalysisStage.CANCELLED, Optional.empty(), Optional.empty());
    }

    static AnalysisOutcome failed(String runId, String error) {
        return new AnalysisOutcome(runId, AnalysisStage.FAILED, Optional.empty(), Optional.ofNullable(error));
    }

    public boolean isDone() {
        return stage.isTerminal();
    }
}
