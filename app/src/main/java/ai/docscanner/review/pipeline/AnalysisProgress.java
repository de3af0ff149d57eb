package ai.docscanner.review.pipeline;

import java.time.Instant;
import java.util.Objects;

public record AnalysisProgress(AnalysisStage stage, int percent, String message, Instant updatedAt) {

    public AnalysisProgress {
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(updatedAt, "updatedAt");
        message = message == null ? "" : message;
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException("percent must be within [0, 100]");
        }
    }

    public static AnalysisProgress of(AnalysisStage stage, String message) {
        return new AnalysisProgress(stage, stage.percent(), message, Instant.now());
    }
}
