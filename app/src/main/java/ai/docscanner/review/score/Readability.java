package ai.docscanner.review.score;

/**
 * Classic readability formulas of one sentence, rounded to two decimals. Text without words scores 0 everywhere.
 * SMOG needs at least three sentences and is 0 below that.
 */
public record Readability(double fleschReadingEase,
                          double gunningFog,
                          double smogIndex,
                          double automatedReadabilityIndex) {

    public static final Readability NONE = new Readability(0d, 0d, 0d, 0d);
}
