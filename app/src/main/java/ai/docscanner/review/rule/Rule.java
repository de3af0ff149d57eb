package ai.docscanner.review.rule;

import java.util.List;

/**
 * A writing-quality check. Implementations must be stateless so the runner can invoke them concurrently.
 */
public interface Rule {

    String id();

    /**
     * Category family used to collapse near-identical findings reported by different rules.
     */
    default String category() {
        return id();
    }

    List<RuleFinding> run(String text);
}
