package ai.docscanner.review.suggest;

/**
 * Produces a rewrite suggestion for one issue. Invoked by callers of the engine, never by the engine itself.
 */
@FunctionalInterface
public interface SuggestionProvider {

    String suggest(String issueMessage, String sentenceText, String documentType);
}
