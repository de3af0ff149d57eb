package ai.docscanner.review.suggest;

import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.Locale;
import java.util.Objects;

/**
 * Suggestion provider backed by a LangChain4j {@link ChatModel} implementation.
 */
public class ChatModelSuggestionProvider implements SuggestionProvider {

    private final ChatModel model;
    private final String providerName;
    private final String modelName;

    public ChatModelSuggestionProvider(ChatModel model, String providerName, String modelName) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
    }

    @Override
    public String suggest(String issueMessage, String sentenceText, String documentType) {
        String issue = requireNonBlank(issueMessage, "issueMessage");
        String sentence = requireNonBlank(sentenceText, "sentenceText");
        String response;
        try {
            response = model.chat(buildPrompt(issue, sentence, documentType));
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new SuggestionException("%s model '%s' is not available.".formatted(providerName, modelName), ex);
            }
            throw new SuggestionException("LangChain suggestion request failed", ex);
        }
        return clean(response, sentence);
    }

    String buildPrompt(String issueMessage, String sentenceText, String documentType) {
        return """
You are a precision %s text editor. You fix specific writing issues by applying the exact correction requested.
Rules:
- Change only what the issue requires; keep the meaning, terminology and product names.
- Return exactly one rewritten sentence.
- Output only the rewritten sentence as plain text. Do not add quotes, labels, or commentary.

Issue: %s

<sentence>
%s
</sentence>""".formatted(editorKind(documentType), issueMessage, sentenceText);
    }

    private String clean(String response, String original) {
        if (response == null) {
            return original;
        }
        String cleaned = response.strip();
        if (cleaned.startsWith("<sentence>")) {
            cleaned = cleaned.substring("<sentence>".length());
        }
        if (cleaned.endsWith("</sentence>")) {
            cleaned = cleaned.substring(0, cleaned.length() - "</sentence>".length());
        }
        cleaned = cleaned.strip();
        if (cleaned.length() > 1 && cleaned.startsWith("\"") && cleaned.endsWith("\"")) {
            cleaned = cleaned.substring(1, cleaned.length() - 1).strip();
        }
        return cleaned.isEmpty() ? original : cleaned;
    }

    private static String editorKind(String documentType) {
        if (documentType == null || documentType.isBlank()) {
            return "general";
        }
        return documentType.trim().toLowerCase(Locale.ROOT);
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
