package ai.docscanner.review.rule;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Factory methods for rules written as plain functions.
 */
public final class Rules {

    private Rules() {
    }

    /**
     * Wraps a check that only reports messages. Its findings carry no position; the resolver places them by
     * scope or leaves them unassigned.
     */
    public static Rule legacy(String id, String category, Function<String, List<String>> check) {
        Objects.requireNonNull(check, "check");
        return new FunctionRule(id, category, text -> {
            List<String> messages = check.apply(text);
            if (messages == null) {
                return null;
            }
            List<RuleFinding> findings = new ArrayList<>(messages.size());
            for (String message : messages) {
                findings.add(message == null ? null : RuleFinding.legacy(message));
            }
            return findings;
        });
    }

    public static Rule of(String id, String category, Function<String, List<RuleFinding>> check) {
        return new FunctionRule(id, category, Objects.requireNonNull(check, "check"));
    }

    private record FunctionRule(String id, String category, Function<String, List<RuleFinding>> check) implements Rule {

        private FunctionRule {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("id must not be blank");
            }
            category = category == null || category.isBlank() ? id : category;
        }

        @Override
        public List<RuleFinding> run(String text) {
            return check.apply(text);
        }
    }
}
