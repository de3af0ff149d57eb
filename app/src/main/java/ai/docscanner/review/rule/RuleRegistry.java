package ai.docscanner.review.rule;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered, immutable set of rules. Registration order decides the merge order of findings.
 */
public final class RuleRegistry {

    private final List<Rule> rules;

    public RuleRegistry(List<Rule> rules) {
        Objects.requireNonNull(rules, "rules");
        Set<String> ids = new HashSet<>();
        for (Rule rule : rules) {
            Objects.requireNonNull(rule, "rule");
            if (rule.id() == null || rule.id().isBlank()) {
                throw new IllegalArgumentException("Rule id must not be blank: " + rule.getClass().getName());
            }
            if (!ids.add(rule.id())) {
                throw new IllegalArgumentException("Duplicate rule id: " + rule.id());
            }
        }
        this.rules = List.copyOf(rules);
    }

    public static RuleRegistry of(Rule... rules) {
        return new RuleRegistry(List.of(rules));
    }

    public static RuleRegistry empty() {
        return new RuleRegistry(List.of());
    }

    public RuleRegistry with(Rule rule) {
        List<Rule> extended = new ArrayList<>(rules);
        extended.add(rule);
        return new RuleRegistry(extended);
    }

    public List<Rule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }
}
