package ai.docscanner.review.resolve;

import ai.docscanner.review.rule.Issue;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Drops near-identical issues reported for the same target. A later issue is a duplicate of an earlier kept one
 * when both belong to the same category family, they come from different rules or carry the same message, and
 * their matched text overlaps highly.
 */
class IssueDeduplicator {

    static final double DEFAULT_OVERLAP_RATIO = 0.8d;

    private final double overlapRatio;

    IssueDeduplicator(double overlapRatio) {
        if (overlapRatio <= 0d || overlapRatio > 1d) {
            throw new IllegalArgumentException("overlapRatio must be within (0, 1]");
        }
        this.overlapRatio = overlapRatio;
    }

    List<LocatedIssue> deduplicate(List<LocatedIssue> issues) {
        List<LocatedIssue> kept = new ArrayList<>(issues.size());
        for (LocatedIssue candidate : issues) {
            if (kept.stream().noneMatch(existing -> isDuplicate(existing, candidate))) {
                kept.add(candidate);
            }
        }
        return kept;
    }

    boolean isDuplicate(LocatedIssue kept, LocatedIssue candidate) {
        Issue first = kept.issue();
        Issue second = candidate.issue();
        if (!first.category().equals(second.category())) {
            return false;
        }
        if (first.ruleId().equals(second.ruleId()) && !first.message().equals(second.message())) {
            return false;
        }
        return overlapsHighly(kept, candidate);
    }

    private boolean overlapsHighly(LocatedIssue first, LocatedIssue second) {
        if (first.positioned() && second.positioned() && first.length() > 0 && second.length() > 0) {
            int intersection = Math.min(first.documentEnd(), second.documentEnd())
                    - Math.max(first.documentStart(), second.documentStart());
            if (intersection <= 0) {
                return false;
            }
            return (double) intersection / Math.max(first.length(), second.length()) >= overlapRatio;
        }
        String a = first.issue().matchedText().toLowerCase(Locale.ROOT);
        String b = second.issue().matchedText().toLowerCase(Locale.ROOT);
        if (a.isEmpty() || b.isEmpty()) {
            return a.isEmpty() && b.isEmpty();
        }
        return a.contains(b) || b.contains(a);
    }
}
