package ai.docscanner.review.resolve;

import ai.docscanner.review.rule.Issue;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Issues grouped by sentence index plus the issues that could not be tied to any sentence. Every issue appears
 * in exactly one place.
 */
public final class SentenceIssueMap {

    private final List<List<Issue>> bySentence;
    private final List<Issue> unassigned;

    SentenceIssueMap(List<List<Issue>> bySentence, List<Issue> unassigned) {
        Objects.requireNonNull(bySentence, "bySentence");
        List<List<Issue>> copy = new ArrayList<>(bySentence.size());
        for (List<Issue> issues : bySentence) {
            copy.add(List.copyOf(issues));
        }
        this.bySentence = List.copyOf(copy);
        this.unassigned = List.copyOf(Objects.requireNonNull(unassigned, "unassigned"));
    }

    public int sentenceCount() {
        return bySentence.size();
    }

    public List<Issue> issuesFor(int sentenceIndex) {
        if (sentenceIndex < 0 || sentenceIndex >= bySentence.size()) {
            throw new IndexOutOfBoundsException("No sentence with index " + sentenceIndex);
        }
        return bySentence.get(sentenceIndex);
    }

    public List<Issue> unassigned() {
        return unassigned;
    }

    public int assignedCount() {
        return bySentence.stream().mapToInt(List::size).sum();
    }

    public int totalIssues() {
        return assignedCount() + unassigned.size();
    }
}
