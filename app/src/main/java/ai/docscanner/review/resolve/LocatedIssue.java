package ai.docscanner.review.resolve;

import ai.docscanner.review.rule.Issue;
import java.util.OptionalInt;

/**
 * An issue with its resolved target and, when known, its range in document coordinates.
 */
record LocatedIssue(Issue issue, OptionalInt sentenceIndex, int documentStart, int documentEnd, boolean positioned) {

    static LocatedIssue at(Issue issue, OptionalInt sentenceIndex, int documentStart, int documentEnd) {
        return new LocatedIssue(issue, sentenceIndex, documentStart, documentEnd, true);
    }

    static LocatedIssue unpositioned(Issue issue, OptionalInt sentenceIndex) {
        return new LocatedIssue(issue, sentenceIndex, 0, 0, false);
    }

    int length() {
        return documentEnd - documentStart;
    }
}
