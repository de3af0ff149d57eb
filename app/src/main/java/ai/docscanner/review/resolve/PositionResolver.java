package ai.docscanner.review.resolve;

import ai.docscanner.review.normalize.FlattenedDocument;
import ai.docscanner.review.rule.Issue;
import ai.docscanner.review.rule.IssueScope;
import ai.docscanner.review.segment.Sentence;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ties every issue to exactly one sentence, or to the unassigned bucket when its position cannot be trusted.
 * An issue without a usable position never falls back to the first sentence.
 */
public class PositionResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(PositionResolver.class);

    private final IssueDeduplicator deduplicator;

    public PositionResolver() {
        this(IssueDeduplicator.DEFAULT_OVERLAP_RATIO);
    }

    public PositionResolver(double dedupOverlapRatio) {
        this.deduplicator = new IssueDeduplicator(dedupOverlapRatio);
    }

    public SentenceIssueMap resolve(FlattenedDocument document, List<Sentence> sentences, List<Issue> issues) {
        Objects.requireNonNull(document, "document");
        SentenceIndex index = new SentenceIndex(sentences == null ? List.of() : sentences);
        List<List<LocatedIssue>> bySentence = new ArrayList<>(index.size());
        for (int i = 0; i < index.size(); i++) {
            bySentence.add(new ArrayList<>());
        }
        List<LocatedIssue> unassigned = new ArrayList<>();
        for (Issue issue : issues == null ? List.<Issue>of() : issues) {
            LocatedIssue located = locate(document, index, issue);
            if (located.sentenceIndex().isPresent()) {
                bySentence.get(located.sentenceIndex().getAsInt()).add(located);
            } else {
                LOGGER.debug("Issue of rule {} has no usable position; leaving it unassigned", issue.ruleId());
                unassigned.add(located);
            }
        }

        List<List<Issue>> resolved = new ArrayList<>(bySentence.size());
        for (List<LocatedIssue> target : bySentence) {
            resolved.add(issuesOf(deduplicator.deduplicate(target)));
        }
        return new SentenceIssueMap(resolved, issuesOf(deduplicator.deduplicate(unassigned)));
    }

    LocatedIssue locate(FlattenedDocument document, SentenceIndex index, Issue issue) {
        if (issue.scope() == IssueScope.SENTENCE) {
            return locateInSentence(index, issue);
        }
        if (issue.start() == 0 && issue.end() == 0) {
            return locateByText(document, index, issue);
        }
        if (issue.start() >= 0 && issue.start() < issue.end() && issue.end() <= document.length()) {
            OptionalInt target = index.firstOverlapping(issue.start(), issue.end());
            return LocatedIssue.at(issue, target, issue.start(), issue.end());
        }
        LOGGER.debug("Issue of rule {} reports range [{}, {}) outside the document of length {}",
                issue.ruleId(), issue.start(), issue.end(), document.length());
        return LocatedIssue.unpositioned(issue, OptionalInt.empty());
    }

    private LocatedIssue locateInSentence(SentenceIndex index, Issue issue) {
        int hint = issue.sentenceHint().getAsInt();
        if (!index.contains(hint)) {
            return LocatedIssue.unpositioned(issue, OptionalInt.empty());
        }
        Sentence sentence = index.get(hint);
        int sentenceLength = sentence.documentEnd() - sentence.documentStart();
        if (issue.start() < issue.end() && issue.end() <= sentenceLength) {
            return LocatedIssue.at(issue, OptionalInt.of(hint),
                    sentence.documentStart() + issue.start(), sentence.documentStart() + issue.end());
        }
        return LocatedIssue.unpositioned(issue, OptionalInt.of(hint));
    }

    /**
     * Last resort for issues that report no position at all but carry matched text: a unique occurrence in the
     * document decides the sentence. A reported range, even a wrong one, never reaches this search.
     */
    private LocatedIssue locateByText(FlattenedDocument document, SentenceIndex index, Issue issue) {
        String matched = issue.matchedText();
        if (matched.isEmpty()) {
            return LocatedIssue.unpositioned(issue, OptionalInt.empty());
        }
        String text = document.text();
        int first = text.indexOf(matched);
        if (first < 0 || text.indexOf(matched, first + 1) >= 0) {
            return LocatedIssue.unpositioned(issue, OptionalInt.empty());
        }
        int end = first + matched.length();
        return LocatedIssue.at(issue, index.firstOverlapping(first, end), first, end);
    }

    private static List<Issue> issuesOf(List<LocatedIssue> located) {
        List<Issue> issues = new ArrayList<>(located.size());
        for (LocatedIssue issue : located) {
            issues.add(issue.issue());
        }
        return issues;
    }
}
