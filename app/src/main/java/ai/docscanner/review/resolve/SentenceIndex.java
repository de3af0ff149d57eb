package ai.docscanner.review.resolve;

import ai.docscanner.review.segment.Sentence;
import java.util.List;
import java.util.OptionalInt;

/**
 * Interval lookup over the sorted, non-overlapping sentence ranges of one document.
 */
final class SentenceIndex {

    private final List<Sentence> sentences;
    private final int[] ends;

    SentenceIndex(List<Sentence> sentences) {
        this.sentences = List.copyOf(sentences);
        this.ends = new int[this.sentences.size()];
        for (int i = 0; i < ends.length; i++) {
            ends[i] = this.sentences.get(i).documentEnd();
        }
    }

    int size() {
        return sentences.size();
    }

    Sentence get(int index) {
        return sentences.get(index);
    }

    boolean contains(int index) {
        return index >= 0 && index < sentences.size();
    }

    /**
     * Returns the first sentence whose range overlaps {@code [start, end)}, ignoring empty sentence ranges.
     */
    OptionalInt firstOverlapping(int start, int end) {
        if (start >= end) {
            return OptionalInt.empty();
        }
        for (int i = firstEndingAfter(start); i < sentences.size(); i++) {
            Sentence sentence = sentences.get(i);
            if (sentence.documentStart() >= end) {
                break;
            }
            if (sentence.documentEnd() > sentence.documentStart() && sentence.overlaps(start, end)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    private int firstEndingAfter(int offset) {
        int low = 0;
        int high = ends.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (ends[mid] <= offset) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }
}
