package ai.docscanner.review.normalize;

import java.util.Arrays;

/**
 * Starting offset of every block within the flattened document text. Offsets grow monotonically with
 * block order.
 */
public final class BlockOffsetMap {

    private final int[] orders;
    private final int[] starts;
    private final int[] lengths;

    BlockOffsetMap(int[] orders, int[] starts, int[] lengths) {
        if (orders.length != starts.length || starts.length != lengths.length) {
            throw new IllegalArgumentException("orders, starts and lengths must have the same size");
        }
        this.orders = orders.clone();
        this.starts = starts.clone();
        this.lengths = lengths.clone();
    }

    static BlockOffsetMap empty() {
        return new BlockOffsetMap(new int[0], new int[0], new int[0]);
    }

    public int blockCount() {
        return orders.length;
    }

    public int blockStart(int blockOrder) {
        return starts[indexOf(blockOrder)];
    }

    public int blockEnd(int blockOrder) {
        int index = indexOf(blockOrder);
        return starts[index] + lengths[index];
    }

    public int toDocumentOffset(int blockOrder, int blockOffset) {
        int index = indexOf(blockOrder);
        if (blockOffset < 0 || blockOffset > lengths[index]) {
            throw new IllegalArgumentException("Offset " + blockOffset + " is outside block " + blockOrder);
        }
        return starts[index] + blockOffset;
    }

    /**
     * Whether the document range {@code [start, end)} lies inside the text of one block, never touching the
     * separator that joins two blocks.
     */
    public boolean withinSingleBlock(int start, int end) {
        if (start < 0 || end < start) {
            return false;
        }
        int index = Arrays.binarySearch(starts, start);
        if (index < 0) {
            index = -index - 2;
        }
        return index >= 0 && end <= starts[index] + lengths[index];
    }

    private int indexOf(int blockOrder) {
        int index = Arrays.binarySearch(orders, blockOrder);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown block order: " + blockOrder);
        }
        return index;
    }
}
