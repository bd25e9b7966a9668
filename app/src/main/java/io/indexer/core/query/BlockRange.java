package io.indexer.core.query;

import java.util.Optional;

/**
 * Inclusive height window selected for one page of blocks.
 */
public record BlockRange(long startBlock, long endBlock, boolean hasNextPage, boolean hasPreviousPage) {

    /**
     * Latest-first paging used when the caller gave no explicit range. Page {@code offset} counts
     * back from {@code latestHeight}.
     */
    public static Optional<BlockRange> reverse(long latestHeight, int offset, int limit) {
        if (offset > latestHeight) {
            return Optional.empty();
        }
        long end = latestHeight - offset;
        long start = Math.max(0, end - limit + 1);
        return Optional.of(new BlockRange(start, end, start > 0, offset > 0));
    }

    /** Oldest-first paging inside an explicit {@code [numberFrom, numberTo]} range. */
    public static Optional<BlockRange> forward(long numberFrom, long numberTo, int offset, int limit) {
        long size = numberTo - numberFrom + 1;
        if (offset >= size) {
            return Optional.empty();
        }
        long start = numberFrom + offset;
        long end = Math.min(start + limit - 1, numberTo);
        return Optional.of(new BlockRange(start, end, end < numberTo, offset > 0));
    }

    public long size() {
        return endBlock - startBlock + 1;
    }
}
