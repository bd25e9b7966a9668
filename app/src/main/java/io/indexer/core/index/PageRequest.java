package io.indexer.core.index;

import io.indexer.core.error.InvalidInputException;

/**
 * Offset/limit window over an ordered index bucket.
 *
 * @param newestFirst scan from the highest height down
 */
public record PageRequest(int offset, int limit, boolean newestFirst) {
    public PageRequest {
        if (offset < 0) {
            throw new InvalidInputException("offset must be >= 0: " + offset);
        }
        if (limit <= 0) {
            throw new InvalidInputException("limit must be > 0: " + limit);
        }
    }

    public static PageRequest newestFirst(int offset, int limit) {
        return new PageRequest(offset, limit, true);
    }

    public static PageRequest oldestFirst(int offset, int limit) {
        return new PageRequest(offset, limit, false);
    }
}
