package io.indexer.core.query;

/** Cursors are null when the page is empty. */
public record PageInfo(boolean hasNextPage, boolean hasPreviousPage, String startCursor, String endCursor) {
}
