package io.indexer.core.query;

import java.util.List;
import java.util.function.Function;

/**
 * One page of results.
 *
 * <p>{@code totalCount} comes from an aggregate counter when one covers the query, in which case
 * {@code exactTotalCount} is true. Otherwise it is the number of matches actually scanned, which
 * understates the real total when the scan was clamped to the maximum block span, and
 * {@code exactTotalCount} is false.
 */
public record Connection<T>(List<T> nodes, long totalCount, boolean exactTotalCount, PageInfo pageInfo) {

    public Connection {
        nodes = List.copyOf(nodes);
    }

    public static <T> Connection<T> empty(boolean hasPreviousPage) {
        return new Connection<>(List.of(), 0, true, new PageInfo(false, hasPreviousPage, null, null));
    }

    static <T> Connection<T> of(List<T> nodes, long totalCount, boolean exact, boolean hasNext, boolean hasPrevious,
                                Function<T, String> cursor) {
        String start = nodes.isEmpty() ? null : cursor.apply(nodes.get(0));
        String end = nodes.isEmpty() ? null : cursor.apply(nodes.get(nodes.size() - 1));
        return new Connection<>(nodes, totalCount, exact, new PageInfo(hasNext, hasPrevious, start, end));
    }
}
