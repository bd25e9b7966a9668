package io.indexer.core.query;

/**
 * Offset/limit requested by a caller, already normalized: a missing or non-positive limit becomes
 * the default, a limit above the maximum is capped, a missing or negative offset becomes zero.
 */
public record Pagination(int offset, int limit) {
    public static final int DEFAULT_LIMIT = 10;
    public static final int DEFAULT_MAX_LIMIT = 100;

    public Pagination {
        if (offset < 0 || limit <= 0) {
            throw new IllegalArgumentException("normalized pagination expected, got offset=" + offset + " limit=" + limit);
        }
    }

    public static Pagination of(Integer offset, Integer limit) {
        return of(offset, limit, DEFAULT_LIMIT, DEFAULT_MAX_LIMIT);
    }

    public static Pagination of(Integer offset, Integer limit, int defaultLimit, int maxLimit) {
        int l = limit == null || limit <= 0 ? defaultLimit : Math.min(limit, maxLimit);
        int o = offset == null || offset < 0 ? 0 : offset;
        return new Pagination(o, l);
    }

    public static Pagination first(int limit) {
        return of(0, limit);
    }
}
