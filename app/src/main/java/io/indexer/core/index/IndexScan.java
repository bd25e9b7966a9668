package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.storage.Column;
import io.indexer.core.storage.KeyValueDB;
import io.indexer.core.storage.Keys;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/** Paged and counted scans over index buckets. */
final class IndexScan {
    private IndexScan() {}

    static <T> List<T> page(KeyValueDB db, OperationContext ctx, byte[] prefix, PageRequest page,
                            Function<KeyValueDB.Entry, T> mapper) {
        return page(db, ctx, prefix, Keys.prefixEnd(prefix), page, mapper);
    }

    /** Entries with {@code from <= key < to}, skipping {@code offset} and stopping after {@code limit}. */
    static <T> List<T> page(KeyValueDB db, OperationContext ctx, byte[] from, byte[] to, PageRequest page,
                            Function<KeyValueDB.Entry, T> mapper) {
        List<T> out = new ArrayList<>(Math.min(page.limit(), 64));
        int[] skipped = {0};
        db.scan(Column.INDEX, from, to, page.newestFirst(), e -> {
            ctx.checkActive();
            T mapped = mapper.apply(e);
            if (mapped == null) {
                return true;
            }
            if (skipped[0] < page.offset()) {
                skipped[0]++;
                return true;
            }
            out.add(mapped);
            return out.size() < page.limit();
        });
        return out;
    }

    static <T> List<T> all(KeyValueDB db, OperationContext ctx, byte[] from, byte[] to, boolean reverse,
                           Function<KeyValueDB.Entry, T> mapper) {
        List<T> out = new ArrayList<>();
        db.scan(Column.INDEX, from, to, reverse, e -> {
            ctx.checkActive();
            T mapped = mapper.apply(e);
            if (mapped != null) {
                out.add(mapped);
            }
            return true;
        });
        return out;
    }

    static long count(KeyValueDB db, OperationContext ctx, byte[] prefix) {
        long[] n = {0};
        db.scanPrefix(Column.INDEX, prefix, false, e -> {
            if ((n[0] & 0x3ff) == 0) {
                ctx.checkActive();
            }
            n[0]++;
            return true;
        });
        return n[0];
    }

    /** Reads the record a pointer entry refers to; pointers store the record's key as their value. */
    static <T> T follow(KeyValueDB db, KeyValueDB.Entry pointer, Class<T> type) {
        byte[] raw = db.get(Column.INDEX, pointer.value());
        return raw == null ? null : IndexJson.read(raw, type);
    }
}
