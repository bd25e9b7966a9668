package io.indexer.core.storage;

import java.util.TreeSet;
import java.util.function.LongPredicate;

/**
 * Highest height {@code h} such that every height in {@code [0, h]} has completed. Heights may
 * complete out of order; later ones wait in a pending set until the gap closes.
 */
public final class HeightWatermark {
    public static final long EMPTY = -1L;

    private final KeyValueDB db;
    private final byte[] key;
    private final LongPredicate completed;
    private final TreeSet<Long> pending = new TreeSet<>();
    private long value;

    HeightWatermark(KeyValueDB db, byte[] key, LongPredicate completed) {
        this.db = db;
        this.key = key;
        this.completed = completed;
        byte[] stored = db.get(Column.META, key);
        long v = stored == null ? EMPTY : Keys.bytesToLong(stored);
        while (completed.test(v + 1)) {
            v++;
        }
        this.value = v;
    }

    public synchronized long get() {
        return value;
    }

    /** Records a completed height and returns the possibly advanced watermark. */
    public synchronized long complete(long height) {
        if (height <= value) {
            return value;
        }
        pending.add(height);
        long before = value;
        while (!pending.isEmpty() && pending.first() == value + 1) {
            value = pending.pollFirst();
        }
        // heights completed before a rollback dropped them from the pending set
        while (completed.test(value + 1)) {
            value++;
            pending.remove(value);
        }
        if (value != before) {
            persist();
        }
        return value;
    }

    /** Drops the watermark below a removed height. */
    public synchronized void rollbackBelow(long height) {
        pending.removeIf(h -> h >= height);
        if (height <= value) {
            value = height - 1;
            persist();
        }
    }

    private void persist() {
        if (!db.isReadOnly()) {
            db.put(Column.META, key, Keys.longToBytes(value));
        }
    }
}
