package io.indexer.core.storage;

import java.io.Closeable;
import java.util.function.Predicate;

/**
 * Minimal ordered key/value API so we can swap implementations (RocksDB, in-memory).
 * Keys and values are raw bytes compared as unsigned; callers handle encoding.
 * Failures surface as {@link io.indexer.core.error.StorageUnavailableException}.
 */
public interface KeyValueDB extends Closeable {
    /** Value for the key, or {@code null} when absent. */
    byte[] get(Column column, byte[] key);

    void put(Column column, byte[] key, byte[] value);

    void delete(Column column, byte[] key);

    /** A write batch whose mutations become visible together on {@link Batch#commit()}. */
    Batch newBatch();

    /**
     * Visits entries with {@code from <= key < to} in key order (descending when {@code reverse}).
     * A {@code null} bound is open. Iteration stops when the visitor returns {@code false}.
     */
    void scan(Column column, byte[] from, byte[] to, boolean reverse, Predicate<Entry> visitor);

    default void scanPrefix(Column column, byte[] prefix, boolean reverse, Predicate<Entry> visitor) {
        scan(column, prefix, Keys.prefixEnd(prefix), reverse, visitor);
    }

    boolean isReadOnly();

    @Override void close();

    interface Batch extends AutoCloseable {
        void put(Column column, byte[] key, byte[] value);
        void delete(Column column, byte[] key);
        /** Number of queued mutations. */
        int size();
        void commit();
        @Override void close();
    }

    record Entry(byte[] key, byte[] value) {}
}
