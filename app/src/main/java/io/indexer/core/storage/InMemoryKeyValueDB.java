package io.indexer.core.storage;

import io.indexer.core.error.ReadOnlyStoreException;
import io.indexer.core.error.StorageUnavailableException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Sorted in-memory backend. Good for tests and throwaway runs.
 *
 * A read/write lock makes batch commits atomic with respect to readers.
 */
public final class InMemoryKeyValueDB implements KeyValueDB {

    private final Map<Column, TreeMap<byte[], byte[]>> columns = new EnumMap<>(Column.class);
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final boolean readOnly;
    private volatile boolean closed;

    public InMemoryKeyValueDB() {
        this(false);
    }

    public InMemoryKeyValueDB(boolean readOnly) {
        this.readOnly = readOnly;
        for (Column c : Column.values()) {
            columns.put(c, new TreeMap<>(Arrays::compareUnsigned));
        }
    }

    @Override
    public byte[] get(Column column, byte[] key) {
        lock.readLock().lock();
        try {
            ensureOpen();
            byte[] v = columns.get(column).get(key);
            return v == null ? null : v.clone();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void put(Column column, byte[] key, byte[] value) {
        try (Batch b = newBatch()) {
            b.put(column, key, value);
            b.commit();
        }
    }

    @Override
    public void delete(Column column, byte[] key) {
        try (Batch b = newBatch()) {
            b.delete(column, key);
            b.commit();
        }
    }

    @Override
    public Batch newBatch() {
        return new MemoryBatch();
    }

    @Override
    public void scan(Column column, byte[] from, byte[] to, boolean reverse, Predicate<Entry> visitor) {
        lock.readLock().lock();
        try {
            ensureOpen();
            NavigableMap<byte[], byte[]> view = columns.get(column);
            if (from != null && to != null) {
                if (Arrays.compareUnsigned(from, to) >= 0) {
                    return;
                }
                view = view.subMap(from, true, to, false);
            } else if (from != null) {
                view = view.tailMap(from, true);
            } else if (to != null) {
                view = view.headMap(to, false);
            }
            if (reverse) {
                view = view.descendingMap();
            }
            for (Map.Entry<byte[], byte[]> e : view.entrySet()) {
                if (!visitor.test(new Entry(e.getKey().clone(), e.getValue().clone()))) {
                    return;
                }
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isReadOnly() {
        return readOnly;
    }

    @Override
    public void close() {
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageUnavailableException("store is closed");
        }
    }

    private record Op(Column column, byte[] key, byte[] value) {}

    private final class MemoryBatch implements Batch {
        private final List<Op> ops = new ArrayList<>();

        @Override
        public void put(Column column, byte[] key, byte[] value) {
            ops.add(new Op(column, key.clone(), value.clone()));
        }

        @Override
        public void delete(Column column, byte[] key) {
            ops.add(new Op(column, key.clone(), null));
        }

        @Override
        public int size() {
            return ops.size();
        }

        @Override
        public void commit() {
            if (readOnly) {
                throw new ReadOnlyStoreException("write");
            }
            lock.writeLock().lock();
            try {
                ensureOpen();
                for (Op op : ops) {
                    TreeMap<byte[], byte[]> map = columns.get(op.column());
                    if (op.value() == null) {
                        map.remove(op.key());
                    } else {
                        map.put(op.key(), op.value());
                    }
                }
                ops.clear();
            } finally {
                lock.writeLock().unlock();
            }
        }

        @Override
        public void close() {
            ops.clear();
        }
    }
}
