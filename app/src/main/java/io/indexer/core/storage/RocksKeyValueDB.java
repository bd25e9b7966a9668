package io.indexer.core.storage;

import io.indexer.core.error.ReadOnlyStoreException;
import io.indexer.core.error.StorageUnavailableException;
import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.DBOptions;
import org.rocksdb.LRUCache;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent backend on RocksDB, one column family per {@link Column}.
 */
public final class RocksKeyValueDB implements KeyValueDB {
    private static final Logger LOG = Logger.getLogger(RocksKeyValueDB.class.getName());

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final ColumnFamilyHandle defaultHandle;
    private final Map<Column, ColumnFamilyHandle> handles;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions cfOptions;
    private final LRUCache cache;
    private final WriteOptions writeOptions;
    private final boolean readOnly;
    private volatile boolean closed;

    private RocksKeyValueDB(RocksDB db,
                            ColumnFamilyHandle defaultHandle,
                            Map<Column, ColumnFamilyHandle> handles,
                            DBOptions dbOptions,
                            ColumnFamilyOptions cfOptions,
                            LRUCache cache,
                            boolean readOnly) {
        this.db = db;
        this.defaultHandle = defaultHandle;
        this.handles = handles;
        this.dbOptions = dbOptions;
        this.cfOptions = cfOptions;
        this.cache = cache;
        this.readOnly = readOnly;
        this.writeOptions = new WriteOptions().setSync(false);
    }

    /** Factory: open or create a store in the given directory. */
    public static RocksKeyValueDB open(Path dataDir, StoreOptions options) {
        LRUCache cache = new LRUCache(Math.max(options.blockCacheBytes(), 1L));
        ColumnFamilyOptions cfOpts = new ColumnFamilyOptions()
                .setWriteBufferSize(options.writeBufferBytes())
                .setTableFormatConfig(new BlockBasedTableConfig().setBlockCache(cache));
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true)
                .setMaxOpenFiles(options.maxOpenFiles());

        List<ColumnFamilyDescriptor> descriptors = new ArrayList<>();
        descriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, cfOpts));
        for (Column c : Column.values()) {
            descriptors.add(new ColumnFamilyDescriptor(c.familyName(), cfOpts));
        }
        List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
        try {
            RocksDB db;
            if (options.readOnly()) {
                if (!Files.isDirectory(dataDir)) {
                    throw new StorageUnavailableException("read-only store requires an existing directory: " + dataDir);
                }
                db = RocksDB.openReadOnly(dbOpts, dataDir.toString(), descriptors, cfHandles);
            } else {
                Files.createDirectories(dataDir);
                db = RocksDB.open(dbOpts, dataDir.toString(), descriptors, cfHandles);
            }
            Map<Column, ColumnFamilyHandle> byColumn = new EnumMap<>(Column.class);
            Column[] columns = Column.values();
            for (int i = 0; i < columns.length; i++) {
                // index 0 is the default family
                byColumn.put(columns[i], cfHandles.get(i + 1));
            }
            LOG.info(() -> "Opened RocksDB at " + dataDir + (options.readOnly() ? " (read-only)" : ""));
            return new RocksKeyValueDB(db, cfHandles.get(0), byColumn, dbOpts, cfOpts, cache, options.readOnly());
        } catch (RocksDBException | java.io.IOException e) {
            cfOpts.close();
            dbOpts.close();
            cache.close();
            throw new StorageUnavailableException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    @Override
    public byte[] get(Column column, byte[] key) {
        ensureOpen();
        try {
            return db.get(handles.get(column), key);
        } catch (RocksDBException e) {
            throw new StorageUnavailableException("get failed", e);
        }
    }

    @Override
    public void put(Column column, byte[] key, byte[] value) {
        ensureWritable("put");
        try {
            db.put(handles.get(column), writeOptions, key, value);
        } catch (RocksDBException e) {
            throw new StorageUnavailableException("put failed", e);
        }
    }

    @Override
    public void delete(Column column, byte[] key) {
        ensureWritable("delete");
        try {
            db.delete(handles.get(column), writeOptions, key);
        } catch (RocksDBException e) {
            throw new StorageUnavailableException("delete failed", e);
        }
    }

    @Override
    public Batch newBatch() {
        ensureOpen();
        return new RocksBatch();
    }

    @Override
    public void scan(Column column, byte[] from, byte[] to, boolean reverse, Predicate<Entry> visitor) {
        ensureOpen();
        if (from != null && to != null && Arrays.compareUnsigned(from, to) >= 0) {
            return;
        }
        try (ReadOptions ro = new ReadOptions();
             RocksIterator it = db.newIterator(handles.get(column), ro)) {
            if (!reverse) {
                if (from == null) it.seekToFirst(); else it.seek(from);
                while (it.isValid()) {
                    byte[] key = it.key();
                    if (to != null && Arrays.compareUnsigned(key, to) >= 0) break;
                    if (!visitor.test(new Entry(key, it.value()))) break;
                    it.next();
                }
            } else {
                if (to == null) {
                    it.seekToLast();
                } else {
                    it.seekForPrev(to);
                    if (it.isValid() && Arrays.equals(it.key(), to)) {
                        it.prev();
                    }
                }
                while (it.isValid()) {
                    byte[] key = it.key();
                    if (from != null && Arrays.compareUnsigned(key, from) < 0) break;
                    if (!visitor.test(new Entry(key, it.value()))) break;
                    it.prev();
                }
            }
            it.status();
        } catch (RocksDBException e) {
            throw new StorageUnavailableException("scan failed", e);
        }
    }

    @Override
    public boolean isReadOnly() {
        return readOnly;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        // handles first, then DB and options
        for (ColumnFamilyHandle h : handles.values()) {
            h.close();
        }
        defaultHandle.close();
        try {
            db.closeE();
        } catch (RocksDBException e) {
            LOG.log(Level.WARNING, "RocksDB close reported an error", e);
        }
        writeOptions.close();
        cfOptions.close();
        dbOptions.close();
        cache.close();
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageUnavailableException("store is closed");
        }
    }

    private void ensureWritable(String op) {
        ensureOpen();
        if (readOnly) {
            throw new ReadOnlyStoreException(op);
        }
    }

    private final class RocksBatch implements Batch {
        private final WriteBatch batch = new WriteBatch();
        private int size;

        @Override
        public void put(Column column, byte[] key, byte[] value) {
            try {
                batch.put(handles.get(column), key, value);
                size++;
            } catch (RocksDBException e) {
                throw new StorageUnavailableException("batch put failed", e);
            }
        }

        @Override
        public void delete(Column column, byte[] key) {
            try {
                batch.delete(handles.get(column), key);
                size++;
            } catch (RocksDBException e) {
                throw new StorageUnavailableException("batch delete failed", e);
            }
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public void commit() {
            ensureWritable("commit");
            try {
                db.write(writeOptions, batch);
                batch.clear();
                size = 0;
            } catch (RocksDBException e) {
                throw new StorageUnavailableException("batch commit failed", e);
            }
        }

        @Override
        public void close() {
            batch.close();
        }
    }
}
