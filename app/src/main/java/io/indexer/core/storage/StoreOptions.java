package io.indexer.core.storage;

/** Tuning for the RocksDB backend. */
public record StoreOptions(boolean readOnly, long blockCacheBytes, int maxOpenFiles, long writeBufferBytes) {
    public static final long MIB = 1024L * 1024L;

    public StoreOptions {
        if (blockCacheBytes < 0 || writeBufferBytes <= 0) {
            throw new IllegalArgumentException("cache and write buffer sizes must be positive");
        }
    }

    public static StoreOptions defaults() {
        return new StoreOptions(false, 128 * MIB, 1000, 64 * MIB);
    }

    public StoreOptions withReadOnly(boolean ro) {
        return new StoreOptions(ro, blockCacheBytes, maxOpenFiles, writeBufferBytes);
    }
}
