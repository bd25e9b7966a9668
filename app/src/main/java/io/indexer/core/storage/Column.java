package io.indexer.core.storage;

import java.nio.charset.StandardCharsets;

/** Storage areas. Each maps to its own RocksDB column family. */
public enum Column {
    /** Blocks, transactions, receipts and logs. */
    CHAIN("chain"),
    /** Secondary index records. */
    INDEX("index"),
    /** Watermarks and aggregate counters. */
    META("meta");

    private final String familyName;

    Column(String familyName) {
        this.familyName = familyName;
    }

    public byte[] familyName() {
        return familyName.getBytes(StandardCharsets.US_ASCII);
    }
}
