package io.indexer.core.index;

import io.indexer.core.storage.StoredBlock;

/**
 * One group of secondary records derived from primary chain data.
 */
public interface IndexFamily {

    String name();

    /**
     * Mandatory families are committed in the same batch as the primary block; the others
     * follow in a second batch that gates the fully-indexed watermark.
     */
    boolean mandatory();

    /** Stages every record this family derives from the bundle. Must be idempotent per height. */
    void stage(IndexBatch batch, BlockBundle bundle);

    /** Stages removal of every record previously derived from this stored block. */
    void unstage(IndexBatch batch, StoredBlock stored);
}
