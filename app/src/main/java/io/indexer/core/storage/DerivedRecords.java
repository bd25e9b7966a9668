package io.indexer.core.storage;

import io.indexer.core.OperationContext;

/**
 * Secondary records derived from stored blocks. The index maintainer attaches itself so that store
 * level deletes and replacements drop those records in the same batch as the primary data.
 */
@FunctionalInterface
public interface DerivedRecords {
    DerivedRecords NONE = (ctx, batch, stored) -> () -> {};

    /**
     * Stages removal of every record derived from {@code stored} and returns the work that must run
     * under the commit lock right before the batch commits.
     */
    Runnable unstage(OperationContext ctx, KeyValueDB.Batch batch, StoredBlock stored);
}
