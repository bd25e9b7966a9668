package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.storage.Column;
import io.indexer.core.storage.KeyValueDB;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Secondary-index view of one write batch. Reads see committed state only; writes land in the
 * batch shared with the primary records of the same height.
 */
public final class IndexBatch {
    private final OperationContext ctx;
    private final KeyValueDB db;
    private final KeyValueDB.Batch batch;
    private final List<Runnable> commitHooks = new ArrayList<>();
    private final List<String> decodeFailures = new ArrayList<>();

    IndexBatch(OperationContext ctx, KeyValueDB db, KeyValueDB.Batch batch) {
        this.ctx = ctx;
        this.db = db;
        this.batch = batch;
    }

    public OperationContext ctx() {
        return ctx;
    }

    public void put(byte[] key, byte[] value) {
        batch.put(Column.INDEX, key, value);
    }

    public void delete(byte[] key) {
        batch.delete(Column.INDEX, key);
    }

    public byte[] get(byte[] key) {
        return db.get(Column.INDEX, key);
    }

    public void scanPrefix(byte[] prefix, boolean reverse, Predicate<KeyValueDB.Entry> visitor) {
        db.scanPrefix(Column.INDEX, prefix, reverse, visitor);
    }

    /**
     * Registers work that must read committed state and write into this batch while no other
     * height commits, such as resolving the current NFT owner.
     */
    public void onCommit(Runnable hook) {
        commitHooks.add(hook);
    }

    public void decodeFailure(String description) {
        decodeFailures.add(description);
    }

    List<String> decodeFailures() {
        return decodeFailures;
    }

    void runCommitHooks() {
        for (Runnable hook : commitHooks) {
            hook.run();
        }
        commitHooks.clear();
    }
}
