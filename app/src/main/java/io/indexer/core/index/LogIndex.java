package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Log;
import io.indexer.core.protocol.Receipt;
import io.indexer.core.storage.Column;
import io.indexer.core.storage.KeyValueDB;
import io.indexer.core.storage.Keys;
import io.indexer.core.storage.KvChainStore;
import io.indexer.core.storage.StoredBlock;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Address and topic0 lookups for logs. The logs themselves live in the chain area; entries here
 * only carry their position:
 *
 * <pre>
 * la/{address}/{height}/{txIndex}/{logIndex}
 * lt/{topic0}/{height}/{txIndex}/{logIndex}
 * </pre>
 */
public final class LogIndex implements IndexFamily, LogIndexReader {
    private static final byte[] EMPTY = new byte[0];

    private final KvChainStore store;
    private final KeyValueDB db;

    public LogIndex(KvChainStore store) {
        this.store = store;
        this.db = store.db();
    }

    @Override
    public String name() {
        return "log";
    }

    @Override
    public boolean mandatory() {
        return true;
    }

    @Override
    public void stage(IndexBatch batch, BlockBundle bundle) {
        for (Receipt r : bundle.receipts()) {
            for (Log log : r.logs()) {
                for (byte[] key : keys(log)) {
                    batch.put(key, EMPTY);
                }
            }
        }
    }

    @Override
    public void unstage(IndexBatch batch, StoredBlock stored) {
        for (Receipt r : stored.receipts()) {
            for (Log log : r.logs()) {
                for (byte[] key : keys(log)) {
                    batch.delete(key);
                }
            }
        }
    }

    @Override
    public List<Log> getLogs(OperationContext ctx, LogQuery query) {
        List<Log> out = new ArrayList<>();
        if (!query.addresses().isEmpty() || !query.firstTopics().isEmpty()) {
            TreeSet<Position> positions = new TreeSet<>();
            if (!query.addresses().isEmpty()) {
                for (Address a : query.addresses()) {
                    collect(ctx, "la", Keys.addr(a), query, positions);
                }
            } else {
                for (Hash topic : query.firstTopics()) {
                    collect(ctx, "lt", topic.hex(), query, positions);
                }
            }
            for (Position p : positions) {
                store.getLog(ctx, p.height, p.txIndex, p.logIndex)
                        .filter(query::matches)
                        .ifPresent(out::add);
            }
            return out;
        }
        store.scanLogs(ctx, query.fromHeight(), query.toHeight(), log -> {
            if (query.matches(log)) {
                out.add(log);
            }
            return true;
        });
        return out;
    }

    private void collect(OperationContext ctx, String bucket, String entity, LogQuery query, TreeSet<Position> sink) {
        byte[] from = Keys.key(bucket, entity, Keys.num(query.fromHeight()));
        byte[] to = query.toHeight() == Long.MAX_VALUE
                ? Keys.prefixEnd(Keys.key(bucket, entity, ""))
                : Keys.key(bucket, entity, Keys.num(query.toHeight() + 1));
        db.scan(Column.INDEX, from, to, false, e -> {
            ctx.checkActive();
            String[] parts = Keys.segments(e.key());
            int n = parts.length;
            sink.add(new Position(Long.parseLong(parts[n - 3]), Integer.parseInt(parts[n - 2]), Integer.parseInt(parts[n - 1])));
            return true;
        });
    }

    private static List<byte[]> keys(Log log) {
        String h = Keys.num(log.blockNumber());
        String ti = Keys.idx(log.txIndex());
        String li = Keys.idx(log.logIndex());
        List<byte[]> keys = new ArrayList<>(2);
        keys.add(Keys.key("la", Keys.addr(log.address()), h, ti, li));
        Hash topic0 = log.topic(0);
        if (topic0 != null) {
            keys.add(Keys.key("lt", topic0.hex(), h, ti, li));
        }
        return keys;
    }

    private record Position(long height, int txIndex, int logIndex) implements Comparable<Position> {
        @Override
        public int compareTo(Position o) {
            int c = Long.compare(height, o.height);
            if (c != 0) return c;
            c = Integer.compare(txIndex, o.txIndex);
            return c != 0 ? c : Integer.compare(logIndex, o.logIndex);
        }
    }
}
