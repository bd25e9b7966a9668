package io.indexer.core.index;

import io.indexer.core.protocol.Block;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Receipt;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything the ingestion path hands over for one height: the finalized block, its receipts
 * and, when a tracer is available, the internal calls per transaction.
 */
public record BlockBundle(Block block, List<Receipt> receipts, Map<Hash, List<InternalCall>> traces) {

    public BlockBundle {
        Objects.requireNonNull(block, "block");
        receipts = receipts == null ? List.of() : List.copyOf(receipts);
        traces = traces == null ? Map.of() : Map.copyOf(traces);
        for (Receipt r : receipts) {
            if (r.blockNumber() != block.number()) {
                throw new IllegalArgumentException("receipt " + r.txHash() + " belongs to block " + r.blockNumber()
                        + ", not " + block.number());
            }
        }
    }

    public BlockBundle(Block block, List<Receipt> receipts) {
        this(block, receipts, Map.of());
    }

    public long height() {
        return block.number();
    }

    /** Receipts keyed by transaction hash. */
    public Map<Hash, Receipt> receiptsByTx() {
        Map<Hash, Receipt> out = new HashMap<>();
        for (Receipt r : receipts) {
            out.put(r.txHash(), r);
        }
        return out;
    }

    public Optional<Receipt> receipt(Hash txHash) {
        for (Receipt r : receipts) {
            if (r.txHash().equals(txHash)) {
                return Optional.of(r);
            }
        }
        return Optional.empty();
    }

    public List<InternalCall> trace(Hash txHash) {
        return traces.getOrDefault(txHash, List.of());
    }
}
