package io.indexer.core.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Encodes a block header with its uncle list and transaction count. Transaction bodies
 * are stored separately and supplied back on decode.
 */
public final class BlockCodec {
    private static final int VERSION = 1;

    private BlockCodec(){}

    public static byte[] headerBytes(Block block) {
        BinaryWriter w = new BinaryWriter()
                .putInt(VERSION)
                .putLong(block.number())
                .putHash(block.hash())
                .putHash(block.parentHash())
                .putLong(block.timestamp())
                .putAddress(block.miner())
                .putLong(block.gasLimit())
                .putLong(block.gasUsed())
                .putOptionalBigInteger(block.baseFee().orElse(null))
                .putOptionalLong(block.blobGasUsed().orElse(null))
                .putOptionalLong(block.excessBlobGas().orElse(null))
                .putBytes(block.extraData());
        w.putInt(block.uncles().size());
        for (Hash uncle : block.uncles()) {
            w.putHash(uncle);
        }
        w.putInt(block.transactions().size());
        return w.toByteArray();
    }

    /** Decodes the header and returns a builder whose transaction list is still empty. */
    public static Header fromHeaderBytes(byte[] bytes) {
        try {
            BinaryReader r = new BinaryReader(bytes);
            int version = r.getInt();
            if (version != VERSION) {
                throw new IllegalArgumentException("unsupported block encoding v" + version);
            }
            Block.Builder b = Block.builder()
                    .number(r.getLong())
                    .hash(r.getHash())
                    .parentHash(r.getHash())
                    .timestamp(r.getLong())
                    .miner(r.getAddress())
                    .gasLimit(r.getLong())
                    .gasUsed(r.getLong())
                    .baseFee(r.getOptionalBigInteger());
            Long blobGasUsed = r.getOptionalLong();
            Long excessBlobGas = r.getOptionalLong();
            b.blobGas(blobGasUsed, excessBlobGas).extraData(r.getBytes());
            int uncleCount = r.getCount(Hash.LENGTH);
            List<Hash> uncles = new ArrayList<>(uncleCount);
            for (int i = 0; i < uncleCount; i++) {
                uncles.add(r.getHash());
            }
            b.uncles(uncles);
            int txCount = r.getInt();
            if (txCount < 0) {
                throw new IllegalArgumentException("bad tx count: " + txCount);
            }
            return new Header(b, txCount);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Block bytes", ex);
        }
    }

    public record Header(Block.Builder builder, int transactionCount) {
        /** The header fields only, with an empty transaction list. */
        public Block headerOnly() {
            return builder.build();
        }

        public Block withTransactions(List<Transaction> txs) {
            if (txs.size() != transactionCount) {
                throw new IllegalArgumentException("expected " + transactionCount + " transactions, got " + txs.size());
            }
            return builder.transactions(txs).build();
        }
    }
}
