package io.indexer.core.protocol;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical block with its ordered transactions. List position is the transaction index.
 */
public final class Block {
    private final long number;
    private final Hash hash;
    private final Hash parentHash;
    private final long timestamp;
    private final Address miner;
    private final long gasLimit;
    private final long gasUsed;
    private final BigInteger baseFee;
    private final Long blobGasUsed;
    private final Long excessBlobGas;
    private final byte[] extraData;
    private final List<Transaction> transactions;
    private final List<Hash> uncles;

    private Block(Builder b) {
        if (b.number < 0) throw new IllegalArgumentException("block number must be >= 0");
        this.number = b.number;
        this.hash = Objects.requireNonNull(b.hash, "hash");
        this.parentHash = b.parentHash == null ? Hash.ZERO : b.parentHash;
        this.timestamp = b.timestamp;
        this.miner = b.miner == null ? Address.ZERO : b.miner;
        this.gasLimit = b.gasLimit;
        this.gasUsed = b.gasUsed;
        this.baseFee = b.baseFee;
        this.blobGasUsed = b.blobGasUsed;
        this.excessBlobGas = b.excessBlobGas;
        this.extraData = b.extraData == null ? new byte[0] : b.extraData.clone();
        this.transactions = b.transactions == null ? List.of() : List.copyOf(b.transactions);
        this.uncles = b.uncles == null ? List.of() : List.copyOf(b.uncles);
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder().number(number).hash(hash).parentHash(parentHash).timestamp(timestamp)
                .miner(miner).gasLimit(gasLimit).gasUsed(gasUsed).baseFee(baseFee)
                .blobGas(blobGasUsed, excessBlobGas).extraData(extraData)
                .transactions(transactions).uncles(uncles);
    }

    public static final class Builder {
        private long number;
        private Hash hash;
        private Hash parentHash;
        private long timestamp;
        private Address miner;
        private long gasLimit;
        private long gasUsed;
        private BigInteger baseFee;
        private Long blobGasUsed;
        private Long excessBlobGas;
        private byte[] extraData;
        private List<Transaction> transactions;
        private List<Hash> uncles;

        public Builder number(long n) { this.number = n; return this; }
        public Builder hash(Hash h) { this.hash = h; return this; }
        public Builder parentHash(Hash h) { this.parentHash = h; return this; }
        public Builder timestamp(long t) { this.timestamp = t; return this; }
        public Builder miner(Address m) { this.miner = m; return this; }
        public Builder gasLimit(long g) { this.gasLimit = g; return this; }
        public Builder gasUsed(long g) { this.gasUsed = g; return this; }
        public Builder baseFee(BigInteger f) { this.baseFee = f; return this; }
        public Builder blobGas(Long used, Long excess) { this.blobGasUsed = used; this.excessBlobGas = excess; return this; }
        public Builder extraData(byte[] e) { this.extraData = e; return this; }
        public Builder transactions(List<Transaction> t) { this.transactions = t; return this; }
        public Builder uncles(List<Hash> u) { this.uncles = u; return this; }

        public Block build() { return new Block(this); }
    }

    public long number() { return number; }
    public Hash hash() { return hash; }
    public Hash parentHash() { return parentHash; }
    public long timestamp() { return timestamp; }
    public Address miner() { return miner; }
    public long gasLimit() { return gasLimit; }
    public long gasUsed() { return gasUsed; }
    /** Absent before the fee-market fork. */
    public Optional<BigInteger> baseFee() { return Optional.ofNullable(baseFee); }
    public Optional<Long> blobGasUsed() { return Optional.ofNullable(blobGasUsed); }
    public Optional<Long> excessBlobGas() { return Optional.ofNullable(excessBlobGas); }
    public byte[] extraData() { return extraData.clone(); }
    public List<Transaction> transactions() { return transactions; }
    public List<Hash> uncles() { return uncles; }

    @Override
    public boolean equals(Object o) {
        return o instanceof Block && number == ((Block) o).number && hash.equals(((Block) o).hash);
    }

    @Override
    public int hashCode() {
        return hash.hashCode();
    }

    @Override
    public String toString() {
        return "Block(" + number + ", " + hash + ", txs=" + transactions.size() + ")";
    }
}
