package io.indexer.core.protocol;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical transaction as ingested from the node. Immutable once built; fee fields
 * that do not apply to the type are {@code null}.
 */
public final class Transaction {

    private final Hash hash;
    private final TxType type;
    private final BigInteger chainId;
    private final long nonce;

    private final Address from;
    private final Address to;
    private final BigInteger value;
    private final long gas;

    private final BigInteger gasPrice;
    private final BigInteger gasTipCap;
    private final BigInteger gasFeeCap;
    private final BigInteger maxFeePerBlobGas;

    private final byte[] input;
    private final BigInteger v;
    private final BigInteger r;
    private final BigInteger s;

    private final List<AccessTuple> accessList;
    private final List<SetCodeAuthorization> authorizations;
    private final List<Hash> blobHashes;
    private final Address feePayer;

    private Transaction(Builder b) {
        this.hash = Objects.requireNonNull(b.hash, "hash");
        this.type = Objects.requireNonNull(b.type, "type");
        this.chainId = b.chainId;
        this.nonce = b.nonce;
        this.from = Objects.requireNonNull(b.from, "from");
        this.to = b.to;
        this.value = b.value == null ? BigInteger.ZERO : b.value;
        this.gas = b.gas;
        this.gasPrice = b.gasPrice;
        this.gasTipCap = b.gasTipCap;
        this.gasFeeCap = b.gasFeeCap;
        this.maxFeePerBlobGas = b.maxFeePerBlobGas;
        this.input = b.input != null ? b.input.clone() : new byte[0];
        this.v = b.v == null ? BigInteger.ZERO : b.v;
        this.r = b.r == null ? BigInteger.ZERO : b.r;
        this.s = b.s == null ? BigInteger.ZERO : b.s;
        this.accessList = b.accessList == null ? List.of() : List.copyOf(b.accessList);
        this.authorizations = b.authorizations == null ? List.of() : List.copyOf(b.authorizations);
        this.blobHashes = b.blobHashes == null ? List.of() : List.copyOf(b.blobHashes);
        this.feePayer = b.feePayer;
        basicValidate();
    }

    private void basicValidate() {
        if (value.signum() < 0) throw new IllegalArgumentException("value must be >= 0");
        if (gas < 0) throw new IllegalArgumentException("gas must be >= 0");
        if (type.usesFeeMarket() && (gasTipCap == null || gasFeeCap == null)) {
            throw new IllegalArgumentException(type + " transaction requires gasTipCap and gasFeeCap");
        }
        if (!type.usesFeeMarket() && gasPrice == null) {
            throw new IllegalArgumentException(type + " transaction requires gasPrice");
        }
        if (type == TxType.SET_CODE && authorizations.isEmpty()) {
            throw new IllegalArgumentException("set-code transaction requires an authorization list");
        }
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder()
                .hash(hash).type(type).chainId(chainId).nonce(nonce)
                .from(from).to(to).value(value).gas(gas)
                .gasPrice(gasPrice).gasTipCap(gasTipCap).gasFeeCap(gasFeeCap)
                .maxFeePerBlobGas(maxFeePerBlobGas).input(input)
                .signature(v, r, s)
                .accessList(accessList).authorizations(authorizations)
                .blobHashes(blobHashes).feePayer(feePayer);
    }

    public static final class Builder {
        private Hash hash;
        private TxType type = TxType.LEGACY;
        private BigInteger chainId;
        private long nonce;
        private Address from;
        private Address to;
        private BigInteger value = BigInteger.ZERO;
        private long gas;
        private BigInteger gasPrice;
        private BigInteger gasTipCap;
        private BigInteger gasFeeCap;
        private BigInteger maxFeePerBlobGas;
        private byte[] input = new byte[0];
        private BigInteger v;
        private BigInteger r;
        private BigInteger s;
        private List<AccessTuple> accessList;
        private List<SetCodeAuthorization> authorizations;
        private List<Hash> blobHashes;
        private Address feePayer;

        public Builder hash(Hash h) { this.hash = h; return this; }
        public Builder type(TxType t) { this.type = t; return this; }
        public Builder chainId(BigInteger id) { this.chainId = id; return this; }
        public Builder nonce(long n) { this.nonce = n; return this; }
        public Builder from(Address f) { this.from = f; return this; }
        public Builder to(Address t) { this.to = t; return this; }
        public Builder value(BigInteger v) { this.value = v; return this; }
        public Builder gas(long g) { this.gas = g; return this; }
        public Builder gasPrice(BigInteger p) { this.gasPrice = p; return this; }
        public Builder gasTipCap(BigInteger p) { this.gasTipCap = p; return this; }
        public Builder gasFeeCap(BigInteger p) { this.gasFeeCap = p; return this; }
        public Builder maxFeePerBlobGas(BigInteger p) { this.maxFeePerBlobGas = p; return this; }
        public Builder input(byte[] in) { this.input = in; return this; }
        public Builder signature(BigInteger v, BigInteger r, BigInteger s) { this.v = v; this.r = r; this.s = s; return this; }
        public Builder accessList(List<AccessTuple> l) { this.accessList = l; return this; }
        public Builder authorizations(List<SetCodeAuthorization> l) { this.authorizations = l; return this; }
        public Builder blobHashes(List<Hash> l) { this.blobHashes = l; return this; }
        public Builder feePayer(Address p) { this.feePayer = p; return this; }

        public Transaction build() { return new Transaction(this); }
    }

    public Hash hash() { return hash; }
    public TxType type() { return type; }
    public BigInteger chainId() { return chainId; }
    public long nonce() { return nonce; }
    public Address from() { return from; }
    /** Empty for contract creation. */
    public Optional<Address> to() { return Optional.ofNullable(to); }
    public boolean isContractCreation() { return to == null; }
    public BigInteger value() { return value; }
    public long gas() { return gas; }
    public BigInteger gasPrice() { return gasPrice; }
    public BigInteger gasTipCap() { return gasTipCap; }
    public BigInteger gasFeeCap() { return gasFeeCap; }
    public BigInteger maxFeePerBlobGas() { return maxFeePerBlobGas; }
    public byte[] input() { return input.clone(); }
    public BigInteger v() { return v; }
    public BigInteger r() { return r; }
    public BigInteger s() { return s; }
    public List<AccessTuple> accessList() { return accessList; }
    public List<SetCodeAuthorization> authorizations() { return authorizations; }
    public List<Hash> blobHashes() { return blobHashes; }
    public Optional<Address> feePayer() { return Optional.ofNullable(feePayer); }

    /** The account charged for gas: the fee payer of a fee-delegated transaction, else the sender. */
    public Address gasPayer() {
        return feePayer != null ? feePayer : from;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Transaction && hash.equals(((Transaction) o).hash);
    }

    @Override
    public int hashCode() {
        return hash.hashCode();
    }

    @Override
    public String toString() {
        return "Transaction(" + hash + ", " + type + ")";
    }
}
