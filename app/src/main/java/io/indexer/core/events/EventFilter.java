package io.indexer.core.events;

import io.indexer.core.error.InvalidInputException;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Log;
import io.indexer.core.protocol.Transaction;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Optional predicate attached to a subscription. Empty sets and null bounds match everything.
 *
 * Blocks are matched on the block range only. Transactions are matched on the range, the
 * participant sets and the value bounds. Logs are matched on the range, the emitting address
 * (against {@code addresses}) and the positional topics.
 */
public final class EventFilter {
    private static final EventFilter ANY = builder().build();

    private final Set<Address> addresses;
    private final Set<Address> fromAddresses;
    private final Set<Address> toAddresses;
    private final BigInteger minValue;
    private final BigInteger maxValue;
    private final Long fromBlock;
    private final Long toBlock;
    private final List<Set<Hash>> topics;

    private EventFilter(Builder b) {
        this.addresses = Set.copyOf(b.addresses);
        this.fromAddresses = Set.copyOf(b.fromAddresses);
        this.toAddresses = Set.copyOf(b.toAddresses);
        this.minValue = b.minValue;
        this.maxValue = b.maxValue;
        this.fromBlock = b.fromBlock;
        this.toBlock = b.toBlock;
        List<Set<Hash>> t = new ArrayList<>(b.topics.size());
        for (Set<Hash> position : b.topics) {
            t.add(position == null ? Set.of() : Set.copyOf(position));
        }
        this.topics = List.copyOf(t);
    }

    public static EventFilter any() {
        return ANY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Set<Address> addresses = Set.of();
        private Set<Address> fromAddresses = Set.of();
        private Set<Address> toAddresses = Set.of();
        private BigInteger minValue;
        private BigInteger maxValue;
        private Long fromBlock;
        private Long toBlock;
        private List<Set<Hash>> topics = List.of();

        private Builder() {}

        public Builder addresses(Set<Address> a) { this.addresses = a == null ? Set.of() : a; return this; }
        public Builder fromAddresses(Set<Address> a) { this.fromAddresses = a == null ? Set.of() : a; return this; }
        public Builder toAddresses(Set<Address> a) { this.toAddresses = a == null ? Set.of() : a; return this; }
        public Builder valueRange(BigInteger min, BigInteger max) { this.minValue = min; this.maxValue = max; return this; }
        public Builder blockRange(Long from, Long to) { this.fromBlock = from; this.toBlock = to; return this; }
        /** Positional topics; an empty or null set at a position is a wildcard. */
        public Builder topics(List<Set<Hash>> t) { this.topics = t == null ? List.of() : new ArrayList<>(t); return this; }

        public EventFilter build() { return new EventFilter(this); }
    }

    public Set<Address> addresses() { return addresses; }
    public Set<Address> fromAddresses() { return fromAddresses; }
    public Set<Address> toAddresses() { return toAddresses; }
    public BigInteger minValue() { return minValue; }
    public BigInteger maxValue() { return maxValue; }
    public Long fromBlock() { return fromBlock; }
    public Long toBlock() { return toBlock; }
    public List<Set<Hash>> topics() { return topics; }

    public void validate() {
        if (minValue != null && minValue.signum() < 0) {
            throw new InvalidInputException("minValue must be >= 0");
        }
        if (maxValue != null && maxValue.signum() < 0) {
            throw new InvalidInputException("maxValue must be >= 0");
        }
        if (minValue != null && maxValue != null && minValue.compareTo(maxValue) > 0) {
            throw new InvalidInputException("minValue " + minValue + " is above maxValue " + maxValue);
        }
        if (fromBlock != null && fromBlock < 0) {
            throw new InvalidInputException("fromBlock must be >= 0: " + fromBlock);
        }
        if (fromBlock != null && toBlock != null && fromBlock > toBlock) {
            throw new InvalidInputException("fromBlock " + fromBlock + " is above toBlock " + toBlock);
        }
    }

    public boolean matches(ChainEvent event) {
        if (!inRange(event.blockNumber())) {
            return false;
        }
        if (event instanceof TransactionEvent te) {
            return matchesTransaction(te.transaction());
        }
        if (event instanceof LogEvent le) {
            return matchesLog(le.log());
        }
        return true;
    }

    private boolean inRange(long height) {
        if (fromBlock != null && height < fromBlock) {
            return false;
        }
        return toBlock == null || height <= toBlock;
    }

    private boolean matchesTransaction(Transaction tx) {
        Address to = tx.to().orElse(null);
        if (!addresses.isEmpty() && !addresses.contains(tx.from()) && (to == null || !addresses.contains(to))) {
            return false;
        }
        if (!fromAddresses.isEmpty() && !fromAddresses.contains(tx.from())) {
            return false;
        }
        // a contract creation has no recipient to match
        if (!toAddresses.isEmpty() && (to == null || !toAddresses.contains(to))) {
            return false;
        }
        BigInteger value = tx.value() == null ? BigInteger.ZERO : tx.value();
        if (minValue != null && value.compareTo(minValue) < 0) {
            return false;
        }
        return maxValue == null || value.compareTo(maxValue) <= 0;
    }

    private boolean matchesLog(Log log) {
        if (!addresses.isEmpty() && !addresses.contains(log.address())) {
            return false;
        }
        for (int i = 0; i < topics.size(); i++) {
            Set<Hash> wanted = topics.get(i);
            if (wanted.isEmpty()) {
                continue;
            }
            Hash actual = log.topic(i);
            if (actual == null || !wanted.contains(actual)) {
                return false;
            }
        }
        return true;
    }
}
