package io.indexer.core.protocol;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public record Log(Address address,
                  List<Hash> topics,
                  byte[] data,
                  long blockNumber,
                  Hash blockHash,
                  Hash txHash,
                  int txIndex,
                  int logIndex,
                  boolean removed) {

    public Log {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(blockHash, "blockHash");
        Objects.requireNonNull(txHash, "txHash");
        topics = topics == null ? List.of() : List.copyOf(topics);
        data = data == null ? new byte[0] : data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    public Hash topic(int position) {
        return position < topics.size() ? topics.get(position) : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Log)) return false;
        Log other = (Log) o;
        return blockNumber == other.blockNumber
                && txIndex == other.txIndex
                && logIndex == other.logIndex
                && removed == other.removed
                && address.equals(other.address)
                && topics.equals(other.topics)
                && Arrays.equals(data, other.data)
                && blockHash.equals(other.blockHash)
                && txHash.equals(other.txHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(txHash, logIndex, blockNumber);
    }
}
