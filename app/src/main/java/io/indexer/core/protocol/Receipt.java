package io.indexer.core.protocol;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Execution receipt keyed by transaction hash. {@code gasUsed} and {@code effectiveGasPrice}
 * carry whatever the source reported (possibly zero or null); stores replace them with
 * derived values on read.
 */
public record Receipt(Hash txHash,
                      int status,
                      long cumulativeGasUsed,
                      long gasUsed,
                      BigInteger effectiveGasPrice,
                      Address contractAddress,
                      byte[] logsBloom,
                      List<Log> logs,
                      long blockNumber,
                      Hash blockHash,
                      int txIndex) {

    public static final int STATUS_FAILED = 0;
    public static final int STATUS_SUCCESS = 1;
    public static final int BLOOM_LENGTH = 256;

    public Receipt {
        Objects.requireNonNull(txHash, "txHash");
        Objects.requireNonNull(blockHash, "blockHash");
        logsBloom = logsBloom == null ? new byte[BLOOM_LENGTH] : logsBloom.clone();
        logs = logs == null ? List.of() : List.copyOf(logs);
    }

    public boolean succeeded() {
        return status == STATUS_SUCCESS;
    }

    @Override
    public byte[] logsBloom() {
        return logsBloom.clone();
    }

    public Receipt withDerived(long derivedGasUsed, BigInteger derivedPrice, Address derivedContract) {
        return new Receipt(txHash, status, cumulativeGasUsed, derivedGasUsed, derivedPrice,
                derivedContract, logsBloom, logs, blockNumber, blockHash, txIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Receipt)) return false;
        Receipt other = (Receipt) o;
        return status == other.status
                && cumulativeGasUsed == other.cumulativeGasUsed
                && gasUsed == other.gasUsed
                && blockNumber == other.blockNumber
                && txIndex == other.txIndex
                && txHash.equals(other.txHash)
                && Objects.equals(effectiveGasPrice, other.effectiveGasPrice)
                && Objects.equals(contractAddress, other.contractAddress)
                && Arrays.equals(logsBloom, other.logsBloom)
                && logs.equals(other.logs)
                && blockHash.equals(other.blockHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(txHash, status, cumulativeGasUsed, blockNumber, txIndex);
    }
}
