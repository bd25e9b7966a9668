package io.indexer.core.index;

import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;

/**
 * A decoded system contract event.
 *
 * @param account     the address the event is about (recipient, burner, minter, member, voter...)
 * @param counterparty second address where the event has one (the minter of a mint, the proposer)
 * @param amount      the main quantity (amount, allowance, new tip), or {@code null}
 * @param proposalId  governance proposal the event belongs to, or {@code null}
 * @param details     remaining event fields by name, as decimal or hex strings
 */
public record SystemContractEvent(SystemEventKind kind,
                                  Address contract,
                                  long blockNumber,
                                  Hash txHash,
                                  int txIndex,
                                  int logIndex,
                                  Address account,
                                  Address counterparty,
                                  BigInteger amount,
                                  BigInteger proposalId,
                                  Map<String, String> details) {
    public SystemContractEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(contract, "contract");
        Objects.requireNonNull(txHash, "txHash");
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public String detail(String name) {
        return details.get(name);
    }
}
