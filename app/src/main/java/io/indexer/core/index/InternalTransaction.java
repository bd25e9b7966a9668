package io.indexer.core.index;

import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;

import java.math.BigInteger;

/** An indexed internal call, identified by (tx hash, call index). */
public record InternalTransaction(Hash txHash,
                                  long blockNumber,
                                  int index,
                                  String type,
                                  Address from,
                                  Address to,
                                  BigInteger value,
                                  long gas,
                                  long gasUsed,
                                  int depth,
                                  String error) {
}
