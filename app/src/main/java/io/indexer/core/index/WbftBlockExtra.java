package io.indexer.core.index;

import io.indexer.core.protocol.Hash;

import java.math.BigInteger;

/** Consensus metadata decoded from a block's extra data. Absent seals and epoch info are null. */
public record WbftBlockExtra(long blockNumber,
                             Hash blockHash,
                             long timestamp,
                             byte[] randaoReveal,
                             long prevRound,
                             WbftSeal prevPreparedSeal,
                             WbftSeal prevCommittedSeal,
                             long round,
                             WbftSeal preparedSeal,
                             WbftSeal committedSeal,
                             BigInteger gasTip,
                             EpochInfo epochInfo) {
}
