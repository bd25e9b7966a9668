package io.indexer.core.index;

import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;

import java.math.BigInteger;

/** Current owner of an ERC721 token and the transfer that made it so. */
public record NftOwnership(Address contract,
                           BigInteger tokenId,
                           Address owner,
                           long blockNumber,
                           int logIndex,
                           Hash txHash) {

    boolean notNewerThan(long height, int index) {
        return blockNumber < height || (blockNumber == height && logIndex <= index);
    }
}
