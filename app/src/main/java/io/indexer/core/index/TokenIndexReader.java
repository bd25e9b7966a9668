package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;

import java.math.BigInteger;
import java.util.List;

public interface TokenIndexReader {
    List<TokenTransfer> getTokenTransfersByTx(OperationContext ctx, Hash txHash);

    List<TokenTransfer> getTokenTransfersByToken(OperationContext ctx, Address contract, PageRequest page);

    List<TokenTransfer> getTokenTransfersByAddress(OperationContext ctx, Address address, TransferDirection direction, PageRequest page);

    /** @throws io.indexer.core.error.NotFoundException when the token was never transferred */
    NftOwnership getNftOwner(OperationContext ctx, Address contract, BigInteger tokenId);

    List<TokenTransfer> getNftTransferHistory(OperationContext ctx, Address contract, BigInteger tokenId, PageRequest page);
}
