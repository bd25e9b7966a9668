package io.indexer.core.index;

import io.indexer.core.error.DecodeFailureException;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Hashes;
import io.indexer.core.protocol.Log;

import java.math.BigInteger;
import java.util.Optional;

/** Decodes ERC20 and ERC721 {@code Transfer(address,address,uint256)} logs. */
public final class TokenTransferDecoder {
    public static final Hash TRANSFER_TOPIC = Hashes.eventTopic("Transfer(address,address,uint256)");

    private TokenTransferDecoder() {}

    /**
     * Empty when the log is not a Transfer event.
     *
     * @throws DecodeFailureException when the log has the Transfer topic but not a valid layout
     */
    public static Optional<TokenTransfer> decode(Log log) {
        if (!TRANSFER_TOPIC.equals(log.topic(0))) {
            return Optional.empty();
        }
        byte[] data = log.data();
        switch (log.topics().size()) {
            case 3:
                if (data.length != 32) {
                    throw new DecodeFailureException("ERC20 Transfer in " + log.txHash() + "#" + log.logIndex()
                            + " has " + data.length + " data bytes");
                }
                return Optional.of(new TokenTransfer(TokenStandard.ERC20, log.address(),
                        Address.fromWord(log.topic(1).bytes()), Address.fromWord(log.topic(2).bytes()),
                        new BigInteger(1, data), null,
                        log.txHash(), log.blockNumber(), log.txIndex(), log.logIndex()));
            case 4:
                return Optional.of(new TokenTransfer(TokenStandard.ERC721, log.address(),
                        Address.fromWord(log.topic(1).bytes()), Address.fromWord(log.topic(2).bytes()),
                        null, new BigInteger(1, log.topic(3).bytes()),
                        log.txHash(), log.blockNumber(), log.txIndex(), log.logIndex()));
            default:
                throw new DecodeFailureException("Transfer in " + log.txHash() + "#" + log.logIndex()
                        + " has " + log.topics().size() + " topics");
        }
    }
}
