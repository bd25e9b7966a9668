package io.indexer.core.index;

import io.indexer.core.error.DecodeFailureException;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Log;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static io.indexer.core.ChainFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class TokenTransferDecoderTest {

    @Test
    void threeTopicsDecodeAsErc20() {
        TokenTransfer t = TokenTransferDecoder.decode(erc20Transfer(addr(0x20), addr(1), addr(2), 500, 7, hash("tx"), 1, 3))
                .orElseThrow();
        assertEquals(TokenStandard.ERC20, t.standard());
        assertEquals(addr(0x20), t.contract());
        assertEquals(addr(1), t.from());
        assertEquals(addr(2), t.to());
        assertEquals(BigInteger.valueOf(500), t.value());
        assertNull(t.tokenId());
        assertEquals(7L, t.blockNumber());
        assertEquals(3, t.logIndex());
    }

    @Test
    void fourTopicsDecodeAsErc721() {
        TokenTransfer t = TokenTransferDecoder.decode(nftTransfer(addr(0x21), Address.ZERO, addr(2), 42, 1, hash("tx"), 0, 0))
                .orElseThrow();
        assertEquals(TokenStandard.ERC721, t.standard());
        assertEquals(BigInteger.valueOf(42), t.tokenId());
        assertNull(t.value());
        assertTrue(t.mint());
        assertFalse(t.burn());
    }

    @Test
    void otherEventsAreIgnored() {
        Log other = log(addr(0x20), List.of(hash("Approval")), new byte[32], 1, hash("tx"), 0, 0);
        assertTrue(TokenTransferDecoder.decode(other).isEmpty());
        Log anonymous = log(addr(0x20), List.of(), new byte[0], 1, hash("tx"), 0, 0);
        assertTrue(TokenTransferDecoder.decode(anonymous).isEmpty());
    }

    @Test
    void malformedTransfersFail() {
        Log shortData = log(addr(0x20), List.of(TokenTransferDecoder.TRANSFER_TOPIC, word(addr(1)), word(addr(2))),
                new byte[0], 1, hash("tx"), 0, 0);
        assertThrows(DecodeFailureException.class, () -> TokenTransferDecoder.decode(shortData));

        Log twoTopics = log(addr(0x20), List.of(TokenTransferDecoder.TRANSFER_TOPIC, word(addr(1))),
                new byte[32], 1, hash("tx"), 0, 0);
        assertThrows(DecodeFailureException.class, () -> TokenTransferDecoder.decode(twoTopics));
    }
}
