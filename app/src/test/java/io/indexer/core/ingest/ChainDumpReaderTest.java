package io.indexer.core.ingest;

import io.indexer.core.error.InvalidInputException;
import io.indexer.core.index.BlockBundle;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Block;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Receipt;
import io.indexer.core.protocol.Transaction;
import io.indexer.core.protocol.TxType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ChainDumpReaderTest {
    private static final String BLOCK_0 = "0x" + "b0".repeat(32);
    private static final String BLOCK_1 = "0x" + "b1".repeat(32);
    private static final String TX_0 = "0x" + "a0".repeat(32);
    private static final String TX_1 = "0x" + "a1".repeat(32);
    private static final String TOPIC = "0x" + "cc".repeat(32);
    private static final String SENDER = "0x" + "11".repeat(20);
    private static final String RECEIVER = "0x" + "22".repeat(20);

    private static final String DUMP = """
            {"blocks": [
              {"number": "0x0", "hash": "%1$s", "timestamp": "0x64", "miner": "%6$s",
               "baseFeePerGas": "0x64", "gasLimit": "0x1c9c380", "extraData": "0x",
               "transactions": [
                 {"hash": "%3$s", "from": "%6$s", "to": "%7$s", "value": "0x3e8",
                  "gas": "0x5208", "gasPrice": "0x96", "nonce": "0x0"}
               ],
               "receipts": [
                 {"transactionHash": "%3$s", "status": "0x1", "cumulativeGasUsed": "0x5208",
                  "logs": [{"address": "%7$s", "topics": ["%5$s"], "data": "0x01", "logIndex": "0x0"}]}
               ]},
              {"number": 1, "hash": "%2$s", "parentHash": "%1$s", "timestamp": 102,
               "baseFeePerGas": "0x64",
               "transactions": [
                 {"hash": "%4$s", "type": "0x2", "from": "%7$s", "to": "%6$s", "gas": "0x5208",
                  "maxPriorityFeePerGas": "0x14", "maxFeePerGas": "0xc8", "chainId": "0x1"}
               ],
               "receipts": [
                 {"transactionHash": "%4$s", "status": "0x0", "cumulativeGasUsed": "0x5208", "logs": []}
               ],
               "traces": {
                 "%4$s": [{"type": "CALL", "from": "%7$s", "to": "%6$s", "value": "0x0", "depth": 0,
                           "error": "execution reverted"}]
               }}
            ]}
            """.formatted(BLOCK_0, BLOCK_1, TX_0, TX_1, TOPIC, SENDER, RECEIVER);

    private final ChainDumpReader reader = new ChainDumpReader();

    @Test
    void readsBlocksTransactionsReceiptsAndTraces() throws IOException {
        List<BlockBundle> bundles = reader.read(stream(DUMP));
        assertEquals(2, bundles.size());

        Block b0 = bundles.get(0).block();
        assertEquals(0L, b0.number());
        assertEquals(Hash.fromHex(BLOCK_0), b0.hash());
        assertEquals(100L, b0.timestamp());
        assertEquals(BigInteger.valueOf(100), b0.baseFee().orElseThrow());

        Transaction tx0 = b0.transactions().get(0);
        assertEquals(TxType.LEGACY, tx0.type());
        assertEquals(Address.fromHex(RECEIVER), tx0.to().orElseThrow());
        assertEquals(BigInteger.valueOf(1000), tx0.value());
        assertEquals(BigInteger.valueOf(150), tx0.gasPrice());

        Receipt r0 = bundles.get(0).receipts().get(0);
        assertTrue(r0.succeeded());
        assertEquals(21_000L, r0.cumulativeGasUsed());
        assertEquals(0, r0.txIndex());
        assertEquals(1, r0.logs().size());
        assertEquals(Hash.fromHex(TX_0), r0.logs().get(0).txHash());
        assertArrayEquals(new byte[] {1}, r0.logs().get(0).data());

        BlockBundle second = bundles.get(1);
        Transaction tx1 = second.block().transactions().get(0);
        assertEquals(TxType.DYNAMIC_FEE, tx1.type());
        assertEquals(BigInteger.valueOf(20), tx1.gasTipCap());
        assertEquals(BigInteger.valueOf(200), tx1.gasFeeCap());
        assertFalse(second.receipts().get(0).succeeded());
        assertEquals(1, second.trace(tx1.hash()).size());
        assertFalse(second.trace(tx1.hash()).get(0).succeeded());
    }

    @Test
    void readsABareArrayFromAFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("dump.json");
        String bare = DUMP.substring(DUMP.indexOf('['), DUMP.lastIndexOf(']') + 1);
        Files.writeString(file, bare);

        assertEquals(2, reader.read(file).size());
    }

    @Test
    void rejectsMalformedDumps() {
        assertThrows(InvalidInputException.class, () -> reader.read(stream("{\"height\": 1}")));

        String hashesOnly = """
                [{"number": "0x0", "hash": "%s", "timestamp": "0x0", "transactions": ["%s"]}]
                """.formatted(BLOCK_0, TX_0);
        InvalidInputException e = assertThrows(InvalidInputException.class, () -> reader.read(stream(hashesOnly)));
        assertTrue(e.getMessage().contains("block entry 0"));

        String orphanReceipt = """
                [{"number": "0x0", "hash": "%s", "timestamp": "0x0", "transactions": [],
                  "receipts": [{"transactionHash": "%s", "cumulativeGasUsed": "0x0"}]}]
                """.formatted(BLOCK_0, TX_0);
        assertThrows(InvalidInputException.class, () -> reader.read(stream(orphanReceipt)));
    }

    private static InputStream stream(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }
}
