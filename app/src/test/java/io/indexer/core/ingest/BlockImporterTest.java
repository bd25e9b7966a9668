package io.indexer.core.ingest;

import io.indexer.core.OperationContext;
import io.indexer.core.index.AddressIndexReader;
import io.indexer.core.index.BlockBundle;
import io.indexer.core.index.BlockIndexer;
import io.indexer.core.index.IndexCatalog;
import io.indexer.core.index.SystemEventDecoders;
import io.indexer.core.protocol.Block;
import io.indexer.core.protocol.Secp256k1SignerRecovery;
import io.indexer.core.storage.InMemoryKeyValueDB;
import io.indexer.core.storage.KvChainStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.indexer.core.ChainFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class BlockImporterTest {
    private final OperationContext ctx = OperationContext.background();
    private KvChainStore store;
    private BlockIndexer indexer;

    @BeforeEach
    void setUp() {
        store = new KvChainStore(new InMemoryKeyValueDB());
        IndexCatalog catalog = IndexCatalog.standard(store, new Secp256k1SignerRecovery(), SystemEventDecoders.initialize(), null);
        indexer = new BlockIndexer(store, catalog, null);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void importsEveryHeightOnThePool() throws Exception {
        List<BlockBundle> bundles = new ArrayList<>();
        for (long h = 0; h < 20; h++) {
            bundles.add(bundle(block(h, List.of(legacyTx("tx-" + h, addr(1), addr(2), 1)))));
        }

        BlockImporter.Summary summary = new BlockImporter(indexer, 4).run(ctx, bundles);

        assertEquals(20, summary.primaryIndexed());
        assertEquals(20, summary.fullyIndexed());
        assertTrue(summary.failedHeights().isEmpty());
        assertEquals(19L, store.getLatestHeight(ctx));
        assertEquals(19L, store.getFullyIndexedHeight(ctx));
        assertEquals(20L, indexer.catalog().require(AddressIndexReader.class).getAddressTransactionCount(ctx, addr(1)));
    }

    @Test
    void rejectedHeightIsReportedAndHoldsBackTheWatermark() throws Exception {
        List<BlockBundle> bundles = new ArrayList<>();
        for (long h = 0; h < 4; h++) {
            Block b = block(h, List.of(legacyTx("tx-" + h, addr(1), addr(2), 1)));
            int status = h == 2 ? 7 : 1;
            bundles.add(new BlockBundle(b, List.of(receipt(b, 0, status, 21_000, List.of()))));
        }

        BlockImporter.Summary summary = new BlockImporter(indexer, 2).run(ctx, bundles);

        assertEquals(3, summary.primaryIndexed());
        assertEquals(3, summary.fullyIndexed());
        assertEquals(List.of(2L), summary.failedHeights());
        assertEquals(1L, store.getLatestHeight(ctx));
        assertTrue(store.hasBlock(ctx, 3));
    }

    @Test
    void workerCountMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new BlockImporter(indexer, 0));
    }
}
