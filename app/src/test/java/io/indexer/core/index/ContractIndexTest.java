package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.error.InvalidInputException;
import io.indexer.core.error.NotFoundException;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Block;
import io.indexer.core.protocol.Receipt;
import io.indexer.core.protocol.Transaction;
import io.indexer.core.storage.InMemoryKeyValueDB;
import io.indexer.core.storage.KvChainStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.indexer.core.ChainFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class ContractIndexTest {
    private static final Address DEPLOYER = addr(0xde);
    private static final Address FIRST = addr(0xc1);
    private static final Address SECOND = addr(0xc2);
    private static final Address REVERTED = addr(0xc3);

    private final OperationContext ctx = OperationContext.background();
    private KvChainStore store;
    private ContractIndex contracts;
    private BlockIndexer indexer;

    @BeforeEach
    void setUp() {
        store = new KvChainStore(new InMemoryKeyValueDB());
        contracts = new ContractIndex(store.db());
        indexer = new BlockIndexer(store, new IndexCatalog(List.of(new AddressIndex(store.db()), contracts)), null);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void successfulDeploymentsAreRecorded() {
        Transaction ok = deployTx("deploy-ok", 4);
        Transaction failed = deployTx("deploy-failed", 2);
        Transaction call = legacyTx("call", DEPLOYER, addr(2), 1);
        Block b = block(0, List.of(ok, failed, call));
        indexer.index(ctx, new BlockBundle(b, List.of(
                creationReceipt(b, 0, Receipt.STATUS_SUCCESS, FIRST),
                creationReceipt(b, 1, Receipt.STATUS_FAILED, REVERTED),
                receipt(b, 2, Receipt.STATUS_SUCCESS, 200_000, List.of()))));

        ContractCreation c = contracts.getContractCreation(ctx, FIRST);
        assertEquals(DEPLOYER, c.creator());
        assertEquals(ok.hash(), c.txHash());
        assertEquals(0L, c.blockNumber());
        assertEquals(0, c.txIndex());
        assertEquals(4, c.bytecodeSize());

        assertThrows(NotFoundException.class, () -> contracts.getContractCreation(ctx, REVERTED));
        assertThrows(NotFoundException.class, () -> contracts.getContractCreation(ctx, addr(2)));
    }

    @Test
    void creatorIndexPagesAcrossHeights() {
        indexDeployment(0, "deploy-0", FIRST);
        indexDeployment(1, "deploy-1", SECOND);

        List<ContractCreation> newest = contracts.getContractsByCreator(ctx, DEPLOYER, PageRequest.newestFirst(0, 1));
        assertEquals(List.of(SECOND), newest.stream().map(ContractCreation::address).toList());

        List<ContractCreation> all = contracts.getContractsByCreator(ctx, DEPLOYER, PageRequest.oldestFirst(0, 10));
        assertEquals(List.of(FIRST, SECOND), all.stream().map(ContractCreation::address).toList());
        assertTrue(contracts.getContractsByCreator(ctx, addr(9), PageRequest.oldestFirst(0, 10)).isEmpty());
    }

    @Test
    void latestVerificationWins() {
        contracts.setContractVerification(ctx, verification(FIRST, true, "Vault"));
        contracts.setContractVerification(ctx, verification(FIRST, true, "VaultV2"));

        assertEquals("VaultV2", contracts.getContractVerification(ctx, FIRST).contractName());
        assertTrue(contracts.isContractVerified(ctx, FIRST));

        contracts.setContractVerification(ctx, verification(FIRST, false, "VaultV2"));
        assertFalse(contracts.isContractVerified(ctx, FIRST));

        contracts.deleteContractVerification(ctx, FIRST);
        assertThrows(NotFoundException.class, () -> contracts.getContractVerification(ctx, FIRST));
    }

    @Test
    void listingSkipsUnverifiedEntries() {
        contracts.setContractVerification(ctx, verification(SECOND, true, "B"));
        contracts.setContractVerification(ctx, verification(REVERTED, false, "C"));
        contracts.setContractVerification(ctx, verification(FIRST, true, "A"));

        List<ContractVerification> listed = contracts.listVerifiedContracts(ctx, PageRequest.oldestFirst(0, 10));
        assertEquals(List.of(FIRST, SECOND), listed.stream().map(ContractVerification::address).toList());
        assertEquals(1, contracts.listVerifiedContracts(ctx, PageRequest.oldestFirst(1, 10)).size());
    }

    @Test
    void verificationSurvivesRollbackOfTheCreation() {
        indexDeployment(0, "deploy-0", FIRST);
        contracts.setContractVerification(ctx, verification(FIRST, true, "Vault"));

        assertTrue(indexer.rollback(ctx, 0));

        assertThrows(NotFoundException.class, () -> contracts.getContractCreation(ctx, FIRST));
        assertTrue(contracts.getContractsByCreator(ctx, DEPLOYER, PageRequest.oldestFirst(0, 10)).isEmpty());
        assertTrue(contracts.isContractVerified(ctx, FIRST));
    }

    @Test
    void negativeOptimizationRunsAreRejected() {
        assertThrows(InvalidInputException.class, () -> new ContractVerification(FIRST, true, "A", "v0.8.24",
                true, -1, "", "[]", "", "MIT", 0L));
    }

    private void indexDeployment(long height, String seed, Address contract) {
        Block b = block(height, List.of(deployTx(seed, 3)));
        indexer.index(ctx, new BlockBundle(b, List.of(creationReceipt(b, 0, Receipt.STATUS_SUCCESS, contract))));
    }

    private static Transaction deployTx(String seed, int codeSize) {
        return legacyTx(seed, DEPLOYER, null, 0).toBuilder().input(new byte[codeSize]).build();
    }

    private static Receipt creationReceipt(Block b, int txIndex, int status, Address contract) {
        return new Receipt(b.transactions().get(txIndex).hash(), status, 100_000L * (txIndex + 1), 0, null,
                contract, null, List.of(), b.number(), b.hash(), txIndex);
    }

    private static ContractVerification verification(Address contract, boolean verified, String name) {
        return new ContractVerification(contract, verified, name, "v0.8.24+commit.e11b9ed9", true, 200,
                "contract " + name + " {}", "[]", "", "MIT", 1_700_000_000L);
    }
}
