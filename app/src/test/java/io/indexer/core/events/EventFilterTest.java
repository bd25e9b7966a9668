package io.indexer.core.events;

import io.indexer.core.error.InvalidInputException;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Log;
import io.indexer.core.protocol.Transaction;
import io.indexer.core.protocol.TxLocation;
import io.indexer.core.protocol.TxType;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;

import static io.indexer.core.ChainFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class EventFilterTest {

    @Test
    void emptyFilterMatchesEverything() {
        EventFilter any = EventFilter.any();
        assertTrue(any.matches(new BlockEvent(emptyBlock(3))));
        assertTrue(any.matches(txEvent(legacyTx("a", addr(1), addr(2), 1), 3)));
        assertTrue(any.matches(new LogEvent(log(addr(9), List.of(), new byte[0], 3, hash("a"), 0, 0))));
    }

    @Test
    void addressesMatchEitherSideOfATransaction() {
        EventFilter f = EventFilter.builder().addresses(Set.of(addr(2))).build();
        assertTrue(f.matches(txEvent(legacyTx("a", addr(1), addr(2), 1), 0)));
        assertTrue(f.matches(txEvent(legacyTx("b", addr(2), addr(5), 1), 0)));
        assertFalse(f.matches(txEvent(legacyTx("c", addr(3), addr(4), 1), 0)));
    }

    @Test
    void recipientFilterNeverMatchesACreation() {
        Transaction creation = Transaction.builder()
                .hash(hash("deploy")).type(TxType.LEGACY).from(addr(1))
                .gasPrice(BigInteger.ONE).build();
        EventFilter f = EventFilter.builder().toAddresses(Set.of(addr(2))).build();
        assertFalse(f.matches(txEvent(creation, 0)));
        assertTrue(EventFilter.builder().fromAddresses(Set.of(addr(1))).build().matches(txEvent(creation, 0)));
    }

    @Test
    void valueBoundsAreInclusive() {
        EventFilter f = EventFilter.builder().valueRange(BigInteger.valueOf(10), BigInteger.valueOf(20)).build();
        assertTrue(f.matches(txEvent(legacyTx("a", addr(1), addr(2), 10), 0)));
        assertTrue(f.matches(txEvent(legacyTx("b", addr(1), addr(2), 20), 0)));
        assertFalse(f.matches(txEvent(legacyTx("c", addr(1), addr(2), 21), 0)));
        assertFalse(f.matches(txEvent(legacyTx("d", addr(1), addr(2), 9), 0)));
    }

    @Test
    void blockRangeAppliesToEveryEventType() {
        EventFilter f = EventFilter.builder().blockRange(5L, 6L).build();
        assertFalse(f.matches(new BlockEvent(emptyBlock(4))));
        assertTrue(f.matches(new BlockEvent(emptyBlock(5))));
        assertTrue(f.matches(txEvent(legacyTx("a", addr(1), addr(2), 1), 6)));
        assertFalse(f.matches(new LogEvent(log(addr(9), List.of(), new byte[0], 7, hash("a"), 0, 0))));
    }

    @Test
    void topicsArePositionalWithWildcards() {
        Hash t0 = hash("t0");
        Hash t1 = hash("t1");
        Log log = log(addr(9), List.of(t0, t1), new byte[0], 1, hash("a"), 0, 0);

        assertTrue(EventFilter.builder().topics(List.of(Set.of(), Set.of(t1))).build().matches(new LogEvent(log)));
        assertTrue(EventFilter.builder().topics(List.of(Set.of(t1, t0))).build().matches(new LogEvent(log)));
        assertFalse(EventFilter.builder().topics(List.of(Set.of(t1))).build().matches(new LogEvent(log)));
        assertFalse(EventFilter.builder().topics(List.of(Set.of(), Set.of(), Set.of(t0))).build().matches(new LogEvent(log)));
    }

    @Test
    void logAddressFilterUsesTheEmitter() {
        Log log = log(addr(9), List.of(), new byte[0], 1, hash("a"), 0, 0);
        assertTrue(EventFilter.builder().addresses(Set.of(addr(9))).build().matches(new LogEvent(log)));
        assertFalse(EventFilter.builder().addresses(Set.of(addr(1))).build().matches(new LogEvent(log)));
    }

    @Test
    void invalidBoundsFailValidation() {
        assertThrows(InvalidInputException.class, () -> EventFilter.builder()
                .valueRange(BigInteger.TEN, BigInteger.ONE).build().validate());
        assertThrows(InvalidInputException.class, () -> EventFilter.builder()
                .valueRange(BigInteger.valueOf(-1), null).build().validate());
        assertThrows(InvalidInputException.class, () -> EventFilter.builder()
                .blockRange(9L, 3L).build().validate());
        assertThrows(InvalidInputException.class, () -> EventFilter.builder()
                .blockRange(-1L, null).build().validate());
        assertDoesNotThrow(() -> EventFilter.builder().blockRange(3L, 3L).build().validate());
    }

    private static TransactionEvent txEvent(Transaction tx, long height) {
        return new TransactionEvent(tx, new TxLocation(height, blockHash(height), 0), null);
    }
}
