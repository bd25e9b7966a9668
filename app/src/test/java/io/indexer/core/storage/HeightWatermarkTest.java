package io.indexer.core.storage;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class HeightWatermarkTest {
    private static final byte[] KEY = Keys.key("test", "watermark");

    @Test
    void advancesOnlyOverContiguousHeights() {
        HeightWatermark w = new HeightWatermark(new InMemoryKeyValueDB(), KEY, h -> false);
        assertEquals(HeightWatermark.EMPTY, w.get());

        assertEquals(0L, w.complete(0));
        assertEquals(0L, w.complete(2));
        assertEquals(0L, w.complete(3));
        assertEquals(3L, w.complete(1));
    }

    @Test
    void persistsAndResumesFromTheStoredValue() {
        InMemoryKeyValueDB db = new InMemoryKeyValueDB();
        HeightWatermark first = new HeightWatermark(db, KEY, h -> false);
        first.complete(0);
        first.complete(1);

        HeightWatermark reopened = new HeightWatermark(db, KEY, h -> false);
        assertEquals(1L, reopened.get());
    }

    @Test
    void rollbackDropsTheWatermarkBelowTheRemovedHeight() {
        Set<Long> done = new HashSet<>();
        HeightWatermark w = new HeightWatermark(new InMemoryKeyValueDB(), KEY, done::contains);
        for (long h = 0; h <= 4; h++) {
            done.add(h);
            w.complete(h);
        }
        assertEquals(4L, w.get());

        done.remove(2L);
        w.rollbackBelow(2);
        assertEquals(1L, w.get());

        // re-completing the gap picks up the heights above it that are still present
        done.add(2L);
        assertEquals(4L, w.complete(2));
    }

    @Test
    void reopeningProbesForwardOverCompletedHeights() {
        InMemoryKeyValueDB db = new InMemoryKeyValueDB();
        Set<Long> done = Set.of(0L, 1L, 2L);
        HeightWatermark w = new HeightWatermark(db, KEY, done::contains);
        assertEquals(2L, w.get());
    }
}
