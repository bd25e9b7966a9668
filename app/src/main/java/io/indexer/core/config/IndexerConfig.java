package io.indexer.core.config;

import io.indexer.core.query.Pagination;
import io.indexer.core.query.QueryEngine;
import io.indexer.core.storage.StoreOptions;

/** Settings shared by the store, the index maintainer, the query engine and the event bus. */
public final class IndexerConfig {
    public final StoreOptions store;
    public final int defaultPageSize;
    public final int maxPageSize;
    public final int maxBlockSpan;
    public final int busCapacity;
    public final int subscriberQueueSize;
    public final int replayHistorySize;
    public final long epochLength;
    public final int indexWorkers;

    public IndexerConfig(StoreOptions store, int defaultPageSize, int maxPageSize, int maxBlockSpan,
                         int busCapacity, int subscriberQueueSize, int replayHistorySize,
                         long epochLength, int indexWorkers) {
        if (defaultPageSize <= 0 || maxPageSize < defaultPageSize) {
            throw new IllegalArgumentException("page sizes must satisfy 0 < default <= max");
        }
        if (maxBlockSpan <= 0 || busCapacity <= 0 || subscriberQueueSize <= 0 || replayHistorySize < 0) {
            throw new IllegalArgumentException("span, capacities and history must be positive");
        }
        if (epochLength <= 0 || indexWorkers <= 0) {
            throw new IllegalArgumentException("epoch length and worker count must be positive");
        }
        this.store = store;
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
        this.maxBlockSpan = maxBlockSpan;
        this.busCapacity = busCapacity;
        this.subscriberQueueSize = subscriberQueueSize;
        this.replayHistorySize = replayHistorySize;
        this.epochLength = epochLength;
        this.indexWorkers = indexWorkers;
    }

    public static IndexerConfig defaults() {
        return new IndexerConfig(
                StoreOptions.defaults(),
                Pagination.DEFAULT_LIMIT,
                Pagination.DEFAULT_MAX_LIMIT,
                QueryEngine.DEFAULT_MAX_BLOCK_SPAN,
                1000,   // bus ingress queue
                100,    // per-subscriber queue
                100,    // replay history
                10L,    // WBFT epoch length
                Math.max(1, Runtime.getRuntime().availableProcessors())
        );
    }

    public IndexerConfig withStore(StoreOptions store) {
        return new IndexerConfig(store, defaultPageSize, maxPageSize, maxBlockSpan, busCapacity,
                subscriberQueueSize, replayHistorySize, epochLength, indexWorkers);
    }

    public IndexerConfig withMaxBlockSpan(int maxBlockSpan) {
        return new IndexerConfig(store, defaultPageSize, maxPageSize, maxBlockSpan, busCapacity,
                subscriberQueueSize, replayHistorySize, epochLength, indexWorkers);
    }

    public IndexerConfig withBusCapacity(int busCapacity) {
        return new IndexerConfig(store, defaultPageSize, maxPageSize, maxBlockSpan, busCapacity,
                subscriberQueueSize, replayHistorySize, epochLength, indexWorkers);
    }

    public IndexerConfig withEpochLength(long epochLength) {
        return new IndexerConfig(store, defaultPageSize, maxPageSize, maxBlockSpan, busCapacity,
                subscriberQueueSize, replayHistorySize, epochLength, indexWorkers);
    }

    public IndexerConfig withIndexWorkers(int indexWorkers) {
        return new IndexerConfig(store, defaultPageSize, maxPageSize, maxBlockSpan, busCapacity,
                subscriberQueueSize, replayHistorySize, epochLength, indexWorkers);
    }
}
