package io.indexer.core.ingest;

import io.indexer.core.OperationContext;
import io.indexer.core.error.IndexerException;
import io.indexer.core.error.InvalidInputException;
import io.indexer.core.index.BlockBundle;
import io.indexer.core.index.BlockIndexer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Feeds bundles to a {@link BlockIndexer} on a worker pool: every height's primary phase first,
 * then the extended phase for the heights whose primary phase committed. A height that fails on the
 * pool is retried once on the calling thread before it is reported as failed.
 */
public final class BlockImporter {
    private static final Logger LOG = Logger.getLogger(BlockImporter.class.getName());

    public record Summary(int primaryIndexed, int fullyIndexed, List<Long> failedHeights) {
        public Summary {
            failedHeights = List.copyOf(failedHeights);
        }
    }

    private final BlockIndexer indexer;
    private final int workers;

    public BlockImporter(BlockIndexer indexer, int workers) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be > 0");
        }
        this.indexer = indexer;
        this.workers = workers;
    }

    public Summary run(OperationContext ctx, List<BlockBundle> bundles) throws InterruptedException {
        AtomicInteger seq = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "chain-indexer-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<BlockBundle> primary = phase(ctx, pool, bundles, "primary", indexer::indexPrimary);
            List<BlockBundle> full = phase(ctx, pool, primary, "extended", indexer::indexExtended);
            Set<Long> completed = new HashSet<>();
            for (BlockBundle b : full) {
                completed.add(b.height());
            }
            List<Long> failed = new ArrayList<>();
            for (BlockBundle b : bundles) {
                if (!completed.contains(b.height())) {
                    failed.add(b.height());
                }
            }
            return new Summary(primary.size(), full.size(), failed);
        } finally {
            pool.shutdownNow();
        }
    }

    /** Runs one phase and returns the bundles it committed. */
    private List<BlockBundle> phase(OperationContext ctx, ExecutorService pool, List<BlockBundle> bundles, String name,
                                    BiConsumer<OperationContext, BlockBundle> step) throws InterruptedException {
        List<Future<?>> futures = new ArrayList<>(bundles.size());
        for (BlockBundle b : bundles) {
            futures.add(pool.submit(() -> step.accept(ctx, b)));
        }
        List<BlockBundle> done = new ArrayList<>(bundles.size());
        for (int i = 0; i < bundles.size(); i++) {
            BlockBundle b = bundles.get(i);
            try {
                futures.get(i).get();
                done.add(b);
            } catch (ExecutionException e) {
                LOG.fine(() -> name + " phase of block " + b.height() + " failed on the pool, retrying: " + e.getCause());
                if (retry(ctx, b, name, step)) {
                    done.add(b);
                }
            }
        }
        return done;
    }

    private static boolean retry(OperationContext ctx, BlockBundle b, String name,
                                 BiConsumer<OperationContext, BlockBundle> step) {
        ctx.checkActive();
        try {
            step.accept(ctx, b);
            return true;
        } catch (InvalidInputException e) {
            LOG.log(Level.WARNING, "Block " + b.height() + " rejected in " + name + " phase", e);
            return false;
        } catch (IndexerException e) {
            LOG.log(Level.WARNING, "Block " + b.height() + " failed " + name + " phase twice", e);
            return false;
        }
    }
}
