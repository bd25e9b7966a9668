package io.indexer.core;

import io.indexer.core.config.IndexerConfig;
import io.indexer.core.events.EventBus;
import io.indexer.core.events.EventType;
import io.indexer.core.events.Subscription;
import io.indexer.core.index.BlockBundle;
import io.indexer.core.index.BlockIndexer;
import io.indexer.core.index.IndexCatalog;
import io.indexer.core.index.SystemEventDecoders;
import io.indexer.core.index.WbftExtraParser;
import io.indexer.core.ingest.BlockImporter;
import io.indexer.core.ingest.ChainDumpReader;
import io.indexer.core.metrics.IndexerMetrics;
import io.indexer.core.protocol.Block;
import io.indexer.core.protocol.Secp256k1SignerRecovery;
import io.indexer.core.query.BlockFilter;
import io.indexer.core.query.Connection;
import io.indexer.core.query.QueryEngine;
import io.indexer.core.query.TransactionFilter;
import io.indexer.core.query.TransactionNode;
import io.indexer.core.storage.InMemoryKeyValueDB;
import io.indexer.core.storage.KeyValueDB;
import io.indexer.core.storage.KvChainStore;
import io.indexer.core.storage.RocksKeyValueDB;
import io.indexer.core.storage.StoreOptions;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class Main {
    private static final Logger LOG;

    static {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Failed to load logging.properties: " + e.getMessage());
        }
        LOG = Logger.getLogger(Main.class.getName());
    }

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        IndexerConfig config = IndexerConfig.defaults()
                .withStore(StoreOptions.defaults().withReadOnly(options.readOnly()))
                .withMaxBlockSpan(options.maxBlockSpan())
                .withBusCapacity(options.busCapacity())
                .withEpochLength(options.epochLength())
                .withIndexWorkers(options.workers());

        KeyValueDB db;
        if (options.inMemory()) {
            db = new InMemoryKeyValueDB(options.readOnly());
            LOG.info("Using in-memory store");
        } else {
            Path dataPath = options.dataDir().toAbsolutePath().normalize();
            if (options.reset()) {
                resetData(dataPath);
            }
            Files.createDirectories(dataPath);
            db = RocksKeyValueDB.open(dataPath, config.store);
            LOG.info("Using RocksDB store at " + dataPath);
        }

        KvChainStore store = new KvChainStore(db);
        EventBus bus = new EventBus(config.busCapacity, config.replayHistorySize);
        try {
            IndexCatalog catalog = IndexCatalog.standard(store, new Secp256k1SignerRecovery(),
                    SystemEventDecoders.initialize(), new WbftExtraParser(config.epochLength));
            BlockIndexer indexer = new BlockIndexer(store, catalog, bus);
            QueryEngine query = new QueryEngine(store, catalog, config.maxBlockSpan,
                    config.defaultPageSize, config.maxPageSize);
            bus.start();
            Subscription blocks = bus.subscribe("cli-blocks", Set.of(EventType.BLOCK), null, config.subscriberQueueSize);

            if (options.importFile() != null) {
                runImport(indexer, options.importFile(), config.indexWorkers);
            }
            report(store, query, bus, blocks);

            if (options.keepAlive()) {
                CountDownLatch shutdownLatch = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "chain-indexer-shutdown"));
                LOG.info("Indexer running. Press CTRL+C to exit.");
                shutdownLatch.await();
            }
        } finally {
            bus.stop();
            store.close();
        }
    }

    private static void runImport(BlockIndexer indexer, Path file, int workers) throws IOException, InterruptedException {
        List<BlockBundle> bundles = new ChainDumpReader().read(file);
        BlockImporter.Summary summary = new BlockImporter(indexer, workers).run(OperationContext.background(), bundles);
        LOG.info("Imported " + summary.primaryIndexed() + " block(s), " + summary.fullyIndexed() + " fully indexed");
        if (!summary.failedHeights().isEmpty()) {
            LOG.warning("Heights still missing secondary indexes: " + summary.failedHeights());
        }
    }

    private static void report(KvChainStore store, QueryEngine query, EventBus bus, Subscription blocks)
            throws InterruptedException {
        OperationContext ctx = OperationContext.background();
        Connection<Block> recent = query.blocks(ctx, BlockFilter.NONE, query.pagination(0, null));
        if (recent.nodes().isEmpty()) {
            LOG.info("No indexed blocks");
        } else {
            Connection<TransactionNode> txs = query.transactions(ctx, TransactionFilter.NONE, query.pagination(0, null));
            LOG.info("Latest height=" + recent.nodes().get(0).number()
                    + " fully indexed=" + store.getFullyIndexedHeight(ctx)
                    + " blocks=" + recent.totalCount()
                    + " transactions=" + txs.totalCount());
            LOG.info("Newest blocks: " + recent.nodes().stream()
                    .map(b -> Long.toString(b.number()))
                    .collect(Collectors.joining(", "))
                    + (recent.pageInfo().hasNextPage() ? ", ..." : ""));
        }
        bus.awaitDispatched(Duration.ofSeconds(5));
        LOG.info("Event bus " + bus.stats() + ", cli subscriber " + blocks.info());
        LOG.info("=== Metrics ===\n" + IndexerMetrics.scrapeMetrics());
    }

    private static void resetData(Path dataPath) {
        if (!Files.exists(dataPath)) {
            return;
        }
        try (Stream<Path> stream = Files.walk(dataPath)) {
            stream.sorted(Comparator.reverseOrder())
                    .filter(path -> !path.equals(dataPath))
                    .forEach(path -> {
                        try {
                            Files.deleteIfExists(path);
                        } catch (IOException e) {
                            throw new IllegalStateException("Failed to delete " + path, e);
                        }
                    });
        } catch (IOException e) {
            throw new IllegalStateException("Failed to reset index data in " + dataPath, e);
        }
        LOG.info("Cleared index data under " + dataPath);
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            boolean inMemory,
            boolean readOnly,
            boolean reset,
            Path importFile,
            int workers,
            int maxBlockSpan,
            int busCapacity,
            int epochLength,
            boolean keepAlive
    ) {
        static CliOptions parse(String[] args) {
            IndexerConfig defaults = IndexerConfig.defaults();
            Path dataDir = envPath("INDEXER_DATA_DIR", Path.of("./data/index"));
            boolean inMemory = "true".equalsIgnoreCase(System.getenv("INDEXER_IN_MEMORY"));
            boolean readOnly = "true".equalsIgnoreCase(System.getenv("INDEXER_READ_ONLY"));
            boolean reset = false;
            Path importFile = envPath("INDEXER_IMPORT", null);
            boolean keepAlive = "true".equalsIgnoreCase(System.getenv("INDEXER_KEEP_ALIVE"));
            boolean showHelp = false;
            String error = null;

            int workers = defaults.indexWorkers;
            int maxBlockSpan = defaults.maxBlockSpan;
            int busCapacity = defaults.busCapacity;
            int epochLength = (int) defaults.epochLength;
            try {
                workers = envPositiveInt("INDEXER_WORKERS", workers);
                maxBlockSpan = envPositiveInt("INDEXER_MAX_BLOCK_SPAN", maxBlockSpan);
                busCapacity = envPositiveInt("INDEXER_BUS_CAPACITY", busCapacity);
                epochLength = envPositiveInt("INDEXER_EPOCH_LENGTH", epochLength);
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.equals("--in-memory")) {
                        inMemory = true;
                    } else if (arg.equals("--read-only")) {
                        readOnly = true;
                    } else if (arg.equals("--reset")) {
                        reset = true;
                    } else if (arg.startsWith("--import=")) {
                        importFile = Path.of(arg.substring("--import=".length()));
                    } else if (arg.equals("--keep-alive")) {
                        keepAlive = true;
                    } else if (arg.startsWith("--workers=")) {
                        try {
                            workers = parsePositiveInt(arg.substring("--workers=".length()), "--workers");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--max-block-span=")) {
                        try {
                            maxBlockSpan = parsePositiveInt(arg.substring("--max-block-span=".length()), "--max-block-span");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--bus-capacity=")) {
                        try {
                            busCapacity = parsePositiveInt(arg.substring("--bus-capacity=".length()), "--bus-capacity");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--epoch-length=")) {
                        try {
                            epochLength = parsePositiveInt(arg.substring("--epoch-length=".length()), "--epoch-length");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (!arg.startsWith("--")) {
                        dataDir = Path.of(arg);
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (readOnly && importFile != null && error == null) {
                showHelp = true;
                error = "--import cannot be combined with --read-only";
            }

            return new CliOptions(
                    showHelp,
                    error,
                    dataDir,
                    inMemory,
                    readOnly,
                    reset,
                    importFile,
                    workers,
                    maxBlockSpan,
                    busCapacity,
                    epochLength,
                    keepAlive
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: chain-indexer [options]

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Path for index data (default ./data/index)
  --in-memory                Keep everything in memory; nothing is persisted
  --read-only                Open the store read-only (no imports)
  --reset                    Delete existing index data before starting
  --import=<file>            Index a JSON chain dump (blocks with full transactions and receipts)
  --workers=<n>              Worker threads used to index heights in parallel
  --max-block-span=<n>       Largest block range a transaction or log query scans (default 1000)
  --bus-capacity=<n>         Event bus ingress queue size (default 1000)
  --epoch-length=<n>         Blocks per WBFT epoch used to locate epoch boundaries (default 10)
  --keep-alive               Keep running until interrupted

Environment overrides:
  INDEXER_DATA_DIR           Override --data-dir
  INDEXER_IN_MEMORY          Set to "true" to use the in-memory store
  INDEXER_READ_ONLY          Set to "true" to open the store read-only
  INDEXER_IMPORT             Chain dump to import
  INDEXER_WORKERS            Override --workers
  INDEXER_MAX_BLOCK_SPAN     Override --max-block-span
  INDEXER_BUS_CAPACITY       Override --bus-capacity
  INDEXER_EPOCH_LENGTH       Override --epoch-length
  INDEXER_KEEP_ALIVE         Set to "true" to force keep-alive mode
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static int envPositiveInt(String key, int fallback) {
            String value = System.getenv(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parsePositiveInt(value, key);
        }

        private static int parsePositiveInt(String value, String flag) {
            try {
                int parsed = Integer.parseInt(value);
                if (parsed <= 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
