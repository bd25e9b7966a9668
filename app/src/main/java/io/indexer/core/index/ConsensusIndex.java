package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.error.DecodeFailureException;
import io.indexer.core.error.InvalidInputException;
import io.indexer.core.error.NotFoundException;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Block;
import io.indexer.core.protocol.Hash;
import io.indexer.core.storage.Column;
import io.indexer.core.storage.KeyValueDB;
import io.indexer.core.storage.Keys;
import io.indexer.core.storage.KvChainStore;
import io.indexer.core.storage.StoredBlock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * WBFT consensus records.
 *
 * <pre>
 * wb/{height}                  block extra
 * wbh/{blockHash}              pointer to wb/{height}
 * ep/{epoch}                   epoch info announced by a boundary block
 * va/{validator}/{height}      signing activity
 * vb/{height}/{validator}      pointer to the activity, for per-block reads
 * </pre>
 *
 * Signers of a block are resolved against the epoch info announced by the boundary block below it,
 * read from the stored header. Without one, the latest indexed epoch below the block is used, then
 * the block's own epoch info.
 */
public final class ConsensusIndex implements IndexFamily, ConsensusIndexReader {
    private static final Logger LOG = Logger.getLogger(ConsensusIndex.class.getName());

    private final KvChainStore store;
    private final KeyValueDB db;
    private final ConsensusExtraParser parser;

    public ConsensusIndex(KvChainStore store, ConsensusExtraParser parser) {
        this.store = store;
        this.db = store.db();
        this.parser = parser;
    }

    @Override
    public String name() {
        return "consensus";
    }

    @Override
    public boolean mandatory() {
        return false;
    }

    @Override
    public void stage(IndexBatch batch, BlockBundle bundle) {
        Block block = bundle.block();
        if (block.extraData().length == 0) {
            return;
        }
        WbftBlockExtra extra;
        try {
            extra = parser.parse(block);
        } catch (DecodeFailureException e) {
            batch.decodeFailure("consensus extra of block " + block.number() + ": " + e.getMessage());
            return;
        }
        long height = block.number();
        byte[] key = extraKey(height);
        batch.put(key, IndexJson.write(extra));
        batch.put(Keys.key("wbh", block.hash().hex()), key);
        if (extra.epochInfo() != null) {
            batch.put(epochKey(extra.epochInfo().epochNumber()), IndexJson.write(extra.epochInfo()));
        }
        EpochInfo governing = governingEpoch(batch.ctx(), height, extra);
        if (governing == null) {
            return;
        }
        for (int i = 0; i < governing.validators().size(); i++) {
            Address validator;
            try {
                validator = governing.validatorAddress(i);
            } catch (DecodeFailureException e) {
                batch.decodeFailure(e.getMessage());
                continue;
            }
            ValidatorSigningActivity activity = new ValidatorSigningActivity(height, block.hash(), validator, i,
                    extra.preparedSeal() != null && extra.preparedSeal().signed(i),
                    extra.committedSeal() != null && extra.committedSeal().signed(i),
                    extra.round(), block.timestamp());
            byte[] activityKey = activityKey(validator, height);
            batch.put(activityKey, IndexJson.write(activity));
            batch.put(Keys.key("vb", Keys.num(height), Keys.addr(validator)), activityKey);
        }
    }

    @Override
    public void unstage(IndexBatch batch, StoredBlock stored) {
        long height = stored.block().number();
        byte[] raw = db.get(Column.INDEX, extraKey(height));
        if (raw == null) {
            return;
        }
        WbftBlockExtra extra = IndexJson.read(raw, WbftBlockExtra.class);
        batch.delete(extraKey(height));
        batch.delete(Keys.key("wbh", extra.blockHash().hex()));
        if (extra.epochInfo() != null) {
            batch.delete(epochKey(extra.epochInfo().epochNumber()));
        }
        db.scanPrefix(Column.INDEX, Keys.key("vb", Keys.num(height), ""), false, e -> {
            batch.delete(e.value());
            batch.delete(e.key());
            return true;
        });
    }

    @Override
    public WbftBlockExtra getWbftBlockExtra(OperationContext ctx, long height) {
        ctx.checkActive();
        checkHeight(height);
        byte[] raw = db.get(Column.INDEX, extraKey(height));
        if (raw == null) {
            throw new NotFoundException("no consensus data for block " + height);
        }
        return IndexJson.read(raw, WbftBlockExtra.class);
    }

    @Override
    public WbftBlockExtra getWbftBlockExtraByHash(OperationContext ctx, Hash blockHash) {
        ctx.checkActive();
        byte[] pointer = db.get(Column.INDEX, Keys.key("wbh", blockHash.hex()));
        byte[] raw = pointer == null ? null : db.get(Column.INDEX, pointer);
        if (raw == null) {
            throw new NotFoundException("no consensus data for block " + blockHash);
        }
        return IndexJson.read(raw, WbftBlockExtra.class);
    }

    @Override
    public EpochInfo getEpochInfo(OperationContext ctx, long epochNumber) {
        ctx.checkActive();
        checkHeight(epochNumber);
        byte[] raw = db.get(Column.INDEX, epochKey(epochNumber));
        if (raw == null) {
            throw new NotFoundException("epoch " + epochNumber + " not found");
        }
        return IndexJson.read(raw, EpochInfo.class);
    }

    @Override
    public EpochInfo getLatestEpochInfo(OperationContext ctx) {
        ctx.checkActive();
        EpochInfo[] latest = new EpochInfo[1];
        db.scanPrefix(Column.INDEX, Keys.key("ep", ""), true, e -> {
            latest[0] = IndexJson.read(e.value(), EpochInfo.class);
            return false;
        });
        if (latest[0] == null) {
            throw new NotFoundException("no epoch info indexed");
        }
        return latest[0];
    }

    @Override
    public ValidatorSigningStats getValidatorSigningStats(OperationContext ctx, Address validator, long fromBlock, long toBlock) {
        checkRange(fromBlock, toBlock);
        Tally tally = new Tally(validator);
        db.scan(Column.INDEX, activityKey(validator, fromBlock), activityUpperBound(validator, toBlock), false, e -> {
            ctx.checkActive();
            tally.add(IndexJson.read(e.value(), ValidatorSigningActivity.class));
            return true;
        });
        return tally.stats(fromBlock, toBlock);
    }

    @Override
    public List<ValidatorSigningStats> getAllValidatorsSigningStats(OperationContext ctx, long fromBlock, long toBlock, PageRequest page) {
        checkRange(fromBlock, toBlock);
        Map<Address, Tally> tallies = new TreeMap<>();
        byte[] to = toBlock == Long.MAX_VALUE ? Keys.prefixEnd(Keys.key("vb", "")) : Keys.key("vb", Keys.num(toBlock + 1));
        db.scan(Column.INDEX, Keys.key("vb", Keys.num(fromBlock)), to, false, e -> {
            ctx.checkActive();
            ValidatorSigningActivity a = IndexScan.follow(db, e, ValidatorSigningActivity.class);
            if (a != null) {
                tallies.computeIfAbsent(a.validator(), Tally::new).add(a);
            }
            return true;
        });
        List<ValidatorSigningStats> all = new ArrayList<>(tallies.size());
        for (Tally t : tallies.values()) {
            all.add(t.stats(fromBlock, toBlock));
        }
        if (page.newestFirst()) {
            Collections.reverse(all);
        }
        int from = Math.min(page.offset(), all.size());
        return List.copyOf(all.subList(from, Math.min(from + page.limit(), all.size())));
    }

    @Override
    public List<ValidatorSigningActivity> getValidatorSigningActivity(OperationContext ctx, Address validator,
                                                                      long fromBlock, long toBlock, PageRequest page) {
        checkRange(fromBlock, toBlock);
        return IndexScan.page(db, ctx, activityKey(validator, fromBlock), activityUpperBound(validator, toBlock), page,
                e -> IndexJson.read(e.value(), ValidatorSigningActivity.class));
    }

    @Override
    public BlockSigners getBlockSigners(OperationContext ctx, long height) {
        getWbftBlockExtra(ctx, height);
        List<ValidatorSigningActivity> activity = new ArrayList<>();
        db.scanPrefix(Column.INDEX, Keys.key("vb", Keys.num(height), ""), false, e -> {
            ValidatorSigningActivity a = IndexScan.follow(db, e, ValidatorSigningActivity.class);
            if (a != null) {
                activity.add(a);
            }
            return true;
        });
        activity.sort((a, b) -> Integer.compare(a.validatorIndex(), b.validatorIndex()));
        List<Address> preparers = new ArrayList<>();
        List<Address> committers = new ArrayList<>();
        for (ValidatorSigningActivity a : activity) {
            if (a.signedPrepare()) preparers.add(a.validator());
            if (a.signedCommit()) committers.add(a.validator());
        }
        return new BlockSigners(preparers, committers);
    }

    private EpochInfo governingEpoch(OperationContext ctx, long height, WbftBlockExtra own) {
        long boundary = parser.governingBoundary(height);
        if (boundary < 0) {
            return own.epochInfo();
        }
        // the boundary header is primary data, so this does not depend on index order
        Optional<Block> boundaryBlock = store.getBlockHeader(ctx, boundary);
        if (boundaryBlock.isPresent() && boundaryBlock.get().extraData().length > 0) {
            try {
                EpochInfo info = parser.parse(boundaryBlock.get()).epochInfo();
                if (info != null) {
                    return info;
                }
            } catch (DecodeFailureException e) {
                LOG.fine(() -> "Boundary block " + boundary + " has no readable consensus data: " + e.getMessage());
            }
        }
        EpochInfo[] found = new EpochInfo[1];
        db.scan(Column.INDEX, Keys.key("ep", ""), epochKey(parser.epochOf(boundary) + 1), true, e -> {
            EpochInfo info = IndexJson.read(e.value(), EpochInfo.class);
            if (info.blockNumber() < height) {
                found[0] = info;
                return false;
            }
            return true;
        });
        return found[0] != null ? found[0] : own.epochInfo();
    }

    private static byte[] extraKey(long height) {
        return Keys.key("wb", Keys.num(height));
    }

    private static byte[] epochKey(long epoch) {
        return Keys.key("ep", Keys.num(epoch));
    }

    private static byte[] activityKey(Address validator, long height) {
        return Keys.key("va", Keys.addr(validator), Keys.num(height));
    }

    private static byte[] activityUpperBound(Address validator, long toBlock) {
        return toBlock == Long.MAX_VALUE
                ? Keys.prefixEnd(Keys.key("va", Keys.addr(validator), ""))
                : activityKey(validator, toBlock + 1);
    }

    private static void checkHeight(long height) {
        if (height < 0) {
            throw new InvalidInputException("height must be >= 0: " + height);
        }
    }

    private static void checkRange(long from, long to) {
        checkHeight(from);
        if (to < from) {
            throw new InvalidInputException("invalid range [" + from + ", " + to + "]");
        }
    }

    private static final class Tally {
        final Address validator;
        int validatorIndex = -1;
        long prepareSigned, prepareMissed, commitSigned, commitMissed;

        Tally(Address validator) {
            this.validator = validator;
        }

        void add(ValidatorSigningActivity a) {
            validatorIndex = a.validatorIndex();
            if (a.signedPrepare()) prepareSigned++; else prepareMissed++;
            if (a.signedCommit()) commitSigned++; else commitMissed++;
        }

        ValidatorSigningStats stats(long from, long to) {
            long total = prepareSigned + prepareMissed;
            long rate = total == 0 ? 0 : prepareSigned * 10_000 / total;
            return new ValidatorSigningStats(validator, validatorIndex, prepareSigned, prepareMissed,
                    commitSigned, commitMissed, from, to, rate);
        }
    }
}
