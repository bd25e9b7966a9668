package io.indexer.core.index;

import io.indexer.core.error.DecodeFailureException;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Block;
import io.indexer.core.protocol.Rlp;

import java.util.ArrayList;
import java.util.List;

/**
 * Extra data is a single RLP list:
 * {@code [vanity, randaoReveal, prevRound, prevPreparedSeal, prevCommittedSeal, round,
 * preparedSeal, committedSeal, gasTip, epochInfo]}. An absent seal or epoch is an empty list.
 */
public final class WbftExtraParser implements ConsensusExtraParser {
    private static final int FIELDS = 10;

    private final long epochLength;

    public WbftExtraParser(long epochLength) {
        if (epochLength <= 0) {
            throw new IllegalArgumentException("epoch length must be > 0");
        }
        this.epochLength = epochLength;
    }

    @Override
    public WbftBlockExtra parse(Block block) {
        byte[] extra = block.extraData();
        if (extra.length == 0) {
            throw new DecodeFailureException("block " + block.number() + " has empty extra data");
        }
        Rlp.Item root = Rlp.decode(extra);
        List<Rlp.Item> fields = root.list();
        if (fields.size() < FIELDS) {
            throw new DecodeFailureException("block " + block.number() + " extra has " + fields.size() + " fields");
        }
        return new WbftBlockExtra(
                block.number(),
                block.hash(),
                block.timestamp(),
                fields.get(1).bytes(),
                uint32(fields.get(2)),
                seal(fields.get(3)),
                seal(fields.get(4)),
                uint32(fields.get(5)),
                seal(fields.get(6)),
                seal(fields.get(7)),
                fields.get(8).isList() ? null : fields.get(8).asBigInteger(),
                epoch(fields.get(9), block.number()));
    }

    @Override
    public long epochOf(long height) {
        return height / epochLength;
    }

    @Override
    public long governingBoundary(long height) {
        if (height <= 0) {
            return -1;
        }
        return ((height - 1) / epochLength) * epochLength;
    }

    private static long uint32(Rlp.Item item) {
        long v = item.asLong();
        if (v < 0 || v > 0xffffffffL) {
            throw new DecodeFailureException("round exceeds uint32: " + v);
        }
        return v;
    }

    private static WbftSeal seal(Rlp.Item item) {
        if (item.isEmpty()) {
            return null;
        }
        return new WbftSeal(item.get(0).bytes(), item.get(1).bytes());
    }

    private EpochInfo epoch(Rlp.Item item, long height) {
        if (item.isEmpty()) {
            return null;
        }
        List<Candidate> candidates = new ArrayList<>();
        for (Rlp.Item c : item.get(0).list()) {
            byte[] addr = c.get(0).bytes();
            if (addr.length != Address.LENGTH) {
                throw new DecodeFailureException("invalid candidate address length: " + addr.length);
            }
            candidates.add(new Candidate(new Address(addr), c.get(1).asLong()));
        }
        List<Integer> validators = new ArrayList<>();
        for (Rlp.Item v : item.get(1).list()) {
            validators.add((int) uint32(v));
        }
        List<byte[]> keys = new ArrayList<>();
        for (Rlp.Item k : item.get(2).list()) {
            keys.add(k.bytes());
        }
        return new EpochInfo(epochOf(height), height, candidates, validators, keys);
    }
}
