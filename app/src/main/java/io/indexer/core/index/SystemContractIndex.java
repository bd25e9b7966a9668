package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.error.DecodeFailureException;
import io.indexer.core.error.InvalidInputException;
import io.indexer.core.error.NotFoundException;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Log;
import io.indexer.core.protocol.Receipt;
import io.indexer.core.storage.Column;
import io.indexer.core.storage.KeyValueDB;
import io.indexer.core.storage.Keys;
import io.indexer.core.storage.StoredBlock;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * System contract events.
 *
 * <pre>
 * se/{kind}/{height}/{logIndex}                          record
 * sea/{account}/{kind}/{height}/{logIndex}               by account
 * sep/{contract}/{proposalId}/{height}/{logIndex}        by proposal
 * seh/{height}/{logIndex}                                by height, for rollback
 * </pre>
 *
 * Blacklist membership and proposal status are folded from the events on read.
 */
public final class SystemContractIndex implements IndexFamily, SystemContractReader {
    private static final Set<SystemEventKind> PROPOSAL_KINDS = EnumSet.of(
            SystemEventKind.PROPOSAL_CREATED, SystemEventKind.PROPOSAL_VOTED, SystemEventKind.PROPOSAL_EXECUTED);

    private final KeyValueDB db;
    private final SystemEventDecoders decoders;

    public SystemContractIndex(KeyValueDB db, SystemEventDecoders decoders) {
        this.db = db;
        this.decoders = decoders;
    }

    @Override
    public String name() {
        return "system";
    }

    @Override
    public boolean mandatory() {
        return false;
    }

    @Override
    public void stage(IndexBatch batch, BlockBundle bundle) {
        for (Receipt r : bundle.receipts()) {
            if (!r.succeeded()) {
                continue;
            }
            for (Log log : r.logs()) {
                Optional<SystemContractEvent> decoded;
                try {
                    decoded = decoders.decode(log);
                } catch (DecodeFailureException | IllegalArgumentException e) {
                    batch.decodeFailure(e.getMessage());
                    continue;
                }
                decoded.ifPresent(event -> {
                    byte[] key = recordKey(event);
                    batch.put(key, IndexJson.write(event));
                    for (byte[] pointer : pointerKeys(event)) {
                        batch.put(pointer, key);
                    }
                });
            }
        }
    }

    @Override
    public void unstage(IndexBatch batch, StoredBlock stored) {
        db.scanPrefix(Column.INDEX, Keys.key("seh", Keys.num(stored.block().number()), ""), false, e -> {
            SystemContractEvent event = IndexScan.follow(db, e, SystemContractEvent.class);
            if (event != null) {
                batch.delete(recordKey(event));
                for (byte[] pointer : pointerKeys(event)) {
                    batch.delete(pointer);
                }
            }
            batch.delete(e.key());
            return true;
        });
    }

    @Override
    public List<SystemContractEvent> getSystemEvents(OperationContext ctx, SystemEventKind kind, long fromBlock, long toBlock, PageRequest page) {
        if (fromBlock < 0 || toBlock < fromBlock) {
            throw new InvalidInputException("invalid range [" + fromBlock + ", " + toBlock + "]");
        }
        byte[] from = Keys.key("se", kind.name(), Keys.num(fromBlock));
        byte[] to = toBlock == Long.MAX_VALUE
                ? Keys.prefixEnd(Keys.key("se", kind.name(), ""))
                : Keys.key("se", kind.name(), Keys.num(toBlock + 1));
        return IndexScan.page(db, ctx, from, to, page, e -> IndexJson.read(e.value(), SystemContractEvent.class));
    }

    @Override
    public List<SystemContractEvent> getSystemEventsByAccount(OperationContext ctx, Address account,
                                                              Set<SystemEventKind> kinds, PageRequest page) {
        List<SystemContractEvent> all = new ArrayList<>();
        for (SystemEventKind kind : kinds) {
            all.addAll(IndexScan.all(db, ctx, Keys.key("sea", Keys.addr(account), kind.name(), ""),
                    Keys.prefixEnd(Keys.key("sea", Keys.addr(account), kind.name(), "")), false,
                    e -> IndexScan.follow(db, e, SystemContractEvent.class)));
        }
        all.sort((a, b) -> {
            int c = Long.compare(a.blockNumber(), b.blockNumber());
            return c != 0 ? c : Integer.compare(a.logIndex(), b.logIndex());
        });
        return slice(all, page);
    }

    @Override
    public List<Address> getBlacklistedAddresses(OperationContext ctx) {
        TreeMap<Address, Boolean> state = new TreeMap<>();
        List<SystemContractEvent> events = new ArrayList<>();
        for (SystemEventKind kind : EnumSet.of(SystemEventKind.ADDRESS_BLACKLISTED, SystemEventKind.ADDRESS_UNBLACKLISTED)) {
            events.addAll(IndexScan.all(db, ctx, Keys.key("se", kind.name(), ""),
                    Keys.prefixEnd(Keys.key("se", kind.name(), "")), false,
                    e -> IndexJson.read(e.value(), SystemContractEvent.class)));
        }
        events.sort((a, b) -> {
            int c = Long.compare(a.blockNumber(), b.blockNumber());
            return c != 0 ? c : Integer.compare(a.logIndex(), b.logIndex());
        });
        for (SystemContractEvent e : events) {
            state.put(e.account(), e.kind() == SystemEventKind.ADDRESS_BLACKLISTED);
        }
        List<Address> out = new ArrayList<>();
        state.forEach((a, listed) -> {
            if (listed) {
                out.add(a);
            }
        });
        return out;
    }

    @Override
    public List<Proposal> getProposals(OperationContext ctx, Address contract, PageRequest page) {
        Map<BigInteger, List<SystemContractEvent>> byProposal = new TreeMap<>();
        db.scanPrefix(Column.INDEX, Keys.key("sep", Keys.addr(contract), ""), false, e -> {
            ctx.checkActive();
            SystemContractEvent event = IndexScan.follow(db, e, SystemContractEvent.class);
            if (event != null) {
                byProposal.computeIfAbsent(event.proposalId(), id -> new ArrayList<>()).add(event);
            }
            return true;
        });
        List<Proposal> out = new ArrayList<>();
        for (List<SystemContractEvent> events : byProposal.values()) {
            fold(events).ifPresent(out::add);
        }
        return slice(out, page);
    }

    @Override
    public Proposal getProposal(OperationContext ctx, Address contract, BigInteger proposalId) {
        return fold(proposalEvents(ctx, contract, proposalId))
                .orElseThrow(() -> new NotFoundException("proposal " + proposalId + " not found on " + contract));
    }

    @Override
    public List<SystemContractEvent> getProposalVotes(OperationContext ctx, Address contract, BigInteger proposalId) {
        List<SystemContractEvent> votes = new ArrayList<>();
        for (SystemContractEvent e : proposalEvents(ctx, contract, proposalId)) {
            if (e.kind() == SystemEventKind.PROPOSAL_VOTED) {
                votes.add(e);
            }
        }
        return votes;
    }

    private List<SystemContractEvent> proposalEvents(OperationContext ctx, Address contract, BigInteger proposalId) {
        byte[] prefix = Keys.key("sep", Keys.addr(contract), proposalWord(proposalId), "");
        return IndexScan.all(db, ctx, prefix, Keys.prefixEnd(prefix), false,
                e -> IndexScan.follow(db, e, SystemContractEvent.class));
    }

    /** Events must be in chain order. Empty when the creation event is missing. */
    static Optional<Proposal> fold(List<SystemContractEvent> events) {
        SystemContractEvent created = null;
        long approved = 0;
        long rejected = 0;
        Proposal.Status status = Proposal.Status.VOTING;
        Long executedAt = null;
        for (SystemContractEvent e : events) {
            switch (e.kind()) {
                case PROPOSAL_CREATED:
                    created = e;
                    break;
                case PROPOSAL_VOTED:
                    approved = parseLong(e.detail("approved"));
                    rejected = parseLong(e.detail("rejected"));
                    break;
                case PROPOSAL_EXECUTED:
                    status = Boolean.parseBoolean(e.detail("success")) ? Proposal.Status.EXECUTED : Proposal.Status.FAILED;
                    executedAt = e.blockNumber();
                    break;
                default:
                    break;
            }
        }
        if (created == null) {
            return Optional.empty();
        }
        return Optional.of(new Proposal(created.contract(), created.proposalId(), created.account(),
                created.blockNumber(), created.txHash(), created.detail("actionType"),
                parseLong(created.detail("requiredApprovals")), approved, rejected, status, executedAt));
    }

    private static long parseLong(String v) {
        return v == null ? 0 : new BigInteger(v).longValue();
    }

    private static <T> List<T> slice(List<T> all, PageRequest page) {
        List<T> ordered = new ArrayList<>(all);
        if (page.newestFirst()) {
            Collections.reverse(ordered);
        }
        int from = Math.min(page.offset(), ordered.size());
        return List.copyOf(ordered.subList(from, Math.min(from + page.limit(), ordered.size())));
    }

    private static byte[] recordKey(SystemContractEvent e) {
        return Keys.key("se", e.kind().name(), Keys.num(e.blockNumber()), Keys.idx(e.logIndex()));
    }

    private static List<byte[]> pointerKeys(SystemContractEvent e) {
        String h = Keys.num(e.blockNumber());
        String li = Keys.idx(e.logIndex());
        List<byte[]> keys = new ArrayList<>(3);
        keys.add(Keys.key("seh", h, li));
        if (e.account() != null) {
            keys.add(Keys.key("sea", Keys.addr(e.account()), e.kind().name(), h, li));
        }
        if (e.proposalId() != null && PROPOSAL_KINDS.contains(e.kind())) {
            keys.add(Keys.key("sep", Keys.addr(e.contract()), proposalWord(e.proposalId()), h, li));
        }
        return keys;
    }

    private static String proposalWord(BigInteger id) {
        return String.format("%064x", id);
    }
}
