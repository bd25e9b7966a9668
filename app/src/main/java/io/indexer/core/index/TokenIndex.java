package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.error.DecodeFailureException;
import io.indexer.core.error.NotFoundException;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Hex;
import io.indexer.core.protocol.Log;
import io.indexer.core.protocol.Receipt;
import io.indexer.core.storage.Column;
import io.indexer.core.storage.KeyValueDB;
import io.indexer.core.storage.Keys;
import io.indexer.core.storage.StoredBlock;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * ERC20/ERC721 transfer ledger and NFT ownership.
 *
 * <pre>
 * tt/{txHash}/{logIndex}                         transfer record
 * ttk/{contract}/{height}/{logIndex}             by token
 * ttf/{from}/..., ttt/{to}/..., tta/{addr}/...   by participant
 * nft/{contract}/{tokenId}                       current owner
 * nfth/{contract}/{tokenId}/{height}/{logIndex}  ownership history
 * </pre>
 *
 * Index entries hold the key of the transfer record. Owners are resolved while the batch commits,
 * last transfer by (height, log index) wins.
 */
public final class TokenIndex implements IndexFamily, TokenIndexReader {
    private final KeyValueDB db;

    public TokenIndex(KeyValueDB db) {
        this.db = db;
    }

    @Override
    public String name() {
        return "token";
    }

    @Override
    public boolean mandatory() {
        return true;
    }

    @Override
    public void stage(IndexBatch batch, BlockBundle bundle) {
        long height = bundle.height();
        Map<TokenKey, TokenTransfer> latestNft = new LinkedHashMap<>();
        for (TokenTransfer t : decodeAll(bundle.receipts(), batch)) {
            byte[] recordKey = recordKey(t.txHash(), t.logIndex());
            batch.put(recordKey, IndexJson.write(t));
            for (byte[] pointer : pointerKeys(t)) {
                batch.put(pointer, recordKey);
            }
            if (t.standard() == TokenStandard.ERC721) {
                latestNft.merge(new TokenKey(t.contract(), t.tokenId()), t,
                        (a, b) -> a.logIndex() >= b.logIndex() ? a : b);
            }
        }
        if (latestNft.isEmpty()) {
            return;
        }
        batch.onCommit(() -> {
            for (Map.Entry<TokenKey, TokenTransfer> e : latestNft.entrySet()) {
                TokenTransfer t = e.getValue();
                NftOwnership current = readOwner(e.getKey());
                // a transfer at a later height committed first; it stays the owner
                if (current != null && current.blockNumber() > height) {
                    continue;
                }
                batch.put(ownerKey(e.getKey()), IndexJson.write(ownership(t)));
            }
        });
    }

    @Override
    public void unstage(IndexBatch batch, StoredBlock stored) {
        long height = stored.block().number();
        Set<TokenKey> touched = new LinkedHashSet<>();
        for (TokenTransfer t : decodeAll(stored.receipts(), null)) {
            batch.delete(recordKey(t.txHash(), t.logIndex()));
            for (byte[] pointer : pointerKeys(t)) {
                batch.delete(pointer);
            }
            if (t.standard() == TokenStandard.ERC721) {
                touched.add(new TokenKey(t.contract(), t.tokenId()));
            }
        }
        if (touched.isEmpty()) {
            return;
        }
        batch.onCommit(() -> {
            for (TokenKey token : touched) {
                NftOwnership current = readOwner(token);
                if (current == null || current.blockNumber() != height) {
                    continue;
                }
                Optional<TokenTransfer> previous = lastTransferBelow(token, height);
                if (previous.isPresent()) {
                    batch.put(ownerKey(token), IndexJson.write(ownership(previous.get())));
                } else {
                    batch.delete(ownerKey(token));
                }
            }
        });
    }

    @Override
    public List<TokenTransfer> getTokenTransfersByTx(OperationContext ctx, Hash txHash) {
        List<TokenTransfer> out = new ArrayList<>();
        db.scanPrefix(Column.INDEX, Keys.key("tt", txHash.hex(), ""), false, e -> {
            ctx.checkActive();
            out.add(IndexJson.read(e.value(), TokenTransfer.class));
            return true;
        });
        return out;
    }

    @Override
    public List<TokenTransfer> getTokenTransfersByToken(OperationContext ctx, Address contract, PageRequest page) {
        return IndexScan.page(db, ctx, Keys.key("ttk", Keys.addr(contract), ""), page,
                e -> IndexScan.follow(db, e, TokenTransfer.class));
    }

    @Override
    public List<TokenTransfer> getTokenTransfersByAddress(OperationContext ctx, Address address,
                                                          TransferDirection direction, PageRequest page) {
        String bucket;
        switch (direction) {
            case FROM: bucket = "ttf"; break;
            case TO: bucket = "ttt"; break;
            default: bucket = "tta"; break;
        }
        return IndexScan.page(db, ctx, Keys.key(bucket, Keys.addr(address), ""), page,
                e -> IndexScan.follow(db, e, TokenTransfer.class));
    }

    @Override
    public NftOwnership getNftOwner(OperationContext ctx, Address contract, BigInteger tokenId) {
        ctx.checkActive();
        NftOwnership owner = readOwner(new TokenKey(contract, tokenId));
        if (owner == null) {
            throw new NotFoundException("no owner recorded for " + contract + " token " + tokenId);
        }
        return owner;
    }

    @Override
    public List<TokenTransfer> getNftTransferHistory(OperationContext ctx, Address contract, BigInteger tokenId, PageRequest page) {
        TokenKey token = new TokenKey(contract, tokenId);
        return IndexScan.page(db, ctx, historyPrefix(token), page, e -> IndexScan.follow(db, e, TokenTransfer.class));
    }

    private List<TokenTransfer> decodeAll(List<Receipt> receipts, IndexBatch failures) {
        List<TokenTransfer> out = new ArrayList<>();
        for (Receipt r : receipts) {
            for (Log log : r.logs()) {
                try {
                    TokenTransferDecoder.decode(log).ifPresent(out::add);
                } catch (DecodeFailureException | IllegalArgumentException e) {
                    if (failures != null) {
                        failures.decodeFailure(e.getMessage());
                    }
                }
            }
        }
        return out;
    }

    private NftOwnership readOwner(TokenKey token) {
        byte[] raw = db.get(Column.INDEX, ownerKey(token));
        return raw == null ? null : IndexJson.read(raw, NftOwnership.class);
    }

    private Optional<TokenTransfer> lastTransferBelow(TokenKey token, long height) {
        List<TokenTransfer> found = new ArrayList<>(1);
        db.scan(Column.INDEX, historyPrefix(token), historyKey(token, height, 0), true, e -> {
            TokenTransfer t = IndexScan.follow(db, e, TokenTransfer.class);
            if (t != null) {
                found.add(t);
                return false;
            }
            return true;
        });
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    private static NftOwnership ownership(TokenTransfer t) {
        return new NftOwnership(t.contract(), t.tokenId(), t.to(), t.blockNumber(), t.logIndex(), t.txHash());
    }

    private static List<byte[]> pointerKeys(TokenTransfer t) {
        String h = Keys.num(t.blockNumber());
        String li = Keys.idx(t.logIndex());
        List<byte[]> keys = new ArrayList<>(6);
        keys.add(Keys.key("ttk", Keys.addr(t.contract()), h, li));
        keys.add(Keys.key("ttf", Keys.addr(t.from()), h, li));
        keys.add(Keys.key("ttt", Keys.addr(t.to()), h, li));
        keys.add(Keys.key("tta", Keys.addr(t.from()), h, li));
        if (!t.to().equals(t.from())) {
            keys.add(Keys.key("tta", Keys.addr(t.to()), h, li));
        }
        if (t.standard() == TokenStandard.ERC721) {
            keys.add(historyKey(new TokenKey(t.contract(), t.tokenId()), t.blockNumber(), t.logIndex()));
        }
        return keys;
    }

    private static byte[] recordKey(Hash txHash, int logIndex) {
        return Keys.key("tt", txHash.hex(), Keys.idx(logIndex));
    }

    private static byte[] ownerKey(TokenKey token) {
        return Keys.key("nft", Keys.addr(token.contract), token.word());
    }

    private static byte[] historyPrefix(TokenKey token) {
        return Keys.key("nfth", Keys.addr(token.contract), token.word(), "");
    }

    private static byte[] historyKey(TokenKey token, long height, int logIndex) {
        return Keys.key("nfth", Keys.addr(token.contract), token.word(), Keys.num(height), Keys.idx(logIndex));
    }

    private record TokenKey(Address contract, BigInteger tokenId) {
        /** Fixed-width hex so token ids never prefix one another. */
        String word() {
            byte[] raw = tokenId.toByteArray();
            byte[] word = new byte[32];
            int len = Math.min(raw.length, 32);
            System.arraycopy(raw, raw.length - len, word, 32 - len, len);
            return Hex.encode(word);
        }
    }
}
