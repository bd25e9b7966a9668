package io.indexer.core.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.indexer.core.error.InvalidInputException;
import io.indexer.core.index.BlockBundle;
import io.indexer.core.index.InternalCall;
import io.indexer.core.protocol.AccessTuple;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Block;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Hex;
import io.indexer.core.protocol.Log;
import io.indexer.core.protocol.Receipt;
import io.indexer.core.protocol.SetCodeAuthorization;
import io.indexer.core.protocol.Transaction;
import io.indexer.core.protocol.TxType;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads a JSON chain dump into {@link BlockBundle}s.
 *
 * <p>The dump is either an array of blocks or an object with a {@code blocks} array. Each block is
 * shaped like {@code eth_getBlockByNumber(n, true)} and may carry a {@code receipts} array (shaped
 * like {@code eth_getTransactionReceipt}) and a {@code traces} object mapping a transaction hash to
 * its call frames ({@code type, from, to, value, gas, gasUsed, depth, error}).
 */
public final class ChainDumpReader {
    private static final Logger LOG = Logger.getLogger(ChainDumpReader.class.getName());

    private final ObjectMapper mapper = new ObjectMapper();

    public List<BlockBundle> read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            List<BlockBundle> bundles = read(in);
            LOG.info(() -> "Read " + bundles.size() + " block(s) from " + file);
            return bundles;
        }
    }

    public List<BlockBundle> read(InputStream in) throws IOException {
        JsonNode root = mapper.readTree(in);
        JsonNode blocks = root != null && root.isObject() ? root.get("blocks") : root;
        if (blocks == null || !blocks.isArray()) {
            throw new InvalidInputException("chain dump must be an array of blocks or an object with a 'blocks' array");
        }
        List<BlockBundle> out = new ArrayList<>(blocks.size());
        int i = 0;
        for (JsonNode node : blocks) {
            try {
                out.add(bundle(node));
            } catch (InvalidInputException | IllegalArgumentException e) {
                throw new InvalidInputException("block entry " + i + ": " + e.getMessage(), e);
            }
            i++;
        }
        return out;
    }

    static BlockBundle bundle(JsonNode node) {
        Block block = block(node);
        List<Receipt> receipts = new ArrayList<>();
        JsonNode rs = node.get("receipts");
        if (rs != null && rs.isArray()) {
            for (JsonNode r : rs) {
                receipts.add(receipt(r, block));
            }
        }
        Map<Hash, List<InternalCall>> traces = new LinkedHashMap<>();
        JsonNode ts = node.get("traces");
        if (ts != null && ts.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = ts.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                List<InternalCall> calls = new ArrayList<>();
                for (JsonNode frame : e.getValue()) {
                    calls.add(call(frame));
                }
                traces.put(Hash.fromHex(e.getKey()), calls);
            }
        }
        return new BlockBundle(block, receipts, traces);
    }

    static Block block(JsonNode n) {
        long number = quantityLong(n, "number");
        List<Transaction> txs = new ArrayList<>();
        JsonNode list = n.get("transactions");
        if (list != null) {
            for (JsonNode tx : list) {
                if (!tx.isObject()) {
                    throw new InvalidInputException("block " + number + " lists transaction hashes only; full transactions are required");
                }
                txs.add(transaction(tx));
            }
        }
        List<Hash> uncles = new ArrayList<>();
        JsonNode us = n.get("uncles");
        if (us != null) {
            for (JsonNode u : us) {
                uncles.add(Hash.fromHex(u.asText()));
            }
        }
        return Block.builder()
                .number(number)
                .hash(hash(n, "hash"))
                .parentHash(optionalHash(n, "parentHash"))
                .timestamp(quantityLong(n, "timestamp"))
                .miner(optionalAddress(n, "miner"))
                .gasLimit(optionalLong(n, "gasLimit", 0))
                .gasUsed(optionalLong(n, "gasUsed", 0))
                .baseFee(optionalQuantity(n, "baseFeePerGas"))
                .blobGas(n.hasNonNull("blobGasUsed") ? quantityLong(n, "blobGasUsed") : null,
                        n.hasNonNull("excessBlobGas") ? quantityLong(n, "excessBlobGas") : null)
                .extraData(n.hasNonNull("extraData") ? Hex.decode(n.get("extraData").asText()) : null)
                .transactions(txs)
                .uncles(uncles)
                .build();
    }

    static Transaction transaction(JsonNode n) {
        TxType type = n.hasNonNull("type") ? TxType.fromCode((int) quantityLong(n, "type")) : TxType.LEGACY;
        Transaction.Builder b = Transaction.builder()
                .hash(hash(n, "hash"))
                .type(type)
                .chainId(optionalQuantity(n, "chainId"))
                .nonce(optionalLong(n, "nonce", 0))
                .from(address(n, "from"))
                .to(optionalAddress(n, "to"))
                .value(optionalQuantity(n, "value"))
                .gas(optionalLong(n, "gas", 0))
                .input(n.hasNonNull("input") ? Hex.decode(n.get("input").asText()) : null)
                .signature(optionalQuantity(n, "v"), optionalQuantity(n, "r"), optionalQuantity(n, "s"))
                .feePayer(optionalAddress(n, "feePayer"));
        if (type.usesFeeMarket()) {
            b.gasTipCap(quantity(n, "maxPriorityFeePerGas"));
            b.gasFeeCap(quantity(n, "maxFeePerGas"));
        } else {
            b.gasPrice(quantity(n, "gasPrice"));
        }
        b.maxFeePerBlobGas(optionalQuantity(n, "maxFeePerBlobGas"));

        JsonNode access = n.get("accessList");
        if (access != null && access.isArray()) {
            List<AccessTuple> tuples = new ArrayList<>();
            for (JsonNode t : access) {
                List<Hash> keys = new ArrayList<>();
                for (JsonNode k : t.path("storageKeys")) {
                    keys.add(Hash.fromHex(k.asText()));
                }
                tuples.add(new AccessTuple(address(t, "address"), keys));
            }
            b.accessList(tuples);
        }
        JsonNode auths = n.get("authorizationList");
        if (auths != null && auths.isArray()) {
            List<SetCodeAuthorization> list = new ArrayList<>();
            for (JsonNode a : auths) {
                int parity = (int) (a.hasNonNull("yParity") ? quantityLong(a, "yParity") : optionalLong(a, "v", 0));
                list.add(new SetCodeAuthorization(quantity(a, "chainId"), address(a, "address"),
                        nonceOrOverflow(a), parity, quantity(a, "r"), quantity(a, "s")));
            }
            b.authorizations(list);
        }
        JsonNode blobs = n.get("blobVersionedHashes");
        if (blobs != null && blobs.isArray()) {
            List<Hash> hashes = new ArrayList<>();
            for (JsonNode h : blobs) {
                hashes.add(Hash.fromHex(h.asText()));
            }
            b.blobHashes(hashes);
        }
        return b.build();
    }

    static Receipt receipt(JsonNode n, Block block) {
        Hash txHash = hash(n, "transactionHash");
        int txIndex = (int) optionalLong(n, "transactionIndex", indexOf(block, txHash));
        List<Log> logs = new ArrayList<>();
        JsonNode ls = n.get("logs");
        if (ls != null) {
            for (JsonNode l : ls) {
                logs.add(log(l, block, txHash, txIndex));
            }
        }
        return new Receipt(
                txHash,
                (int) optionalLong(n, "status", Receipt.STATUS_SUCCESS),
                quantityLong(n, "cumulativeGasUsed"),
                optionalLong(n, "gasUsed", 0),
                optionalQuantity(n, "effectiveGasPrice"),
                optionalAddress(n, "contractAddress"),
                n.hasNonNull("logsBloom") ? Hex.decode(n.get("logsBloom").asText()) : null,
                logs,
                block.number(),
                block.hash(),
                txIndex);
    }

    static Log log(JsonNode n, Block block, Hash txHash, int txIndex) {
        List<Hash> topics = new ArrayList<>();
        for (JsonNode t : n.path("topics")) {
            topics.add(Hash.fromHex(t.asText()));
        }
        return new Log(
                address(n, "address"),
                topics,
                n.hasNonNull("data") ? Hex.decode(n.get("data").asText()) : null,
                block.number(),
                block.hash(),
                txHash,
                txIndex,
                (int) quantityLong(n, "logIndex"),
                n.path("removed").asBoolean(false));
    }

    static InternalCall call(JsonNode n) {
        String error = n.hasNonNull("error") ? n.get("error").asText() : null;
        return new InternalCall(
                n.path("type").asText("CALL"),
                address(n, "from"),
                optionalAddress(n, "to"),
                optionalQuantity(n, "value"),
                optionalLong(n, "gas", 0),
                optionalLong(n, "gasUsed", 0),
                n.path("depth").asInt(0),
                error);
    }

    // a nonce of 2^64-1 cannot be incremented; -1 marks it for the set-code index
    private static long nonceOrOverflow(JsonNode a) {
        BigInteger nonce = quantity(a, "nonce");
        return nonce.bitLength() > 63 ? -1L : nonce.longValue();
    }

    private static int indexOf(Block block, Hash txHash) {
        List<Transaction> txs = block.transactions();
        for (int i = 0; i < txs.size(); i++) {
            if (txs.get(i).hash().equals(txHash)) {
                return i;
            }
        }
        throw new InvalidInputException("receipt " + txHash + " has no transaction in block " + block.number());
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) {
            throw new InvalidInputException("missing field '" + field + "'");
        }
        return v.asText();
    }

    private static Hash hash(JsonNode n, String field) {
        return Hash.fromHex(text(n, field));
    }

    private static Hash optionalHash(JsonNode n, String field) {
        return n.hasNonNull(field) ? hash(n, field) : null;
    }

    private static Address address(JsonNode n, String field) {
        return Address.fromHex(text(n, field));
    }

    private static Address optionalAddress(JsonNode n, String field) {
        return n.hasNonNull(field) ? address(n, field) : null;
    }

    private static BigInteger quantity(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) {
            throw new InvalidInputException("missing field '" + field + "'");
        }
        return v.isNumber() ? v.bigIntegerValue() : Hex.quantity(v.asText());
    }

    private static BigInteger optionalQuantity(JsonNode n, String field) {
        return n.hasNonNull(field) ? quantity(n, field) : null;
    }

    private static long quantityLong(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v != null && v.isIntegralNumber()) {
            return v.longValue();
        }
        return Hex.quantityLong(text(n, field));
    }

    private static long optionalLong(JsonNode n, String field, long fallback) {
        return n.hasNonNull(field) ? quantityLong(n, field) : fallback;
    }
}
