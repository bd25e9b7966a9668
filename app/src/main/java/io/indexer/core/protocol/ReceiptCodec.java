package io.indexer.core.protocol;

import java.util.ArrayList;
import java.util.List;

public final class ReceiptCodec {
    private static final int VERSION = 1;

    private ReceiptCodec(){}

    public static byte[] toBytes(Receipt receipt) {
        BinaryWriter w = new BinaryWriter()
                .putInt(VERSION)
                .putHash(receipt.txHash())
                .putInt(receipt.status())
                .putLong(receipt.cumulativeGasUsed())
                .putLong(receipt.gasUsed())
                .putOptionalBigInteger(receipt.effectiveGasPrice())
                .putOptionalAddress(receipt.contractAddress())
                .putBytes(receipt.logsBloom())
                .putLong(receipt.blockNumber())
                .putHash(receipt.blockHash())
                .putInt(receipt.txIndex());
        w.putInt(receipt.logs().size());
        for (Log log : receipt.logs()) {
            writeLog(w, log);
        }
        return w.toByteArray();
    }

    public static Receipt fromBytes(byte[] bytes) {
        try {
            BinaryReader r = new BinaryReader(bytes);
            int version = r.getInt();
            if (version != VERSION) {
                throw new IllegalArgumentException("unsupported receipt encoding v" + version);
            }
            Hash txHash = r.getHash();
            int status = r.getInt();
            long cumulative = r.getLong();
            long gasUsed = r.getLong();
            var price = r.getOptionalBigInteger();
            Address contract = r.getOptionalAddress();
            byte[] bloom = r.getBytes();
            long blockNumber = r.getLong();
            Hash blockHash = r.getHash();
            int txIndex = r.getInt();
            int count = r.getCount(Address.LENGTH);
            List<Log> logs = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                logs.add(readLog(r));
            }
            return new Receipt(txHash, status, cumulative, gasUsed, price, contract, bloom, logs,
                    blockNumber, blockHash, txIndex);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Receipt bytes", ex);
        }
    }

    public static byte[] logBytes(Log log) {
        BinaryWriter w = new BinaryWriter().putInt(VERSION);
        writeLog(w, log);
        return w.toByteArray();
    }

    public static Log logFromBytes(byte[] bytes) {
        try {
            BinaryReader r = new BinaryReader(bytes);
            int version = r.getInt();
            if (version != VERSION) {
                throw new IllegalArgumentException("unsupported log encoding v" + version);
            }
            return readLog(r);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Log bytes", ex);
        }
    }

    private static void writeLog(BinaryWriter w, Log log) {
        w.putAddress(log.address());
        w.putInt(log.topics().size());
        for (Hash topic : log.topics()) {
            w.putHash(topic);
        }
        w.putBytes(log.data())
                .putLong(log.blockNumber())
                .putHash(log.blockHash())
                .putHash(log.txHash())
                .putInt(log.txIndex())
                .putInt(log.logIndex())
                .putBoolean(log.removed());
    }

    private static Log readLog(BinaryReader r) {
        Address address = r.getAddress();
        int topicCount = r.getCount(Hash.LENGTH);
        List<Hash> topics = new ArrayList<>(topicCount);
        for (int i = 0; i < topicCount; i++) {
            topics.add(r.getHash());
        }
        byte[] data = r.getBytes();
        long blockNumber = r.getLong();
        Hash blockHash = r.getHash();
        Hash txHash = r.getHash();
        int txIndex = r.getInt();
        int logIndex = r.getInt();
        boolean removed = r.getBoolean();
        return new Log(address, topics, data, blockNumber, blockHash, txHash, txIndex, logIndex, removed);
    }
}
