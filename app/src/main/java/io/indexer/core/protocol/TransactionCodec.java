package io.indexer.core.protocol;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

public final class TransactionCodec {
    private static final int VERSION = 1;

    private TransactionCodec(){}

    public static byte[] toBytes(Transaction tx) {
        BinaryWriter w = new BinaryWriter()
                .putInt(VERSION)
                .putHash(tx.hash())
                .putInt(tx.type().code())
                .putOptionalBigInteger(tx.chainId())
                .putLong(tx.nonce())
                .putAddress(tx.from())
                .putOptionalAddress(tx.to().orElse(null))
                .putBigInteger(tx.value())
                .putLong(tx.gas())
                .putOptionalBigInteger(tx.gasPrice())
                .putOptionalBigInteger(tx.gasTipCap())
                .putOptionalBigInteger(tx.gasFeeCap())
                .putOptionalBigInteger(tx.maxFeePerBlobGas())
                .putBytes(tx.input())
                .putBigInteger(tx.v())
                .putBigInteger(tx.r())
                .putBigInteger(tx.s());

        w.putInt(tx.accessList().size());
        for (AccessTuple t : tx.accessList()) {
            w.putAddress(t.address());
            w.putInt(t.storageKeys().size());
            for (Hash k : t.storageKeys()) {
                w.putHash(k);
            }
        }
        w.putInt(tx.authorizations().size());
        for (SetCodeAuthorization a : tx.authorizations()) {
            w.putBigInteger(a.chainId())
                    .putAddress(a.address())
                    .putLong(a.nonce())
                    .putInt(a.yParity())
                    .putBigInteger(a.r())
                    .putBigInteger(a.s());
        }
        w.putInt(tx.blobHashes().size());
        for (Hash h : tx.blobHashes()) {
            w.putHash(h);
        }
        w.putOptionalAddress(tx.feePayer().orElse(null));
        return w.toByteArray();
    }

    public static Transaction fromBytes(byte[] bytes) {
        try {
            BinaryReader r = new BinaryReader(bytes);
            int version = r.getInt();
            if (version != VERSION) {
                throw new IllegalArgumentException("unsupported transaction encoding v" + version);
            }
            Transaction.Builder b = Transaction.builder()
                    .hash(r.getHash())
                    .type(TxType.fromCode(r.getInt()))
                    .chainId(r.getOptionalBigInteger())
                    .nonce(r.getLong())
                    .from(r.getAddress())
                    .to(r.getOptionalAddress())
                    .value(r.getBigInteger())
                    .gas(r.getLong())
                    .gasPrice(r.getOptionalBigInteger())
                    .gasTipCap(r.getOptionalBigInteger())
                    .gasFeeCap(r.getOptionalBigInteger())
                    .maxFeePerBlobGas(r.getOptionalBigInteger())
                    .input(r.getBytes());
            BigInteger v = r.getBigInteger();
            BigInteger sigR = r.getBigInteger();
            BigInteger sigS = r.getBigInteger();
            b.signature(v, sigR, sigS);

            int tuples = r.getCount(Address.LENGTH + 4);
            List<AccessTuple> accessList = new ArrayList<>(tuples);
            for (int i = 0; i < tuples; i++) {
                Address address = r.getAddress();
                int keys = r.getCount(Hash.LENGTH);
                List<Hash> storageKeys = new ArrayList<>(keys);
                for (int k = 0; k < keys; k++) {
                    storageKeys.add(r.getHash());
                }
                accessList.add(new AccessTuple(address, storageKeys));
            }
            int auths = r.getCount(Address.LENGTH);
            List<SetCodeAuthorization> authorizations = new ArrayList<>(auths);
            for (int i = 0; i < auths; i++) {
                authorizations.add(new SetCodeAuthorization(
                        r.getBigInteger(), r.getAddress(), r.getLong(), r.getInt(), r.getBigInteger(), r.getBigInteger()));
            }
            int blobs = r.getCount(Hash.LENGTH);
            List<Hash> blobHashes = new ArrayList<>(blobs);
            for (int i = 0; i < blobs; i++) {
                blobHashes.add(r.getHash());
            }
            return b.accessList(accessList)
                    .authorizations(authorizations)
                    .blobHashes(blobHashes)
                    .feePayer(r.getOptionalAddress())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Transaction bytes", ex);
        }
    }
}
