package io.indexer.core.index;

import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;

/** Code delegation currently in force for an authority. */
public record Delegation(Address authority, Address target, long blockNumber, Hash txHash) {
    /** Code an account carries once delegated: 0xef0100 followed by the target address. */
    public byte[] designatorCode() {
        byte[] out = new byte[23];
        out[0] = (byte) 0xef;
        out[1] = 0x01;
        out[2] = 0x00;
        System.arraycopy(target.bytes(), 0, out, 3, 20);
        return out;
    }
}
