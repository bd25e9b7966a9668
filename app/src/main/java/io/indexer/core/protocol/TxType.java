package io.indexer.core.protocol;

import io.indexer.core.error.InvalidInputException;

public enum TxType {
    LEGACY(0x00),
    ACCESS_LIST(0x01),
    DYNAMIC_FEE(0x02),
    BLOB(0x03),
    SET_CODE(0x04),
    FEE_DELEGATED(0x16);

    private final int code;

    TxType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** Whether the fee-market price formula applies (tip cap and fee cap instead of a fixed price). */
    public boolean usesFeeMarket() {
        return this == DYNAMIC_FEE || this == BLOB || this == SET_CODE || this == FEE_DELEGATED;
    }

    public static TxType fromCode(int code) {
        for (TxType t : values()) {
            if (t.code == code) {
                return t;
            }
        }
        throw new InvalidInputException("unknown transaction type 0x" + Integer.toHexString(code));
    }
}
