package io.indexer.core.index;

import io.indexer.core.protocol.Address;

import java.math.BigInteger;
import java.util.Objects;

/**
 * One frame of an execution trace, as supplied by the tracer. Depth 0 is the top-level call.
 *
 * @param error revert or failure reason, {@code null} when the call succeeded
 */
public record InternalCall(String callType,
                           Address from,
                           Address to,
                           BigInteger value,
                           long gas,
                           long gasUsed,
                           int depth,
                           String error) {
    public InternalCall {
        Objects.requireNonNull(callType, "callType");
        Objects.requireNonNull(from, "from");
        value = value == null ? BigInteger.ZERO : value;
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be >= 0");
        }
    }

    public boolean succeeded() {
        return error == null || error.isEmpty();
    }
}
