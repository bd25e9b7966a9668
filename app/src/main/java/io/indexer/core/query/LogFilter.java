package io.indexer.core.query;

import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;

import java.util.List;
import java.util.Set;

/** Log list filter. Topics are positional; an empty or null position is a wildcard. */
public record LogFilter(Long blockFrom, Long blockTo, Set<Address> addresses, List<Set<Hash>> topics) {

    public static final LogFilter NONE = new LogFilter(null, null, Set.of(), List.of());

    public LogFilter {
        addresses = addresses == null ? Set.of() : Set.copyOf(addresses);
        topics = topics == null ? List.of() : topics;
    }
}
