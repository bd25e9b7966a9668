package io.indexer.core.index;

import io.indexer.core.error.InvalidInputException;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Log selection over an inclusive height range. Topics are positional: each position holds the
 * accepted values (any of them matches), an empty set is a wildcard.
 */
public record LogQuery(long fromHeight, long toHeight, Set<Address> addresses, List<Set<Hash>> topics) {

    public LogQuery {
        if (fromHeight < 0 || toHeight < fromHeight) {
            throw new InvalidInputException("invalid log range [" + fromHeight + ", " + toHeight + "]");
        }
        addresses = addresses == null ? Set.of() : Set.copyOf(addresses);
        List<Set<Hash>> copy = new ArrayList<>();
        if (topics != null) {
            for (Set<Hash> position : topics) {
                copy.add(position == null ? Set.of() : Set.copyOf(position));
            }
        }
        topics = Collections.unmodifiableList(copy);
    }

    public static LogQuery range(long fromHeight, long toHeight) {
        return new LogQuery(fromHeight, toHeight, Set.of(), List.of());
    }

    public boolean matches(Log log) {
        if (log.blockNumber() < fromHeight || log.blockNumber() > toHeight) {
            return false;
        }
        if (!addresses.isEmpty() && !addresses.contains(log.address())) {
            return false;
        }
        for (int i = 0; i < topics.size(); i++) {
            Set<Hash> accepted = topics.get(i);
            if (accepted.isEmpty()) {
                continue;
            }
            Hash actual = log.topic(i);
            if (actual == null || !accepted.contains(actual)) {
                return false;
            }
        }
        return true;
    }

    Set<Hash> firstTopics() {
        return topics.isEmpty() ? Set.of() : topics.get(0);
    }
}
