package io.indexer.core.protocol;

import java.util.List;
import java.util.Objects;

public record AccessTuple(Address address, List<Hash> storageKeys) {
    public AccessTuple {
        Objects.requireNonNull(address, "address");
        storageKeys = storageKeys == null ? List.of() : List.copyOf(storageKeys);
    }
}
