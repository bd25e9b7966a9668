package io.indexer.core.index;

public enum TransferDirection {
    FROM,
    TO,
    ANY
}
