package io.indexer.core.error;

public class CancelledException extends IndexerException {
    public CancelledException(String message) {
        super(message);
    }
}
