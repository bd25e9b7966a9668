package io.indexer.core.error;

public class ReadOnlyStoreException extends StorageUnavailableException {
    public ReadOnlyStoreException(String operation) {
        super(operation + " rejected: store is read-only");
    }
}
