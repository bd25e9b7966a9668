package io.indexer.core.error;

/**
 * The durability layer failed. Fatal for the triggering operation; the caller retries.
 */
public class StorageUnavailableException extends IndexerException {
    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
