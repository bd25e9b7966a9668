package io.indexer.core.error;

/** A requested primary or secondary record does not exist. */
public class NotFoundException extends IndexerException {
    public NotFoundException(String message) {
        super(message);
    }
}
