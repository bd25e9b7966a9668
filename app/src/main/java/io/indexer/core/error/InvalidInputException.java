package io.indexer.core.error;

/** Malformed address, hash, range or argument, rejected before storage is touched. */
public class InvalidInputException extends IndexerException {
    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
