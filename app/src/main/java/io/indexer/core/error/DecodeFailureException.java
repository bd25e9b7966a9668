package io.indexer.core.error;

/** A log or extra-data blob did not match the schema it claimed to follow. */
public class DecodeFailureException extends IndexerException {
    public DecodeFailureException(String message) {
        super(message);
    }

    public DecodeFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
