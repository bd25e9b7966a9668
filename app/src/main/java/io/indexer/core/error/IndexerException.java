package io.indexer.core.error;

/**
 * Root of the indexer's unchecked error taxonomy. Callers can catch the concrete
 * subclasses to tell "absent" apart from "broken".
 */
public abstract class IndexerException extends RuntimeException {
    protected IndexerException(String message) {
        super(message);
    }

    protected IndexerException(String message, Throwable cause) {
        super(message, cause);
    }
}
