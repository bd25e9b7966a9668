package io.indexer.core.storage;

import java.io.Closeable;

public interface ChainStore extends ChainReader, ChainWriter, Closeable {
    @Override void close();
}
