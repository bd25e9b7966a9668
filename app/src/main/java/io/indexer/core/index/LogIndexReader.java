package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.protocol.Log;

import java.util.List;

public interface LogIndexReader {
    /** Matching logs in (height, tx index, log index) order. */
    List<Log> getLogs(OperationContext ctx, LogQuery query);
}
