package io.indexer.core.index;

import io.indexer.core.protocol.Block;

/** Decodes consensus metadata from a block header. */
public interface ConsensusExtraParser {
    /**
     * @throws io.indexer.core.error.DecodeFailureException when the extra data is not in the expected layout
     */
    WbftBlockExtra parse(Block block);

    /** Epoch an epoch-info snapshot carried by the block at {@code height} is filed under. */
    long epochOf(long height);

    /** The boundary block whose epoch info governs {@code height}, or -1 when there is none. */
    long governingBoundary(long height);
}
