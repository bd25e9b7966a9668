package io.indexer.core.index;

/** Token standard inferred from the number of indexed Transfer topics. */
public enum TokenStandard {
    ERC20,
    ERC721
}
