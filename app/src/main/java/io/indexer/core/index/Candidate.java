package io.indexer.core.index;

import io.indexer.core.protocol.Address;

/**
 * @param diligence score in millionths
 */
public record Candidate(Address address, long diligence) {
}
