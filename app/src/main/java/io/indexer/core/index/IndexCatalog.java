package io.indexer.core.index;

import io.indexer.core.protocol.SignerRecovery;
import io.indexer.core.storage.KvChainStore;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The index families maintained for a store. Callers probe for optional capabilities with
 * {@link #find(Class)}, e.g. {@code catalog.find(ConsensusIndexReader.class)}, and treat an empty
 * result as "not supported by this backend".
 */
public final class IndexCatalog {
    private final List<IndexFamily> families;

    public IndexCatalog(List<IndexFamily> families) {
        Set<String> names = new HashSet<>();
        for (IndexFamily f : families) {
            if (!names.add(f.name())) {
                throw new IllegalArgumentException("duplicate index family " + f.name());
            }
        }
        this.families = List.copyOf(families);
    }

    /**
     * Every family this module ships. The consensus family is only included when a parser for the
     * chain's extra-data format is given.
     */
    public static IndexCatalog standard(KvChainStore store, SignerRecovery recovery,
                                        SystemEventDecoders decoders, ConsensusExtraParser consensusParser) {
        List<IndexFamily> out = new ArrayList<>();
        out.add(new AddressIndex(store.db()));
        out.add(new LogIndex(store));
        out.add(new TokenIndex(store.db()));
        out.add(new ContractIndex(store.db()));
        out.add(new InternalTxIndex(store.db()));
        out.add(new SetCodeIndex(store.db(), recovery));
        if (consensusParser != null) {
            out.add(new ConsensusIndex(store, consensusParser));
        }
        out.add(new BalanceIndex(store.db()));
        out.add(new SystemContractIndex(store.db(), decoders));
        return new IndexCatalog(out);
    }

    public List<IndexFamily> families() {
        return families;
    }

    public List<IndexFamily> mandatory() {
        return families.stream().filter(IndexFamily::mandatory).toList();
    }

    public List<IndexFamily> extended() {
        return families.stream().filter(f -> !f.mandatory()).toList();
    }

    public <T> Optional<T> find(Class<T> capability) {
        for (IndexFamily f : families) {
            if (capability.isInstance(f)) {
                return Optional.of(capability.cast(f));
            }
        }
        return Optional.empty();
    }

    public <T> T require(Class<T> capability) {
        return find(capability).orElseThrow(() ->
                new UnsupportedOperationException(capability.getSimpleName() + " is not available"));
    }
}
