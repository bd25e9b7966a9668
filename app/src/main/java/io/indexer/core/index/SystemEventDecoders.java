package io.indexer.core.index;

import io.indexer.core.error.DecodeFailureException;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Hex;
import io.indexer.core.protocol.Log;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Decoder registry for system contract events. One instance is created at startup and handed to
 * whoever decodes; {@link #reload(Set, Set)} swaps the watched contracts and enabled events
 * atomically while indexing continues.
 */
public final class SystemEventDecoders {
    private static final Logger LOG = Logger.getLogger(SystemEventDecoders.class.getName());

    public static final Address NATIVE_COIN_ADAPTER = Address.fromHex("0x0000000000000000000000000000000000001000");
    public static final Address GOV_VALIDATOR = Address.fromHex("0x0000000000000000000000000000000000001001");
    public static final Address GOV_MASTER_MINTER = Address.fromHex("0x0000000000000000000000000000000000001002");
    public static final Address GOV_MINTER = Address.fromHex("0x0000000000000000000000000000000000001003");
    public static final Address GOV_COUNCIL = Address.fromHex("0x0000000000000000000000000000000000001004");

    public static final Set<Address> DEFAULT_CONTRACTS =
            Set.of(NATIVE_COIN_ADAPTER, GOV_VALIDATOR, GOV_MASTER_MINTER, GOV_MINTER, GOV_COUNCIL);

    private volatile Registry registry;

    private SystemEventDecoders(Registry registry) {
        this.registry = registry;
    }

    /** Registry watching the built-in system contracts for every known event. */
    public static SystemEventDecoders initialize() {
        return initialize(DEFAULT_CONTRACTS, EnumSet.allOf(SystemEventKind.class));
    }

    public static SystemEventDecoders initialize(Set<Address> contracts, Set<SystemEventKind> kinds) {
        return new SystemEventDecoders(Registry.of(contracts, kinds));
    }

    public void reload(Set<Address> contracts, Set<SystemEventKind> kinds) {
        Registry next = Registry.of(contracts, kinds);
        registry = next;
        LOG.info(() -> "System event decoders reloaded: " + next.contracts.size() + " contracts, "
                + next.byTopic.size() + " events");
    }

    public Set<Address> contracts() {
        return registry.contracts;
    }

    public boolean watches(Address contract) {
        return registry.contracts.contains(contract);
    }

    /**
     * Empty when the log is not from a watched contract or not a known event.
     *
     * @throws DecodeFailureException when a known event does not have the expected layout
     */
    public Optional<SystemContractEvent> decode(Log log) {
        Registry r = registry;
        if (!r.contracts.contains(log.address())) {
            return Optional.empty();
        }
        Hash topic0 = log.topic(0);
        SystemEventKind kind = topic0 == null ? null : r.byTopic.get(topic0);
        if (kind == null) {
            return Optional.empty();
        }
        return Optional.of(decode(kind, log));
    }

    static SystemContractEvent decode(SystemEventKind kind, Log log) {
        byte[] data = log.data();
        Map<String, String> details = new LinkedHashMap<>();
        Address account = null;
        Address counterparty = null;
        BigInteger amount = null;
        BigInteger proposalId = null;
        switch (kind) {
            case MINT:
                requireTopics(kind, log, 3);
                requireData(kind, log, data, 32);
                counterparty = topicAddress(log, 1);
                account = topicAddress(log, 2);
                amount = word(data, 0);
                break;
            case BURN:
                requireTopics(kind, log, 2);
                requireData(kind, log, data, 32);
                account = topicAddress(log, 1);
                amount = word(data, 0);
                break;
            case MINTER_CONFIGURED:
                requireTopics(kind, log, 2);
                requireData(kind, log, data, 32);
                account = topicAddress(log, 1);
                amount = word(data, 0);
                break;
            case MINTER_REMOVED:
                requireTopics(kind, log, 2);
                account = topicAddress(log, 1);
                break;
            case GAS_TIP_UPDATED:
                requireTopics(kind, log, 2);
                requireData(kind, log, data, 64);
                account = topicAddress(log, 1);
                details.put("oldTip", word(data, 0).toString());
                amount = word(data, 1);
                break;
            case ADDRESS_BLACKLISTED:
            case ADDRESS_UNBLACKLISTED:
                if (log.topics().size() != 3) {
                    throw failure(kind, log, "expected 3 topics, got " + log.topics().size());
                }
                account = topicAddress(log, 1);
                proposalId = topicNumber(log, 2);
                break;
            case EMERGENCY_PAUSED:
            case EMERGENCY_UNPAUSED:
                requireTopics(kind, log, 2);
                proposalId = topicNumber(log, 1);
                break;
            case MEMBER_ADDED:
            case MEMBER_REMOVED:
                requireTopics(kind, log, 2);
                requireData(kind, log, data, 64);
                account = topicAddress(log, 1);
                details.put("totalMembers", word(data, 0).toString());
                details.put("newQuorum", word(data, 1).toString());
                break;
            case PROPOSAL_CREATED:
                requireTopics(kind, log, 3);
                requireData(kind, log, data, 128);
                proposalId = topicNumber(log, 1);
                account = topicAddress(log, 2);
                details.put("actionType", Hex.encodePrefixed(Arrays.copyOfRange(data, 0, 32)));
                details.put("memberVersion", word(data, 1).toString());
                details.put("requiredApprovals", word(data, 2).toString());
                break;
            case PROPOSAL_VOTED:
                requireTopics(kind, log, 3);
                requireData(kind, log, data, 96);
                proposalId = topicNumber(log, 1);
                account = topicAddress(log, 2);
                details.put("approval", Boolean.toString(word(data, 0).signum() != 0));
                details.put("approved", word(data, 1).toString());
                details.put("rejected", word(data, 2).toString());
                break;
            case PROPOSAL_EXECUTED:
                requireTopics(kind, log, 3);
                requireData(kind, log, data, 32);
                proposalId = topicNumber(log, 1);
                account = topicAddress(log, 2);
                details.put("success", Boolean.toString(word(data, 0).signum() != 0));
                break;
            default:
                throw failure(kind, log, "no decoder");
        }
        return new SystemContractEvent(kind, log.address(), log.blockNumber(), log.txHash(), log.txIndex(),
                log.logIndex(), account, counterparty, amount, proposalId, details);
    }

    private static void requireTopics(SystemEventKind kind, Log log, int min) {
        if (log.topics().size() < min) {
            throw failure(kind, log, "expected " + min + " topics, got " + log.topics().size());
        }
    }

    private static void requireData(SystemEventKind kind, Log log, byte[] data, int min) {
        if (data.length < min) {
            throw failure(kind, log, "expected " + min + " data bytes, got " + data.length);
        }
    }

    private static DecodeFailureException failure(SystemEventKind kind, Log log, String reason) {
        return new DecodeFailureException(kind + " in " + log.txHash() + "#" + log.logIndex() + ": " + reason);
    }

    private static Address topicAddress(Log log, int position) {
        return Address.fromWord(log.topic(position).bytes());
    }

    private static BigInteger topicNumber(Log log, int position) {
        return new BigInteger(1, log.topic(position).bytes());
    }

    private static BigInteger word(byte[] data, int index) {
        return new BigInteger(1, Arrays.copyOfRange(data, index * 32, index * 32 + 32));
    }

    private static final class Registry {
        final Set<Address> contracts;
        final Map<Hash, SystemEventKind> byTopic;

        private Registry(Set<Address> contracts, Map<Hash, SystemEventKind> byTopic) {
            this.contracts = contracts;
            this.byTopic = byTopic;
        }

        static Registry of(Set<Address> contracts, Set<SystemEventKind> kinds) {
            Map<Hash, SystemEventKind> byTopic = new HashMap<>();
            for (SystemEventKind k : kinds) {
                byTopic.put(k.topic(), k);
            }
            return new Registry(Set.copyOf(contracts), Map.copyOf(byTopic));
        }
    }
}
