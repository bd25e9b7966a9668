package io.indexer.core.index;

import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Hashes;

/** Governance and native-coin events emitted by the system contracts. */
public enum SystemEventKind {
    MINT("Mint(address,address,uint256)"),
    BURN("Burn(address,uint256)"),
    MINTER_CONFIGURED("MinterConfigured(address,uint256)"),
    MINTER_REMOVED("MinterRemoved(address)"),
    GAS_TIP_UPDATED("GasTipUpdated(uint256,uint256,address)"),
    ADDRESS_BLACKLISTED("AddressBlacklisted(address,uint256)"),
    ADDRESS_UNBLACKLISTED("AddressUnblacklisted(address,uint256)"),
    EMERGENCY_PAUSED("EmergencyPaused(uint256)"),
    EMERGENCY_UNPAUSED("EmergencyUnpaused(uint256)"),
    MEMBER_ADDED("MemberAdded(address,uint256,uint32)"),
    MEMBER_REMOVED("MemberRemoved(address,uint256,uint32)"),
    PROPOSAL_CREATED("ProposalCreated(uint256,address,bytes32,bytes,uint256,uint256,uint256)"),
    PROPOSAL_VOTED("ProposalVoted(uint256,address,bool,uint256,uint256)"),
    PROPOSAL_EXECUTED("ProposalExecuted(uint256,address,bool)");

    private final String signature;
    private final Hash topic;

    SystemEventKind(String signature) {
        this.signature = signature;
        this.topic = Hashes.eventTopic(signature);
    }

    public String signature() {
        return signature;
    }

    public Hash topic() {
        return topic;
    }
}
