package com.basepulse.indexer.modules.chains.events;

import org.web3j.abi.EventEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * ABI of the events emitted by the poll contract.
 */
public enum PollContractEvent {

    POLL_CREATED(new Event("PollCreated", Arrays.asList(
            new TypeReference<Uint256>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Utf8String>() {},
            new TypeReference<Uint256>() {}))),

    POLL_FUNDED(new Event("PollFunded", Arrays.asList(
            new TypeReference<Uint256>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Address>() {},
            new TypeReference<Uint256>() {}))),

    VOTED(new Event("Voted", Arrays.asList(
            new TypeReference<Uint256>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Uint256>() {}))),

    DISTRIBUTION_MODE_SET(new Event("DistributionModeSet", Arrays.asList(
            new TypeReference<Uint256>(true) {},
            new TypeReference<Uint8>() {},
            new TypeReference<Uint256>() {}))),

    REWARD_DISTRIBUTED(new Event("RewardDistributed", Arrays.asList(
            new TypeReference<Uint256>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Address>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {}))),

    REWARD_CLAIMED(new Event("RewardClaimed", Arrays.asList(
            new TypeReference<Uint256>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Address>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {}))),

    FUNDS_WITHDRAWN(new Event("FundsWithdrawn", Arrays.asList(
            new TypeReference<Uint256>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Address>() {},
            new TypeReference<Uint256>() {})));

    private final Event event;
    private final String topic;

    PollContractEvent(Event event) {
        this.event = event;
        this.topic = EventEncoder.encode(event).toLowerCase();
    }

    public Event getEvent() {
        return event;
    }

    /**
     * keccak256 of the canonical signature, i.e. topic0 of every log of this event
     */
    public String getTopic() {
        return topic;
    }

    public static Optional<PollContractEvent> fromTopic(String topic0) {
        if (topic0 == null) {
            return Optional.empty();
        }
        String normalized = topic0.toLowerCase();
        return Arrays.stream(values())
                .filter(e -> e.topic.equals(normalized))
                .findFirst();
    }

    public static List<String> allTopics() {
        return Arrays.stream(values())
                .map(PollContractEvent::getTopic)
                .collect(Collectors.toList());
    }
}
