package com.basepulse.indexer.modules.chains.events;

import com.basepulse.indexer.entity.DistributionMode;
import org.junit.jupiter.api.Test;
import org.web3j.protocol.core.methods.response.Log;

import java.math.BigInteger;
import java.util.List;

import static com.basepulse.indexer.modules.chains.events.PollLogFixtures.tx;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PollEventDecoderTest {

    private static final String ALICE = "0x00000000000000000000000000000000000000AA";
    private static final String BOB = "0x00000000000000000000000000000000000000bb";

    private final PollEventDecoder decoder = new PollEventDecoder();

    @Test
    void decodesPollCreated() {
        PollEvent event = decoder.decode(8453L, PollLogFixtures.pollCreated(100, tx(1), 3, 1, ALICE));

        PollCreated created = assertInstanceOf(PollCreated.class, event);
        assertEquals(8453L, created.getChainId());
        assertEquals(100L, created.getBlockNumber());
        assertEquals(tx(1), created.getTxHash());
        assertEquals(3, created.getLogIndex());
        assertEquals(1L, created.getPollId());
        assertEquals(ALICE.toLowerCase(), created.getCreator());
        assertEquals("Best L2?", created.getQuestion());
        assertEquals(BigInteger.valueOf(1_900_000_000L), created.getEndTime());
    }

    @Test
    void decodesVoted() {
        Voted voted = assertInstanceOf(Voted.class,
                decoder.decode(8453L, PollLogFixtures.voted(101, tx(2), 0, 1, ALICE, 2)));

        assertEquals(ALICE.toLowerCase(), voted.getVoter());
        assertEquals(2L, voted.getOptionIndex());
        assertEquals(tx(2) + "_0", voted.getUniqueKey());
    }

    @Test
    void decodesDistributionModeByIndex() {
        DistributionModeSet modeSet = assertInstanceOf(DistributionModeSet.class,
                decoder.decode(8453L, PollLogFixtures.distributionModeSet(102, tx(3), 0, 1, 2)));

        assertEquals(DistributionMode.AUTOMATED, modeSet.getMode());
    }

    @Test
    void rejectsUnknownDistributionMode() {
        Log log = PollLogFixtures.distributionModeSet(102, tx(3), 0, 1, 7);

        assertThrows(EventDecodeException.class, () -> decoder.decode(8453L, log));
    }

    @Test
    void decodesRewardEvents() {
        RewardDistributed distributed = assertInstanceOf(RewardDistributed.class, decoder.decode(8453L,
                PollLogFixtures.rewardDistributed(103, tx(4), 1, 1, BOB, BigInteger.valueOf(100))));
        assertEquals(BOB, distributed.getRecipient());
        assertEquals(PollLogFixtures.TOKEN, distributed.getToken());
        assertEquals(BigInteger.valueOf(100), distributed.getAmount());
        assertEquals(BigInteger.valueOf(1_700_000_000L), distributed.getTimestamp());

        RewardClaimed claimed = assertInstanceOf(RewardClaimed.class, decoder.decode(8453L,
                PollLogFixtures.rewardClaimed(104, tx(5), 0, 1, BOB, BigInteger.TEN)));
        assertEquals(BOB, claimed.getClaimer());
        assertEquals(BigInteger.TEN, claimed.getAmount());

        FundsWithdrawn withdrawn = assertInstanceOf(FundsWithdrawn.class, decoder.decode(8453L,
                PollLogFixtures.fundsWithdrawn(105, tx(6), 0, 1, ALICE, BigInteger.ONE)));
        assertEquals(ALICE.toLowerCase(), withdrawn.getRecipient());

        PollFunded funded = assertInstanceOf(PollFunded.class, decoder.decode(8453L,
                PollLogFixtures.pollFunded(99, tx(7), 0, 1, ALICE, 500)));
        assertEquals(BigInteger.valueOf(500), funded.getAmount());
    }

    @Test
    void rejectsTimestampBeyondDateRange() {
        Log log = PollLogFixtures.rewardDistributed(103, tx(4), 1, 1, BOB, BigInteger.ONE, BigInteger.TWO.pow(70));

        assertThrows(EventDecodeException.class, () -> decoder.decode(8453L, log));
    }

    @Test
    void acceptsLastRepresentableTimestamp() {
        Log log = PollLogFixtures.rewardDistributed(103, tx(4), 1, 1, BOB, BigInteger.ONE,
                PollEventDecoder.MAX_TIMESTAMP_SECONDS);

        RewardDistributed event = (RewardDistributed) decoder.decode(8453L, log);
        assertEquals(PollEventDecoder.MAX_TIMESTAMP_SECONDS, event.getTimestamp());
    }

    @Test
    void rejectsUnknownTopic() {
        EventDecodeException e = assertThrows(EventDecodeException.class,
                () -> decoder.decode(8453L, PollLogFixtures.unknownEvent(100, tx(1), 0)));
        assertTrue(e.getMessage().contains("Unrecognized event signature"));
    }

    @Test
    void rejectsMissingIndexedTopic() {
        Log log = PollLogFixtures.voted(101, tx(2), 0, 1, ALICE, 0);
        log.setTopics(List.of(log.getTopics().get(0), log.getTopics().get(1)));

        assertThrows(EventDecodeException.class, () -> decoder.decode(8453L, log));
    }

    @Test
    void rejectsTruncatedData() {
        Log log = PollLogFixtures.rewardDistributed(103, tx(4), 1, 1, BOB, BigInteger.ONE);
        log.setData("0x");

        assertThrows(EventDecodeException.class, () -> decoder.decode(8453L, log));
    }

    @Test
    void rejectsLogWithoutTopics() {
        Log log = PollLogFixtures.voted(101, tx(2), 0, 1, ALICE, 0);
        log.setTopics(List.of());

        assertThrows(EventDecodeException.class, () -> decoder.decode(8453L, log));
    }

    @Test
    void everyEventHasADistinctTopic() {
        assertEquals(PollContractEvent.values().length, PollContractEvent.allTopics().stream().distinct().count());
        for (PollContractEvent type : PollContractEvent.values()) {
            assertEquals(type, PollContractEvent.fromTopic(type.getTopic().toUpperCase().replace("0X", "0x")).orElseThrow());
        }
    }
}
