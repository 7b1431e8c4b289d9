package com.basepulse.indexer.sync;

import com.basepulse.indexer.entity.DistributionMode;
import com.basepulse.indexer.entity.PollVote;
import com.basepulse.indexer.entity.SyncError;
import com.basepulse.indexer.modules.chains.events.PollLogFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.web3j.protocol.core.methods.response.Log;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.basepulse.indexer.modules.chains.events.PollLogFixtures.tx;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;

class PollEventProcessorTest {

    private static final Long CHAIN = 8453L;
    private static final String CREATOR = "0x00000000000000000000000000000000000000c1";
    private static final String VOTER_A = "0x00000000000000000000000000000000000000aa";
    private static final String VOTER_B = "0x00000000000000000000000000000000000000bb";

    private final InMemoryProjection projection = new InMemoryProjection();
    private final PollEventProcessor processor = projection.processor;

    @Test
    void duplicateVoteDeliveryCountsOnce() {
        processor.applyBlock(CHAIN, 100, List.of(PollLogFixtures.pollCreated(100, tx(1), 0, 1, CREATOR)));
        Log vote = PollLogFixtures.voted(101, tx(2), 0, 1, VOTER_A, 0);

        BlockResult first = processor.applyBlock(CHAIN, 101, List.of(vote));
        BlockResult second = processor.applyBlock(CHAIN, 101, List.of(vote));

        assertEquals(1, first.getApplied());
        assertEquals(0, second.getApplied());
        assertEquals(1, second.getSkipped());
        assertEquals(1, projection.polls.size());
        assertEquals(1, projection.entry(VOTER_A).getTotalVotes());
        assertEquals(1, projection.entry(VOTER_A).getPollsParticipated());
        assertEquals(1, projection.entry(CREATOR).getPollsCreated());
    }

    @Test
    void duplicateWithinOneBlockIsAppliedOnce() {
        processor.applyBlock(CHAIN, 100, List.of(PollLogFixtures.pollCreated(100, tx(1), 0, 1, CREATOR)));
        Log vote = PollLogFixtures.voted(101, tx(2), 4, 1, VOTER_A, 0);

        BlockResult result = processor.applyBlock(CHAIN, 101, List.of(vote, vote));

        assertEquals(1, result.getApplied());
        assertEquals(1, projection.votes.size());
    }

    @Test
    void rewardSeenLiveAndInBackfillIsLedgeredOnce() {
        processor.applyBlock(CHAIN, 100, List.of(PollLogFixtures.pollCreated(100, tx(1), 0, 1, CREATOR)));
        Log reward = PollLogFixtures.rewardDistributed(120, tx(3), 2, 1, VOTER_B, BigInteger.valueOf(100));

        processor.applyBlock(CHAIN, 120, List.of(reward));
        RangeResult backfill = processor.applyRange(CHAIN, 110, 130, List.of(reward), () -> true);

        assertTrue(backfill.isComplete());
        assertEquals(130, backfill.getLastCompleteBlock());
        assertEquals(1, projection.ledger.size());
        assertEquals("distributed", projection.ledger.values().iterator().next().getEventType());
        assertEquals(0, new BigDecimal(100).compareTo(projection.entry(VOTER_B).getTotalRewards()));
    }

    @Test
    void secondVoteInSamePollDoesNotCountParticipationAgain() {
        processor.applyBlock(CHAIN, 100, List.of(PollLogFixtures.pollCreated(100, tx(1), 0, 1, CREATOR)));
        processor.applyBlock(CHAIN, 101, List.of(
                PollLogFixtures.voted(101, tx(2), 0, 1, VOTER_A, 0),
                PollLogFixtures.voted(101, tx(3), 1, 1, VOTER_A, 1)));

        assertEquals(2, projection.entry(VOTER_A).getTotalVotes());
        assertEquals(1, projection.entry(VOTER_A).getPollsParticipated());
    }

    @Test
    void fullReplayIsIdempotent() {
        List<Log> history = history();

        processor.applyRange(CHAIN, 100, 110, history, () -> true);
        Map<String, String> once = projection.snapshot();
        processor.applyRange(CHAIN, 100, 110, history, () -> true);

        assertEquals(once, projection.snapshot());
        assertEquals(DistributionMode.MANUAL_PUSH, projection.polls.get(CHAIN + ":1").getDistributionMode());
        assertEquals(3, projection.ledger.size());
        assertEquals(0, new BigDecimal(150).compareTo(projection.entry(VOTER_B).getTotalRewards()));
        assertEquals(0, BigDecimal.ZERO.compareTo(projection.entry(CREATOR).getTotalRewards()));
    }

    @Test
    void crashBeforeCheckpointThenFullReprocessMatchesSingleRun() {
        List<Log> history = history();
        InMemoryProjection reference = new InMemoryProjection();
        reference.processor.applyRange(CHAIN, 100, 110, history, () -> true);

        // first N events applied, then the process dies before the checkpoint moves
        int applied = 0;
        for (Log log : history) {
            if (applied++ == 4) {
                break;
            }
            processor.applyBlock(CHAIN, log.getBlockNumber().longValue(), List.of(log));
        }
        processor.applyRange(CHAIN, 100, 110, history, () -> true);

        assertEquals(reference.snapshot(), projection.snapshot());
    }

    @Test
    void decodeErrorDoesNotBlockCheckpoint() {
        processor.applyBlock(CHAIN, 100, List.of(PollLogFixtures.pollCreated(100, tx(1), 0, 1, CREATOR)));

        BlockResult result = processor.applyBlock(CHAIN, 101, List.of(
                PollLogFixtures.unknownEvent(101, tx(2), 0),
                PollLogFixtures.voted(101, tx(2), 1, 1, VOTER_A, 0)));

        assertTrue(result.isCheckpointable());
        assertEquals(1, result.getDecodeErrors());
        assertEquals(1, result.getApplied());
        assertEquals(1, projection.errors.size());
        assertEquals(SyncError.DECODE, projection.errors.get(0).getErrorType());
    }

    @Test
    void handlerErrorBlocksCheckpointButRestOfBlockRuns() {
        processor.applyBlock(CHAIN, 100, List.of(PollLogFixtures.pollCreated(100, tx(1), 0, 1, CREATOR)));
        doThrow(new IllegalStateException("connection reset"))
                .when(projection.pollVoteRepository).save(any(PollVote.class));

        BlockResult result = processor.applyBlock(CHAIN, 101, List.of(
                PollLogFixtures.voted(101, tx(2), 0, 1, VOTER_A, 0),
                PollLogFixtures.rewardDistributed(101, tx(2), 1, 1, VOTER_B, BigInteger.TEN)));

        assertFalse(result.isCheckpointable());
        assertEquals(1, result.getFailed());
        assertEquals(1, result.getApplied());
        assertEquals(1, projection.ledger.size());
        assertEquals(SyncError.HANDLER, projection.errors.get(0).getErrorType());
    }

    @Test
    void repeatedHandlerFailureBumpsRetryCount() {
        processor.applyBlock(CHAIN, 100, List.of(PollLogFixtures.pollCreated(100, tx(1), 0, 1, CREATOR)));
        doThrow(new IllegalStateException("connection reset"))
                .when(projection.pollVoteRepository).save(any(PollVote.class));
        Log vote = PollLogFixtures.voted(101, tx(2), 0, 1, VOTER_A, 0);

        processor.applyBlock(CHAIN, 101, List.of(vote));
        processor.applyBlock(CHAIN, 101, List.of(vote));

        assertEquals(1, projection.errors.size());
        assertEquals(1, projection.errors.get(0).getRetryCount());
    }

    @Test
    void constraintViolationCountsAsAlreadyApplied() {
        processor.applyBlock(CHAIN, 100, List.of(PollLogFixtures.pollCreated(100, tx(1), 0, 1, CREATOR)));
        doThrow(new DataIntegrityViolationException("poll_votes_tx_hash_log_index_key"))
                .when(projection.pollVoteRepository).save(any(PollVote.class));

        BlockResult result = processor.applyBlock(CHAIN, 101,
                List.of(PollLogFixtures.voted(101, tx(2), 0, 1, VOTER_A, 0)));

        assertTrue(result.isCheckpointable());
        assertEquals(1, result.getSkipped());
        assertTrue(projection.errors.isEmpty());
    }

    @Test
    void otherConstraintViolationFailsTheBlock() {
        processor.applyBlock(84532L, 100, List.of(PollLogFixtures.pollCreated(100, tx(1), 0, 1, CREATOR)));
        doThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint "
                + "\"leaderboard_address_key\""))
                .when(projection.leaderboardRepository).accumulate(eq(VOTER_A), any(), anyInt(), anyInt(), anyInt());

        BlockResult result = processor.applyBlock(84532L, 101,
                List.of(PollLogFixtures.voted(101, tx(2), 0, 1, VOTER_A, 0)));

        assertFalse(result.isCheckpointable());
        assertEquals(1, result.getFailed());
        assertEquals(0, result.getSkipped());
        assertEquals(1, projection.errors.size());
        assertEquals(SyncError.HANDLER, projection.errors.get(0).getErrorType());
    }

    @Test
    void naturalKeyConstraintsAreRecognised() {
        assertTrue(PollEventProcessor.isNaturalKeyViolation(new DataIntegrityViolationException(
                "could not execute statement", new RuntimeException("violates \"polls_chain_id_poll_id_key\""))));
        assertTrue(PollEventProcessor.isNaturalKeyViolation(
                new DataIntegrityViolationException("distribution_logs_tx_hash_log_index_key")));
        assertFalse(PollEventProcessor.isNaturalKeyViolation(
                new DataIntegrityViolationException("null value in column \"voter\"")));
    }

    @Test
    void votesFromTwoChainsAccumulateOnSharedAddress() {
        processor.applyBlock(CHAIN, 100, List.of(PollLogFixtures.pollCreated(100, tx(1), 0, 1, CREATOR)));
        processor.applyBlock(84532L, 100, List.of(PollLogFixtures.pollCreated(100, tx(3), 0, 1, CREATOR)));

        processor.applyBlock(CHAIN, 101, List.of(PollLogFixtures.voted(101, tx(2), 0, 1, VOTER_A, 0)));
        processor.applyBlock(84532L, 101, List.of(PollLogFixtures.voted(101, tx(4), 0, 1, VOTER_A, 1)));

        assertEquals(2, projection.entry(VOTER_A).getTotalVotes());
        assertEquals(2, projection.entry(VOTER_A).getPollsParticipated());
        assertEquals(2, projection.entry(CREATOR).getPollsCreated());
    }

    @Test
    void outOfRangeTimestampIsSkippedWithoutHoldingCheckpoint() {
        processor.applyBlock(CHAIN, 100, List.of(PollLogFixtures.pollCreated(100, tx(1), 0, 1, CREATOR)));

        BlockResult result = processor.applyBlock(CHAIN, 102, List.of(PollLogFixtures.rewardDistributed(
                102, tx(5), 0, 1, VOTER_B, BigInteger.TEN, BigInteger.TWO.pow(70))));

        assertTrue(result.isCheckpointable());
        assertEquals(1, result.getDecodeErrors());
        assertEquals(0, result.getFailed());
        assertTrue(projection.ledger.isEmpty());
        assertEquals(SyncError.DECODE, projection.errors.get(0).getErrorType());
    }

    @Test
    void eventsForUnknownPollAreSkipped() {
        BlockResult result = processor.applyBlock(CHAIN, 101, List.of(
                PollLogFixtures.distributionModeSet(101, tx(2), 0, 9, 1),
                PollLogFixtures.rewardClaimed(101, tx(2), 1, 9, VOTER_B, BigInteger.TEN)));

        assertTrue(result.isCheckpointable());
        assertEquals(2, result.getSkipped());
        assertTrue(projection.ledger.isEmpty());
        assertTrue(projection.leaderboard.isEmpty());
    }

    @Test
    void applyRangeStopsAtFirstFailedBlock() {
        doThrow(new IllegalStateException("connection reset"))
                .when(projection.pollVoteRepository).save(any(PollVote.class));
        List<Log> logs = List.of(
                PollLogFixtures.pollCreated(100, tx(1), 0, 1, CREATOR),
                PollLogFixtures.voted(103, tx(2), 0, 1, VOTER_A, 0),
                PollLogFixtures.pollCreated(105, tx(3), 0, 2, CREATOR));

        RangeResult result = processor.applyRange(CHAIN, 100, 110, logs, () -> true);

        assertEquals(102, result.getLastCompleteBlock());
        assertEquals(103, result.getFailedBlock());
        assertEquals(1, projection.polls.size());
    }

    @Test
    void applyRangeHonoursStopBetweenBlocks() {
        List<Log> logs = List.of(
                PollLogFixtures.pollCreated(100, tx(1), 0, 1, CREATOR),
                PollLogFixtures.pollCreated(104, tx(2), 0, 2, CREATOR));
        int[] checks = {0};

        RangeResult result = processor.applyRange(CHAIN, 100, 110, logs, () -> checks[0]++ == 0);

        assertTrue(result.isInterrupted());
        assertEquals(103, result.getLastCompleteBlock());
        assertEquals(1, projection.polls.size());
    }

    private static List<Log> history() {
        List<Log> logs = new ArrayList<>();
        logs.add(PollLogFixtures.pollCreated(100, tx(1), 0, 1, CREATOR));
        logs.add(PollLogFixtures.pollFunded(100, tx(1), 1, 1, CREATOR, 1000));
        logs.add(PollLogFixtures.voted(101, tx(2), 0, 1, VOTER_A, 0));
        logs.add(PollLogFixtures.voted(102, tx(3), 0, 1, VOTER_B, 1));
        logs.add(PollLogFixtures.distributionModeSet(103, tx(4), 0, 1, 1));
        logs.add(PollLogFixtures.rewardDistributed(104, tx(5), 0, 1, VOTER_B, BigInteger.valueOf(100)));
        logs.add(PollLogFixtures.rewardClaimed(105, tx(6), 0, 1, VOTER_B, BigInteger.valueOf(50)));
        logs.add(PollLogFixtures.fundsWithdrawn(106, tx(7), 0, 1, CREATOR, BigInteger.valueOf(850)));
        return logs;
    }
}
