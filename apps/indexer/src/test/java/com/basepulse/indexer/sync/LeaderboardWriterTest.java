package com.basepulse.indexer.sync;

import com.basepulse.indexer.repository.LeaderboardRepository;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class LeaderboardWriterTest {

    private final LeaderboardRepository repository = mock(LeaderboardRepository.class);
    private final LeaderboardWriter writer = new LeaderboardWriter(repository);

    @Test
    void rewardsBeyondLongRangeArePassedExactly() {
        writer.addRewards("0xBB", BigInteger.valueOf(Long.MAX_VALUE).multiply(BigInteger.TWO));

        verify(repository).accumulate("0xbb", new BigDecimal("18446744073709551614"), 0, 0, 0);
    }

    @Test
    void firstVoteCountsParticipation() {
        writer.incrementVotes("0xAA", true);
        writer.incrementVotes("0xAA", false);

        verify(repository).accumulate("0xaa", BigDecimal.ZERO, 1, 1, 0);
        verify(repository).accumulate("0xaa", BigDecimal.ZERO, 0, 1, 0);
    }

    @Test
    void pollCreationIncrementsCreatorOnly() {
        writer.incrementPollsCreated("0xC1");

        verify(repository).accumulate("0xc1", BigDecimal.ZERO, 0, 0, 1);
    }

    @Test
    void negativeRewardIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> writer.addRewards("0xbb", BigInteger.valueOf(-1)));
        verify(repository, never()).accumulate(anyString(), any(), anyInt(), anyInt(), anyInt());
    }
}
