package com.basepulse.indexer.service;

import com.basepulse.indexer.entity.DistributionLog;
import com.basepulse.indexer.entity.LeaderboardEntry;
import com.basepulse.indexer.entity.Poll;
import com.basepulse.indexer.repository.DistributionLogRepository;
import com.basepulse.indexer.repository.LeaderboardRepository;
import com.basepulse.indexer.repository.PollRepository;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ProjectionQueryServiceTest {

    private final PollRepository pollRepository = mock(PollRepository.class);
    private final DistributionLogRepository distributionLogRepository = mock(DistributionLogRepository.class);
    private final LeaderboardRepository leaderboardRepository = mock(LeaderboardRepository.class);
    private final ProjectionQueryService service =
            new ProjectionQueryService(pollRepository, distributionLogRepository, leaderboardRepository);

    @Test
    void unknownAddressGetsZeroStats() {
        when(leaderboardRepository.findByAddress("0xabc")).thenReturn(Optional.empty());

        LeaderboardEntry stats = service.userStats("0xABC");

        assertEquals("0xabc", stats.getAddress());
        assertEquals(BigDecimal.ZERO, stats.getTotalRewards());
        assertEquals(0, stats.getTotalVotes());
        assertEquals(0, stats.getPollsParticipated());
        assertEquals(0, stats.getPollsCreated());
        assertTrue(service.rankByRewards("0xabc").isEmpty());
    }

    @Test
    void rankCountsAddressesWithMoreRewards() {
        LeaderboardEntry entry = LeaderboardEntry.empty("0xabc");
        entry.setTotalRewards(new BigDecimal(500));
        when(leaderboardRepository.findByAddress("0xabc")).thenReturn(Optional.of(entry));
        when(leaderboardRepository.countByTotalRewardsGreaterThan(new BigDecimal(500))).thenReturn(2L);

        assertEquals(Optional.of(3L), service.rankByRewards("0xAbC"));
    }

    @Test
    void topClampsLimit() {
        when(leaderboardRepository.findAllByOrderByTotalVotesDesc(any(Pageable.class))).thenReturn(List.of());

        service.top(LeaderboardMetric.VOTES, 0, 10_000);

        ArgumentCaptor<Pageable> captor = ArgumentCaptor.forClass(Pageable.class);
        verify(leaderboardRepository).findAllByOrderByTotalVotesDesc(captor.capture());
        assertEquals(ProjectionQueryService.MAX_LIMIT, captor.getValue().getPageSize());
        assertEquals(ProjectionQueryService.DEFAULT_LIMIT, ProjectionQueryService.clampLimit(0));
    }

    @Test
    void distributionsForUnknownPollAreEmpty() {
        when(pollRepository.findByChainIdAndPollId(8453L, 9L)).thenReturn(Optional.empty());

        assertTrue(service.distributionsForPoll(8453L, 9L).isEmpty());
        verifyNoInteractions(distributionLogRepository);
    }

    @Test
    void distributionsAreLookedUpByPollRowId() {
        Poll poll = new Poll();
        poll.setId(42L);
        DistributionLog row = new DistributionLog();
        when(pollRepository.findByChainIdAndPollId(8453L, 1L)).thenReturn(Optional.of(poll));
        when(distributionLogRepository.findByPollIdOrderByBlockNumberAscLogIndexAsc(42L)).thenReturn(List.of(row));

        assertEquals(List.of(row), service.distributionsForPoll(8453L, 1L));
    }

    @Test
    void blankAddressIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.userStats(" "));
    }
}
