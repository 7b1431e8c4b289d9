package com.basepulse.indexer.service;

public enum LeaderboardMetric {
    REWARDS,
    VOTES,
    POLLS_CREATED,
    PARTICIPATION
}
