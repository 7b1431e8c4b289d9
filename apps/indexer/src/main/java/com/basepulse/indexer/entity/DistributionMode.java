package com.basepulse.indexer.entity;

/**
 * Reward distribution mode of a poll, indexed by the contract's uint8 value.
 */
public enum DistributionMode {
    MANUAL_PULL,
    MANUAL_PUSH,
    AUTOMATED;

    /**
     * @throws IllegalArgumentException for values the contract does not define
     */
    public static DistributionMode fromOrdinal(int value) {
        DistributionMode[] modes = values();
        if (value < 0 || value >= modes.length) {
            throw new IllegalArgumentException("Unknown distribution mode: " + value);
        }
        return modes[value];
    }
}
