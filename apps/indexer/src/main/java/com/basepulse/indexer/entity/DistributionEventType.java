package com.basepulse.indexer.entity;

public enum DistributionEventType {
    DISTRIBUTED("distributed"),
    CLAIMED("claimed"),
    WITHDRAWN("withdrawn");

    private final String value;

    DistributionEventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
