package com.basepulse.indexer.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SyncPropertiesTest {

    @Test
    void chunkSizeFallsBackToDefaultAndIsCapped() {
        SyncProperties properties = new SyncProperties();
        assertEquals(2000, properties.resolveChunkSize());

        properties.setChunkSize(0);
        assertEquals(SyncProperties.DEFAULT_CHUNK_SIZE, properties.resolveChunkSize());

        properties.setChunkSize(50_000);
        assertEquals(SyncProperties.MAX_CHUNK_SIZE, properties.resolveChunkSize());

        properties.setChunkSize(3);
        assertEquals(3, properties.resolveChunkSize());
    }
}
