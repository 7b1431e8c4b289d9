package com.basepulse.indexer.controller;

import com.basepulse.indexer.sync.ChainSyncManager;
import com.basepulse.indexer.sync.ChainSyncStatus;
import com.basepulse.indexer.sync.ResyncJob;
import com.basepulse.indexer.sync.SyncState;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SyncControllerTest {

    private final ChainSyncManager manager = mock(ChainSyncManager.class);
    private final MockMvc mockMvc = MockMvcBuilders.standaloneSetup(new SyncController(manager)).build();

    @Test
    void resyncIsAccepted() throws Exception {
        ResyncJob job = new ResyncJob(8453L, 100L, 200L);
        when(manager.resync(8453L, 100L, 200L)).thenReturn(job);

        mockMvc.perform(post("/api/sync/resync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"chainId\":8453,\"fromBlock\":100,\"toBlock\":200}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.job.id").value(job.getId()))
                .andExpect(jsonPath("$.job.status").value("PENDING"));

        verify(manager).resync(8453L, 100L, 200L);
    }

    @Test
    void resyncWithoutToBlockDefaultsToHead() throws Exception {
        when(manager.resync(8453L, 100L, null)).thenReturn(new ResyncJob(8453L, 100L, null));

        mockMvc.perform(post("/api/sync/resync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"chainId\":8453,\"fromBlock\":100}"))
                .andExpect(status().isAccepted());

        verify(manager).resync(8453L, 100L, null);
    }

    @Test
    void invalidRangeIsBadRequest() throws Exception {
        when(manager.resync(8453L, 200L, 100L))
                .thenThrow(new IllegalArgumentException("toBlock 100 is before fromBlock 200"));

        mockMvc.perform(post("/api/sync/resync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"chainId\":8453,\"fromBlock\":200,\"toBlock\":100}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("toBlock 100 is before fromBlock 200"));
    }

    @Test
    void missingFieldsAreBadRequest() throws Exception {
        mockMvc.perform(post("/api/sync/resync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fromBlock\":100}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(manager);
    }

    @Test
    void statusListsChains() throws Exception {
        when(manager.statuses()).thenReturn(List.of(ChainSyncStatus.builder()
                .chainId(8453L)
                .name("Base")
                .state(SyncState.LIVE)
                .checkpoint(510L)
                .head(512L)
                .build()));

        mockMvc.perform(get("/api/sync/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chains[0].chainId").value(8453))
                .andExpect(jsonPath("$.chains[0].state").value("LIVE"))
                .andExpect(jsonPath("$.chains[0].checkpoint").value(510));
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        when(manager.getJob("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/sync/resync/nope"))
                .andExpect(status().isNotFound());
    }
}
