package com.basepulse.indexer.controller;

import com.basepulse.indexer.sync.ChainSyncManager;
import com.basepulse.indexer.sync.ChainSyncStatus;
import com.basepulse.indexer.sync.ResyncJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Operational endpoints for chain sync: status and historical resync.
 */
@Slf4j
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
public class SyncController {

    private final ChainSyncManager chainSyncManager;

    /**
     * Replay a block range through the event handlers without moving the checkpoint.
     *
     * POST /api/sync/resync {"chainId": 8453, "fromBlock": 100, "toBlock": 200}
     */
    @PostMapping("/resync")
    public ResponseEntity<Map<String, Object>> resync(@RequestBody ResyncRequest request) {
        log.info("Received resync request: {}", request);
        if (request.getChainId() == null || request.getFromBlock() == null) {
            throw new IllegalArgumentException("chainId and fromBlock are required");
        }

        ResyncJob job = chainSyncManager.resync(request.getChainId(), request.getFromBlock(), request.getToBlock());

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "Resync accepted");
        response.put("job", toJobView(job));
        response.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    /**
     * GET /api/sync/resync/{jobId}
     */
    @GetMapping("/resync/{jobId}")
    public ResponseEntity<Map<String, Object>> getResyncJob(@PathVariable String jobId) {
        return chainSyncManager.getJob(jobId)
                .map(job -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("job", toJobView(job));
                    response.put("timestamp", System.currentTimeMillis());
                    return ResponseEntity.ok(response);
                })
                .orElseGet(() -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", false);
                    response.put("message", "Unknown resync job " + jobId);
                    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
                });
    }

    /**
     * GET /api/sync/status
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getSyncStatus() {
        List<ChainSyncStatus> chains = chainSyncManager.statuses();

        Map<String, Object> response = new HashMap<>();
        response.put("chains", chains);
        response.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(response);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        log.warn("Rejected sync request: {}", e.getMessage());
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", e.getMessage());
        return ResponseEntity.badRequest().body(response);
    }

    private static Map<String, Object> toJobView(ResyncJob job) {
        Map<String, Object> view = new HashMap<>();
        view.put("id", job.getId());
        view.put("chainId", job.getChainId());
        view.put("fromBlock", job.getFromBlock());
        view.put("toBlock", job.getToBlock());
        view.put("status", job.getStatus());
        view.put("submittedAt", job.getSubmittedAt());
        if (job.getResult() != null) {
            view.put("result", job.getResult());
        }
        if (job.getError() != null) {
            view.put("error", job.getError());
        }
        return view;
    }
}
