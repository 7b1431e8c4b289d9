package com.basepulse.indexer.sync;

import lombok.Getter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * An operator-submitted replay and its progress.
 */
@Getter
public class ResyncJob {

    public enum Status {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED
    }

    private final String id = UUID.randomUUID().toString();
    private final Long chainId;
    private final long fromBlock;
    /** Null means the head at the time the job runs */
    private final Long toBlock;
    private final LocalDateTime submittedAt = LocalDateTime.now();

    private volatile Status status = Status.PENDING;
    private volatile ResyncResult result;
    private volatile String error;
    private volatile LocalDateTime finishedAt;

    public ResyncJob(Long chainId, long fromBlock, Long toBlock) {
        this.chainId = chainId;
        this.fromBlock = fromBlock;
        this.toBlock = toBlock;
    }

    void markRunning() {
        status = Status.RUNNING;
    }

    void complete(ResyncResult result) {
        this.result = result;
        this.finishedAt = LocalDateTime.now();
        this.status = Status.COMPLETED;
    }

    void fail(Throwable cause) {
        this.error = cause.getMessage();
        this.finishedAt = LocalDateTime.now();
        this.status = Status.FAILED;
    }

    public boolean isDone() {
        return status == Status.COMPLETED || status == Status.FAILED;
    }
}
