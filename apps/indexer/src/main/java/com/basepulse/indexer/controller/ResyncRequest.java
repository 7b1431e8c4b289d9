package com.basepulse.indexer.controller;

import lombok.Data;

/**
 * Body of {@code POST /api/sync/resync}.
 */
@Data
public class ResyncRequest {

    private Long chainId;
    private Long fromBlock;
    /** Optional; defaults to the chain head when the job runs */
    private Long toBlock;
}
