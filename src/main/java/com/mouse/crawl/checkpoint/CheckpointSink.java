package com.mouse.crawl.checkpoint;

import com.mouse.crawl.model.Checkpoint;

/**
 * Fire-and-forget progress persistence. Implementations log failures and never throw.
 */
public interface CheckpointSink {

    void saveCheckpoint(String runId, Checkpoint checkpoint);
}
