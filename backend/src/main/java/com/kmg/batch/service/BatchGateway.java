package com.kmg.batch.service;

import com.kmg.batch.model.BatchPoll;

/**
 * Asynchronous batch inference provider. Every method throws {@link GatewayException} on failure.
 */
public interface BatchGateway {

    /**
     * Uploads a JSONL request file.
     *
     * @return provider file id
     */
    String upload(byte[] content, String fileName);

    /**
     * Submits an uploaded file as a batch.
     *
     * @return provider batch id
     */
    String submitBatch(String fileId, String endpoint, String completionWindow);

    BatchPoll pollBatch(String batchId);

    byte[] fetch(String fileId);
}
