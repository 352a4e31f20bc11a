package com.kmg.batch.service;

import com.kmg.batch.config.BatchProperties;
import com.kmg.batch.model.BatchPoll;
import com.kmg.batch.model.RequestCounts;
import com.kmg.batch.model.SubmissionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Drives one provider batch from upload to downloaded results: upload, submit, poll until the
 * batch settles, then fetch the output and error files.
 */
@Service
public class BatchSubmissionService {
    private static final Logger log = LoggerFactory.getLogger(BatchSubmissionService.class);
    private static final int ERROR_PREVIEW_CHARS = 500;

    private final BatchGateway gateway;
    private final BatchProperties properties;
    private final Sleeper sleeper;

    public BatchSubmissionService(BatchGateway gateway, BatchProperties properties, Sleeper sleeper) {
        this.gateway = gateway;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    /**
     * Submits {@code jsonl} and blocks until the batch completes. {@code onBatchId} receives the
     * provider batch id as soon as it is known.
     *
     * @throws GatewayException when any step fails or the batch ends in a non-completed state
     */
    public SubmissionResult submit(String jobName, byte[] jsonl, Path runDir, Consumer<String> onBatchId) {
        BatchProperties.Provider provider = properties.getProvider();

        String fileId = gateway.upload(jsonl, jobName + "_requests.jsonl");
        log.info("[{}] uploaded request file {} ({} bytes)", jobName, fileId, jsonl.length);

        String batchId = gateway.submitBatch(fileId, provider.getEndpoint(), provider.getCompletionWindow());
        log.info("[{}] submitted batch {}", jobName, batchId);
        onBatchId.accept(batchId);

        BatchPoll poll = awaitTerminal(jobName, batchId);
        switch (poll.status()) {
            case FAILED -> throw new GatewayException(GatewayFailure.BATCH_FAILED, failureMessage(jobName, poll));
            case EXPIRED -> throw new GatewayException(GatewayFailure.BATCH_EXPIRED,
                    "Batch " + batchId + " expired before completion");
            case CANCELLED -> throw new GatewayException(GatewayFailure.BATCH_CANCELLED,
                    "Batch " + batchId + " was cancelled");
            default -> {
            }
        }

        if (!poll.hasOutputFile()) {
            throw new GatewayException(GatewayFailure.DOWNLOAD,
                    "Batch " + batchId + " completed without an output file");
        }

        Path resultFile = runDir.resolve("batch_results_" + jobName + "_" + batchId + ".jsonl");
        write(resultFile, gateway.fetch(poll.outputFileId()));
        log.info("[{}] downloaded results to {}", jobName, resultFile);

        Path errorFile = null;
        if (poll.hasErrorFile()) {
            errorFile = runDir.resolve("batch_errors_" + jobName + "_" + batchId + ".jsonl");
            try {
                write(errorFile, gateway.fetch(poll.errorFileId()));
                log.warn("[{}] batch reported per-request errors, saved to {}", jobName, errorFile);
            } catch (GatewayException e) {
                log.warn("[{}] could not download error file {}: {}", jobName, poll.errorFileId(), e.getMessage());
                errorFile = null;
            }
        }

        return new SubmissionResult(batchId, resultFile, errorFile, poll.counts());
    }

    private BatchPoll awaitTerminal(String jobName, String batchId) {
        while (true) {
            BatchPoll poll = gateway.pollBatch(batchId);
            RequestCounts counts = poll.counts();
            log.info("[{}] batch {} is {} ({}/{} completed, {} failed)", jobName, batchId,
                    poll.status(), counts.completed(), counts.total(), counts.failed());
            if (poll.status().isTerminal()) {
                return poll;
            }
            try {
                sleeper.sleep(properties.getProvider().getPollInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new GatewayException(GatewayFailure.INTERRUPTED, "Interrupted while polling batch " + batchId, e);
            }
        }
    }

    private String failureMessage(String jobName, BatchPoll poll) {
        StringBuilder message = new StringBuilder("Batch ").append(poll.batchId()).append(" failed");
        if (!poll.errors().isEmpty()) {
            message.append(": ").append(String.join("; ", poll.errors()));
        }
        if (poll.hasErrorFile()) {
            try {
                String preview = new String(gateway.fetch(poll.errorFileId()), StandardCharsets.UTF_8);
                if (preview.length() > ERROR_PREVIEW_CHARS) {
                    preview = preview.substring(0, ERROR_PREVIEW_CHARS) + "...";
                }
                message.append(" | error file: ").append(preview.strip());
            } catch (GatewayException e) {
                log.warn("[{}] could not read error file {}: {}", jobName, poll.errorFileId(), e.getMessage());
            }
        }
        return message.toString();
    }

    private void write(Path file, byte[] content) {
        try {
            Files.createDirectories(file.getParent());
            Files.write(file, content);
        } catch (IOException e) {
            throw new GatewayException(GatewayFailure.DOWNLOAD, "Failed to save " + file + ": " + e.getMessage(), e);
        }
    }
}
