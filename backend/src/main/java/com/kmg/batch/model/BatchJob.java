package com.kmg.batch.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.stream.IntStream;

/**
 * One chunk of record indices submitted to the provider as a single batch.
 * <p>
 * Contiguous jobs cover {@code [startIndex, endIndex)}. Jobs planned over an arbitrary index set
 * additionally carry {@code indices}; the bounds are then the smallest index and one past the largest.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BatchJob {
    private String name;
    private int startIndex;
    private int endIndex;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<Integer> indices;
    private JobStatus status = JobStatus.PENDING;
    private int attempts;
    private int maxAttempts;
    private String errorMessage = "";
    private FailureCategory failureCategory;
    private String providerBatchId = "";
    private String resultFile;
    private String errorFile;
    private OffsetDateTime createdAt;
    private OffsetDateTime completedAt;

    public BatchJob() {
    }

    public BatchJob(String name, int startIndex, int endIndex, int maxAttempts, OffsetDateTime createdAt) {
        if (startIndex < 0 || startIndex >= endIndex) {
            throw new IllegalArgumentException(
                    "Job " + name + " needs 0 <= start < end, got [" + startIndex + ", " + endIndex + ")");
        }
        this.name = name;
        this.startIndex = startIndex;
        this.endIndex = endIndex;
        this.maxAttempts = maxAttempts;
        this.createdAt = createdAt;
    }

    public static BatchJob forIndices(String name, List<Integer> indices, int maxAttempts, OffsetDateTime createdAt) {
        if (indices.isEmpty()) {
            throw new IllegalArgumentException("Job " + name + " needs at least one index");
        }
        List<Integer> sorted = indices.stream().distinct().sorted().toList();
        BatchJob job = new BatchJob(name, sorted.get(0), sorted.get(sorted.size() - 1) + 1, maxAttempts, createdAt);
        job.indices = sorted;
        return job;
    }

    /**
     * Record indices this job covers, ascending.
     */
    @JsonIgnore
    public List<Integer> coveredIndices() {
        if (indices != null) {
            return indices;
        }
        return IntStream.range(startIndex, endIndex).boxed().toList();
    }

    @JsonIgnore
    public boolean isExhausted() {
        return attempts >= maxAttempts;
    }

    @JsonIgnore
    public boolean canAttempt() {
        return status != JobStatus.COMPLETED && !isExhausted();
    }

    @JsonIgnore
    public String rowRangeLabel() {
        return (startIndex + 1) + "-" + endIndex;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getStartIndex() {
        return startIndex;
    }

    public void setStartIndex(int startIndex) {
        this.startIndex = startIndex;
    }

    public int getEndIndex() {
        return endIndex;
    }

    public void setEndIndex(int endIndex) {
        this.endIndex = endIndex;
    }

    public List<Integer> getIndices() {
        return indices;
    }

    public void setIndices(List<Integer> indices) {
        this.indices = indices;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public FailureCategory getFailureCategory() {
        return failureCategory;
    }

    public void setFailureCategory(FailureCategory failureCategory) {
        this.failureCategory = failureCategory;
    }

    public String getProviderBatchId() {
        return providerBatchId;
    }

    public void setProviderBatchId(String providerBatchId) {
        this.providerBatchId = providerBatchId;
    }

    public String getResultFile() {
        return resultFile;
    }

    public void setResultFile(String resultFile) {
        this.resultFile = resultFile;
    }

    public String getErrorFile() {
        return errorFile;
    }

    public void setErrorFile(String errorFile) {
        this.errorFile = errorFile;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(OffsetDateTime completedAt) {
        this.completedAt = completedAt;
    }

    @Override
    public String toString() {
        return name + "[" + startIndex + "," + endIndex + ") " + status + " attempts=" + attempts + "/" + maxAttempts;
    }
}
