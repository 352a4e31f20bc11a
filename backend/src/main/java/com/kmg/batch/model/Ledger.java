package com.kmg.batch.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered collection of all jobs of one processing run. The single source of truth for the run;
 * every mutation is persisted by {@code LedgerRepository#save}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Ledger {
    private OffsetDateTime lastUpdated;
    private String recordsFile;
    private List<BatchJob> jobs = new ArrayList<>();
    @JsonIgnore
    private Path location;

    public Ledger() {
    }

    public Ledger(Path location) {
        this.location = location;
    }

    public Optional<BatchJob> findJob(String name) {
        return jobs.stream().filter(job -> job.getName().equals(name)).findFirst();
    }

    /**
     * Appends the job unless one with the same name is already present.
     *
     * @return true when the job was added
     */
    public boolean addIfAbsent(BatchJob job) {
        if (findJob(job.getName()).isPresent()) {
            return false;
        }
        jobs.add(job);
        return true;
    }

    @JsonProperty(value = "total_jobs", access = JsonProperty.Access.READ_ONLY)
    public int getTotalJobs() {
        return jobs.size();
    }

    public OffsetDateTime getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(OffsetDateTime lastUpdated) {
        this.lastUpdated = lastUpdated;
    }

    /**
     * Record table the jobs were planned against, so later rounds can run without naming it again.
     */
    public String getRecordsFile() {
        return recordsFile;
    }

    public void setRecordsFile(String recordsFile) {
        this.recordsFile = recordsFile;
    }

    public List<BatchJob> getJobs() {
        return jobs;
    }

    public void setJobs(List<BatchJob> jobs) {
        this.jobs = new ArrayList<>(jobs);
    }

    public Path getLocation() {
        return location;
    }

    public void setLocation(Path location) {
        this.location = location;
    }
}
