package net.kairos.core.service;

import java.util.NoSuchElementException;

public class JobNotFoundException extends NoSuchElementException {
    private final long jobId;

    public JobNotFoundException(long jobId) {
        super("job not found: " + jobId);
        this.jobId = jobId;
    }

    public long jobId() {
        return jobId;
    }
}
