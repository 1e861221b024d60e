package com.pharmascope.helix.exception;

public class JobNotFoundException extends OrchestrationException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super(ErrorCode.NOT_FOUND, "Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
