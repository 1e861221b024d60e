package com.pharmascope.helix.exception;

import com.pharmascope.helix.domain.model.JobStatus;

/**
 * Report requested before the job settled.
 */
public class JobNotReadyException extends OrchestrationException {

    private final JobStatus status;

    public JobNotReadyException(String jobId, JobStatus status) {
        super(ErrorCode.NOT_READY, "Job " + jobId + " is still " + status);
        this.status = status;
    }

    public JobStatus getStatus() {
        return status;
    }
}
