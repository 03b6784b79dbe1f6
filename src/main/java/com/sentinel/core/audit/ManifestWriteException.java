package com.sentinel.core.audit;

import com.sentinel.core.model.RunResult;

/**
 * The audit triple for a run could not be written. Fatal: the run's outcome exists
 * only in this exception's message and needs operator attention.
 */
public class ManifestWriteException extends RuntimeException {

    private final String sentinelTaskId;
    private final RunResult result;

    public ManifestWriteException(String sentinelTaskId, RunResult result, Throwable cause) {
        super("Failed to write audit artifacts for " + sentinelTaskId + " (run result " + result + "): "
                + cause.getMessage(), cause);
        this.sentinelTaskId = sentinelTaskId;
        this.result = result;
    }

    public String sentinelTaskId() {
        return sentinelTaskId;
    }

    public RunResult result() {
        return result;
    }
}
