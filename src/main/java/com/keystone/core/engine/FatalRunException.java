package com.keystone.core.engine;

/**
 * Unrecoverable run failure: graph corruption or resource exhaustion. The run is aborted
 * and its state dumped to the audit log. The only failure surfaced to callers.
 */
public class FatalRunException extends RuntimeException {

    private final String runId;

    public FatalRunException(String runId, String message) {
        super(message);
        this.runId = runId;
    }

    public FatalRunException(String runId, String message, Throwable cause) {
        super(message, cause);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
