package com.keystone.core.engine;

import com.keystone.core.model.RunSnapshot;
import com.keystone.core.model.RunStatus;

/**
 * Final outcome of a run.
 *
 * @param error failure message for aborted runs (nullable)
 */
public record RunResult(String runId, RunStatus status, RunSnapshot snapshot, String error) {

    public boolean succeeded() {
        return status == RunStatus.SUCCEEDED;
    }
}
