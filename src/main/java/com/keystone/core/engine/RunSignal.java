package com.keystone.core.engine;

import com.keystone.core.model.VerificationResult;

/**
 * Message posted into a run's inbox from outside the run loop.
 *
 * @param feedback the injected judgement, for {@link Kind#FEEDBACK} only
 */
public record RunSignal(Kind kind, String nodeId, VerificationResult feedback) {

    public enum Kind { CANCEL, FEEDBACK }

    public static RunSignal cancel(String nodeId) {
        return new RunSignal(Kind.CANCEL, nodeId, null);
    }

    public static RunSignal feedback(String nodeId, VerificationResult feedback) {
        return new RunSignal(Kind.FEEDBACK, nodeId, feedback);
    }
}
