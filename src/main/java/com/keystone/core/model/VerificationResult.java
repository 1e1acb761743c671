package com.keystone.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Verifier (or human) judgement on an attempt. A REJECT always carries a rationale.
 *
 * @param remediation optional hint for the next attempt (nullable)
 */
public record VerificationResult(Verdict verdict, String rationale, String remediation) implements Serializable {

    public VerificationResult {
        Objects.requireNonNull(verdict, "verdict");
        if (verdict == Verdict.REJECT && (rationale == null || rationale.isBlank())) {
            throw new IllegalArgumentException("REJECT requires a rationale");
        }
        rationale = rationale == null ? "" : rationale;
    }

    public static VerificationResult approve(String rationale) {
        return new VerificationResult(Verdict.APPROVE, rationale, null);
    }

    public static VerificationResult reject(String rationale) {
        return new VerificationResult(Verdict.REJECT, rationale, null);
    }

    public static VerificationResult reject(String rationale, String remediation) {
        return new VerificationResult(Verdict.REJECT, rationale, remediation);
    }

    public static VerificationResult needMoreInfo(String rationale) {
        return new VerificationResult(Verdict.NEED_MORE_INFO, rationale, null);
    }

    /** Rationale with the remediation hint appended, as stored in a node's rejection history. */
    public String fullRationale() {
        if (remediation == null || remediation.isBlank()) {
            return rationale;
        }
        return rationale + " (remediation: " + remediation + ")";
    }
}
