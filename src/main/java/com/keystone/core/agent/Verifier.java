package com.keystone.core.agent;

import com.keystone.core.model.ResultBundle;
import com.keystone.core.model.VerificationResult;

/**
 * Judges whether an attempt's results achieve the goal.
 */
public interface Verifier {

    String name();

    VerificationResult verify(ResultBundle bundle, String goal);
}
