package com.keystone.core.state;

/**
 * How one Plan → Execute → Verify attempt ended.
 */
public enum AttemptOutcome {
    APPROVED,
    REJECTED,
    NEED_MORE_INFO,
    /** The danger gate denied a call; the node is abandoned without retry. */
    ABORTED,
    CANCELLED
}
