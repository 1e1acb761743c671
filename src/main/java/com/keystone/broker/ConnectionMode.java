package com.keystone.broker;

public enum ConnectionMode {
    /** One long-lived connection per server, evicted after an idle TTL or a remote failure. */
    POOLED,
    /** A fresh connection for every call, closed afterwards. */
    SPAWN_PER_CALL
}
