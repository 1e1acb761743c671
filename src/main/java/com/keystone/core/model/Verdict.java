package com.keystone.core.model;

public enum Verdict {
    APPROVE,
    REJECT,
    NEED_MORE_INFO
}
