package com.keystone.core.agent;

/**
 * Structured LLM output for a verification.
 *
 * @param verdict APPROVE, REJECT or NEED_MORE_INFO
 */
public record VerdictDraft(String verdict, String rationale, String remediation) {}
