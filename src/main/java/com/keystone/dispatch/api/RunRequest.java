package com.keystone.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/runs.
 *
 * @param goal              natural-language goal
 * @param runId             caller-chosen id for idempotent re-submission; nullable
 * @param allowDangerousOps bypass the danger gate for this run; nullable, defaults to false
 * @param deadlineSeconds   wall-clock limit for the run's tool calls; nullable
 */
public record RunRequest(
    String goal,
    @JsonProperty("run_id") String runId,
    @JsonProperty("allow_dangerous_ops") Boolean allowDangerousOps,
    @JsonProperty("deadline_seconds") Long deadlineSeconds
) {}
