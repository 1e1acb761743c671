package com.keystone.core.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;

/**
 * Resolves the configured Planner, Executor and Verifier implementations by name, and
 * carries the {@link AgentCallGuard} that bounds Planner and Verifier calls.
 */
@Component
public class AgentRoster {

    private static final Logger log = LoggerFactory.getLogger(AgentRoster.class);

    private final Planner planner;
    private final Executor executor;
    private final Verifier verifier;
    private final AgentCallGuard calls;

    @Autowired
    public AgentRoster(List<Planner> planners, List<Executor> executors, List<Verifier> verifiers,
                       AgentProperties properties, AgentCallGuard calls) {
        this.planner = select("planner", planners, Planner::name, properties.getPlanner());
        this.executor = select("executor", executors, Executor::name, properties.getExecutor());
        this.verifier = select("verifier", verifiers, Verifier::name, properties.getVerifier());
        this.calls = calls;
        log.info("Agents: planner={}, executor={}, verifier={}", planner.name(), executor.name(), verifier.name());
    }

    public AgentRoster(Planner planner, Executor executor, Verifier verifier) {
        this(planner, executor, verifier, new AgentCallGuard(AgentCallGuard.DEFAULT_TIMEOUT));
    }

    public AgentRoster(Planner planner, Executor executor, Verifier verifier, AgentCallGuard calls) {
        this.planner = planner;
        this.executor = executor;
        this.verifier = verifier;
        this.calls = calls;
    }

    public Planner planner() {
        return planner;
    }

    public Executor executor() {
        return executor;
    }

    public Verifier verifier() {
        return verifier;
    }

    public AgentCallGuard calls() {
        return calls;
    }

    private static <T> T select(String role, List<T> candidates, Function<T, String> name, String wanted) {
        return candidates.stream()
                .filter(c -> name.apply(c).equals(wanted))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No " + role + " named '" + wanted + "'; available: "
                        + candidates.stream().map(name).toList()));
    }
}
