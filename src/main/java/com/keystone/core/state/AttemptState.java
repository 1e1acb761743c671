package com.keystone.core.state;

import com.keystone.core.memory.StrategyRecord;
import com.keystone.core.model.ResultBundle;
import com.keystone.core.model.TaskConstraints;
import com.keystone.core.model.ToolCallIntent;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for a single attempt at a task node.
 * <p>
 * Holds only serializable values. Live objects an attempt needs (its cancellation token)
 * are looked up through {@link #attemptId()} in {@link AttemptScopes}.
 */
public class AttemptState extends AgentState {

    public static final String ATTEMPT_ID = "attemptId";
    public static final String RUN_ID = "runId";
    public static final String NODE_ID = "nodeId";
    public static final String GOAL = "goal";
    public static final String CONTEXT_STACK = "contextStack";
    public static final String REJECTIONS = "rejections";
    public static final String MEMORY_HITS = "memoryHits";
    public static final String TEMPERATURE = "temperature";
    public static final String SESSION_TOKEN = "sessionToken";
    public static final String CONSTRAINTS = "constraints";
    public static final String STRATEGY = "strategy";
    public static final String INTENTS = "intents";
    public static final String RESULT_BUNDLE = "resultBundle";
    public static final String VERDICT = "verdict";
    public static final String RATIONALE = "rationale";
    public static final String REMEDIATION = "remediation";
    public static final String OUTCOME = "outcome";

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry(ATTEMPT_ID,     Channels.base(() -> "")),
        Map.entry(RUN_ID,         Channels.base(() -> "")),
        Map.entry(NODE_ID,        Channels.base(() -> "")),
        Map.entry(GOAL,           Channels.base(() -> "")),
        Map.entry(CONTEXT_STACK,  Channels.base((Supplier<List<String>>) List::of)),
        Map.entry(REJECTIONS,     Channels.base((Supplier<List<String>>) List::of)),
        Map.entry(MEMORY_HITS,    Channels.base((Supplier<List<StrategyRecord>>) List::of)),
        Map.entry(TEMPERATURE,    Channels.base(() -> 0.1)),
        Map.entry(SESSION_TOKEN,  Channels.base(() -> "")),
        Map.entry(CONSTRAINTS,    Channels.base((Reducer<TaskConstraints>) null)),
        Map.entry(STRATEGY,       Channels.base(() -> "")),
        Map.entry(INTENTS,        Channels.base((Supplier<List<ToolCallIntent>>) List::of)),
        Map.entry(RESULT_BUNDLE,  Channels.base((Reducer<ResultBundle>) null)),
        Map.entry(VERDICT,        Channels.base(() -> "")),
        Map.entry(RATIONALE,      Channels.base(() -> "")),
        Map.entry(REMEDIATION,    Channels.base(() -> "")),
        Map.entry(OUTCOME,        Channels.base(() -> ""))
    );

    public AttemptState(Map<String, Object> initData) {
        super(initData);
    }

    public String attemptId() {
        return this.<String>value(ATTEMPT_ID).orElse("");
    }

    public String runId() {
        return this.<String>value(RUN_ID).orElse("");
    }

    public String nodeId() {
        return this.<String>value(NODE_ID).orElse("");
    }

    public String goal() {
        return this.<String>value(GOAL).orElse("");
    }

    public List<String> contextStack() {
        return this.<List<String>>value(CONTEXT_STACK).orElse(List.of());
    }

    public List<String> rejections() {
        return this.<List<String>>value(REJECTIONS).orElse(List.of());
    }

    public List<StrategyRecord> memoryHits() {
        return this.<List<StrategyRecord>>value(MEMORY_HITS).orElse(List.of());
    }

    public double temperature() {
        return this.<Number>value(TEMPERATURE).map(Number::doubleValue).orElse(0.1);
    }

    public String sessionToken() {
        return this.<String>value(SESSION_TOKEN).filter(s -> !s.isBlank()).orElse(null);
    }

    public TaskConstraints constraints() {
        return this.<TaskConstraints>value(CONSTRAINTS).orElse(TaskConstraints.none());
    }

    public String strategy() {
        return this.<String>value(STRATEGY).orElse("");
    }

    public List<ToolCallIntent> intents() {
        return this.<List<ToolCallIntent>>value(INTENTS).orElse(List.of());
    }

    public Optional<ResultBundle> resultBundle() {
        return value(RESULT_BUNDLE);
    }

    public String rationale() {
        return this.<String>value(RATIONALE).orElse("");
    }

    public String remediation() {
        return this.<String>value(REMEDIATION).filter(s -> !s.isBlank()).orElse(null);
    }

    public Optional<AttemptOutcome> outcome() {
        return this.<String>value(OUTCOME).filter(s -> !s.isBlank()).map(AttemptOutcome::valueOf);
    }

    public boolean isFinished() {
        return outcome().isPresent();
    }
}
