package com.keystone.core.graph;

import com.keystone.core.concurrent.CancellationToken;
import com.keystone.core.nodes.ExecuteNode;
import com.keystone.core.nodes.PlanNode;
import com.keystone.core.nodes.VerifyNode;
import com.keystone.core.state.AttemptScopes;
import com.keystone.core.state.AttemptState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} for one attempt at a task node:
 * <pre>
 *   START → plan → execute → verify → END
 * </pre>
 * Planning is skipped when the node already has a strategy. A phase that settles the attempt
 * early (agent failure, danger-gate denial, cancellation) routes straight to END.
 */
@Component
public class AttemptGraph {

    private static final Logger log = LoggerFactory.getLogger(AttemptGraph.class);

    private final CompiledGraph<AttemptState> compiledGraph;
    private final AttemptScopes scopes;

    public AttemptGraph(PlanNode planNode, ExecuteNode executeNode, VerifyNode verifyNode,
                        AttemptScopes scopes) throws GraphStateException {
        this.scopes = scopes;
        var graph = new StateGraph<>(AttemptState.SCHEMA, AttemptState::new)
                .addNode("plan", node_async(planNode::apply))
                .addNode("execute", node_async(executeNode::apply))
                .addNode("verify", node_async(verifyNode::apply))
                .addEdge(START, "plan")
                .addConditionalEdges("plan",
                        edge_async(state -> routeAfter(state, "execute")),
                        Map.of("execute", "execute", "end", END))
                .addConditionalEdges("execute",
                        edge_async(state -> routeAfter(state, "verify")),
                        Map.of("verify", "verify", "end", END))
                .addEdge("verify", END);
        this.compiledGraph = graph.compile();
        log.info("Attempt graph compiled");
    }

    /**
     * Runs one attempt to completion.
     *
     * @param inputs initial state values; see {@link AttemptState} keys
     * @param token  cancels the attempt's agent and tool calls
     * @return the final attempt state
     */
    public AttemptState run(Map<String, Object> inputs, CancellationToken token) {
        String attemptId = UUID.randomUUID().toString();
        Map<String, Object> initial = new HashMap<>(inputs);
        initial.put(AttemptState.ATTEMPT_ID, attemptId);
        scopes.open(attemptId, token);
        try {
            var config = RunnableConfig.builder()
                    .threadId(attemptId)
                    .build();
            return compiledGraph.invoke(initial, config)
                    .orElseThrow(() -> new IllegalStateException("Attempt graph produced no final state"));
        } finally {
            scopes.close(attemptId);
        }
    }

    static String routeAfter(AttemptState state, String next) {
        return state.isFinished() ? "end" : next;
    }
}
