package com.keystone.dispatch.cli;

import com.keystone.core.engine.FatalRunException;
import com.keystone.core.engine.RunEngine;
import com.keystone.core.engine.RunResult;
import com.keystone.core.events.EventBus;
import com.keystone.core.model.RunSnapshot;
import com.keystone.core.model.RunStatus;
import com.keystone.core.model.TaskConstraints;
import com.keystone.core.model.TaskNodeView;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI command: keystone run "&lt;goal&gt;"
 * <p>
 * Runs a goal in this process, printing node transitions as they happen and the final
 * task tree and metrics at the end. Exits 0 only when the root succeeded; an aborted run
 * is rethrown after its tree is printed so {@link CliRunner} maps it to its exit code.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a goal to completion")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Set<String> LIVE_EVENTS = Set.of(
            "node.transition", "node.decomposed", "node.cancelled", "tool.timeout", "approval.requested");

    @Parameters(index = "0", description = "Natural language goal")
    private String goal;

    @Option(names = {"--run-id"}, description = "Run id to use; re-running a finished id returns its cached result")
    private String runId;

    @Option(names = {"--allow-dangerous"},
            description = "Skip the danger gate. Without it, held calls are denied when no approval arrives")
    private boolean allowDangerous;

    @Option(names = {"--deadline"}, description = "Wall-clock limit in seconds for the run's tool calls")
    private Long deadlineSeconds;

    @Option(names = {"--quiet", "-q"}, description = "Only print the final result")
    private boolean quiet;

    private final RunEngine runEngine;
    private final EventBus eventBus;

    public RunCommand(RunEngine runEngine, EventBus eventBus) {
        this.runEngine = runEngine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        String id = runId != null ? runId : runEngine.generateRunId();
        Instant deadline = deadlineSeconds == null ? null : Instant.now().plusSeconds(deadlineSeconds);
        var constraints = new TaskConstraints(deadline, allowDangerous);

        EventBus.Subscription subscription = quiet ? null : eventBus.subscribe(id, LIVE_EVENTS, event -> {
            // the final tree is printed below; skip the terminal event itself
            if (!EventBus.isTerminal(event)) {
                String node = event.nodeId() == null ? "" : event.nodeId() + " ";
                ConsoleOutput.watchEvent(event.eventType(), node + event.payload());
            }
        });

        ConsoleOutput.info("Run " + id + ": " + goal);
        RunResult result;
        try {
            result = runEngine.runToCompletion(goal, id, constraints);
        } catch (FatalRunException e) {
            printTree(runEngine.snapshot(id));
            throw e;
        } catch (IllegalArgumentException | IllegalStateException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        System.out.println();
        printTree(result.snapshot());
        ConsoleOutput.metrics(result.snapshot().metrics());
        if (result.status() == RunStatus.SUCCEEDED) {
            ConsoleOutput.success("Run " + id + " succeeded");
            return 0;
        }
        ConsoleOutput.error("Run " + id + " " + result.status()
                + (result.error() != null ? ": " + result.error() : ""));
        return 1;
    }

    private static void printTree(RunSnapshot snapshot) {
        System.out.println("TASKS:");
        for (TaskNodeView node : snapshot.tree()) {
            ConsoleOutput.node(node.depth(), node.id(), node.status().name(), node.attemptCount(), node.goal());
        }
    }
}
