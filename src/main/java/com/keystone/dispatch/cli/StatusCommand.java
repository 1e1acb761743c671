package com.keystone.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keystone.dispatch.api.RunResponse;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.stream.Stream;

/**
 * CLI command: keystone status &lt;run-id&gt;
 * <p>
 * Fetches a run's snapshot from a running Keystone server and prints its task tree,
 * or follows its SSE stream with {@code --watch}.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check run status on a Keystone server")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    @Option(names = {"--watch", "-w"}, description = "Watch for live updates via SSE")
    private boolean watch;

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    private final ObjectMapper objectMapper;

    public StatusCommand(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (watch) {
            runWatchMode();
        } else {
            printSnapshot();
        }
    }

    private void printSnapshot() {
        URI uri = URI.create("http://localhost:" + port + "/api/v1/runs/" + runId);
        try {
            HttpResponse<String> response = client().send(HttpRequest.newBuilder().uri(uri).GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() == 404) {
                ConsoleOutput.error("Run not found: " + runId);
                return;
            }
            if (response.statusCode() != 200) {
                ConsoleOutput.error("Server returned HTTP " + response.statusCode());
                return;
            }
            print(objectMapper.readValue(response.body(), RunResponse.class));
        } catch (ConnectException e) {
            notReachable();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
        } catch (Exception e) {
            ConsoleOutput.error("Status failed: " + e.getMessage());
        }
    }

    static void print(RunResponse run) {
        System.out.println();
        System.out.println("RUN " + run.runId() + " (version " + run.version() + ")");
        System.out.println("Goal: " + run.goal());
        switch (run.status()) {
            case "SUCCEEDED" -> ConsoleOutput.success("Status: " + run.status());
            case "FAILED", "ABORTED", "CANCELLED" -> ConsoleOutput.error("Status: " + run.status()
                    + (run.error() != null ? " (" + run.error() + ")" : ""));
            default -> ConsoleOutput.info("Status: " + run.status()
                    + (run.activeNode() != null ? ", working on node " + run.activeNode() : ""));
        }
        System.out.println();
        for (RunResponse.NodeResponse node : run.nodes()) {
            ConsoleOutput.node(node.depth(), node.id(), node.status(), node.attemptCount(), node.goal());
        }
        if (run.metrics() != null) {
            ConsoleOutput.metrics(run.metrics());
        }
    }

    private void runWatchMode() {
        ConsoleOutput.info("Watching run " + runId + " (connecting to localhost:" + port + ")...");
        System.out.println();

        URI uri = URI.create("http://localhost:" + port + "/api/v1/runs/" + runId + "/events");
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(uri)
                    .header("Accept", "text/event-stream")
                    .GET()
                    .build();
            HttpResponse<Stream<String>> response = client().send(request, HttpResponse.BodyHandlers.ofLines());

            if (response.statusCode() == 404) {
                ConsoleOutput.error("Run not found: " + runId);
                return;
            }
            if (response.statusCode() != 200) {
                ConsoleOutput.error("Server returned HTTP " + response.statusCode());
                return;
            }

            final String[] currentEventType = {""};
            response.body().forEach(line -> {
                if (line.startsWith("event:")) {
                    currentEventType[0] = line.substring(6).trim();
                } else if (line.startsWith("data:")) {
                    String data = line.substring(5).trim();
                    String eventType = currentEventType[0].isEmpty() ? "message" : currentEventType[0];
                    ConsoleOutput.watchEvent(eventType,
                            "run.snapshot".equals(eventType) ? ConsoleOutput.truncate(data, 120) : data);
                    currentEventType[0] = "";
                }
            });

            System.out.println();
            ConsoleOutput.info("Stream ended.");
        } catch (ConnectException e) {
            notReachable();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Watch interrupted.");
        } catch (Exception e) {
            ConsoleOutput.error("Watch failed: " + e.getMessage());
        }
    }

    private void notReachable() {
        ConsoleOutput.error("Cannot connect to Keystone server at localhost:" + port);
        ConsoleOutput.info("Start the server first: keystone serve");
    }

    private static HttpClient client() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }
}
