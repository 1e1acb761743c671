package com.keystone.dispatch.cli;

import com.keystone.broker.ToolBroker;
import com.keystone.broker.ToolServerConfig;
import com.keystone.core.agent.AgentProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: keystone serve
 * <p>
 * Starts Keystone as a long-running HTTP server. {@link com.keystone.KeystoneApplication}
 * enables the web server when {@link CliRunner#isServe} matches; picocli is skipped, and
 * the banner below is printed once the port is bound.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 keystone serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Keystone HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    private final ToolBroker toolBroker;
    private final AgentProperties agents;

    public ServeCommand(ToolBroker toolBroker, AgentProperties agents) {
        this.toolBroker = toolBroker;
        this.agents = agents;
    }

    @Override
    public void run() {
        // only reached for --help style invocations
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    void printBanner(int boundPort) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Keystone server running on port " + boundPort);
        System.out.println();
        System.out.println("  Runs:       http://localhost:" + boundPort + "/api/v1/runs");
        System.out.println("  Approvals:  http://localhost:" + boundPort + "/api/v1/approvals");
        System.out.println("  Health:     http://localhost:" + boundPort + "/api/v1/health");
        System.out.println();
        System.out.println("  Agents:     planner=" + agents.getPlanner() + ", executor=" + agents.getExecutor()
                + ", verifier=" + agents.getVerifier());
        System.out.println("  Tools:      " + describe(toolBroker.servers()));
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    static String describe(List<ToolServerConfig> servers) {
        if (servers.isEmpty()) {
            return "none configured";
        }
        var parts = servers.stream()
                .map(s -> s.serverId() + " (" + s.transport().name().toLowerCase()
                        + (s.enabled() ? "" : ", disabled") + ")")
                .toList();
        return String.join(", ", parts);
    }
}
