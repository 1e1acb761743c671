package com.keystone.dispatch.cli;

import com.keystone.broker.ToolBroker;
import com.keystone.broker.ToolDescriptor;
import com.keystone.broker.ToolServerConfig;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * CLI command: keystone tools
 * <p>
 * Lists configured tool servers and the tools each one advertises.
 */
@Command(name = "tools", mixinStandardHelpOptions = true, description = "List tool servers and their tools")
@Component
public class ToolsCommand implements Runnable {

    @Option(names = {"--verbose", "-v"}, description = "Show tool descriptions and parameters")
    private boolean verbose;

    private final ToolBroker toolBroker;

    public ToolsCommand(ToolBroker toolBroker) {
        this.toolBroker = toolBroker;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<ToolServerConfig> servers = toolBroker.servers();
        if (servers.isEmpty()) {
            ConsoleOutput.error("No tool servers configured (keystone.tools.servers)");
            return;
        }

        Map<String, List<ToolDescriptor>> byServer = toolBroker.catalog().stream()
                .collect(Collectors.groupingBy(ToolDescriptor::serverId));
        for (ToolServerConfig server : servers) {
            String header = server.serverId() + " (" + server.transport() + ", " + server.connectionMode() + ")";
            if (!server.enabled()) {
                ConsoleOutput.info(header + " disabled");
                continue;
            }
            List<ToolDescriptor> tools = byServer.getOrDefault(server.serverId(), List.of());
            if (tools.isEmpty()) {
                ConsoleOutput.error(header + " advertised no tools or is unreachable");
                continue;
            }
            ConsoleOutput.success(header + " " + tools.size() + " tool(s)");
            for (ToolDescriptor tool : tools) {
                System.out.println("    " + tool.toolName()
                        + (verbose && tool.description() != null ? "  " + tool.description() : ""));
                if (verbose && tool.inputSchema().get("properties") instanceof Map<?, ?> properties) {
                    System.out.println("      args: " + String.join(", ",
                            properties.keySet().stream().map(String::valueOf).toList()));
                }
            }
        }
    }
}
