package com.keystone.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Built-in file tools confined to the configured workspace root.
 * Relative paths resolve against the root; anything that normalizes outside it is refused.
 */
@Component
public class FilesystemToolProvider implements LocalToolProvider {

    private static final Logger log = LoggerFactory.getLogger(FilesystemToolProvider.class);

    private static final long MAX_READ_BYTES = 1_000_000;

    private final Path root;

    @Autowired
    public FilesystemToolProvider(ToolBrokerProperties properties) {
        this(Path.of(properties.getWorkspaceRoot()));
    }

    FilesystemToolProvider(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public String name() {
        return "filesystem";
    }

    @Override
    public List<ToolDescriptor> describe(String serverId) {
        List<String> tags = List.of("files");
        return List.of(
                new ToolDescriptor(serverId, "create_directory", "Create a directory (and missing parents)",
                        schema(Map.of("path", string("Directory path")), List.of("path")), tags),
                new ToolDescriptor(serverId, "write_file", "Write UTF-8 text to a file, replacing it",
                        schema(Map.of("path", string("File path"), "content", string("Text to write")),
                                List.of("path", "content")), tags),
                new ToolDescriptor(serverId, "read_file", "Read a UTF-8 text file",
                        schema(Map.of("path", string("File path")), List.of("path")), tags),
                new ToolDescriptor(serverId, "list_directory", "List the entries of a directory",
                        schema(Map.of("path", string("Directory path")), List.of("path")), tags));
    }

    @Override
    public ToolReply call(String toolName, Map<String, Object> args) {
        Path path = resolve(args.get("path"));
        try {
            return switch (toolName) {
                case "create_directory" -> {
                    Files.createDirectories(path);
                    yield ToolReply.ok("created " + root.relativize(path));
                }
                case "write_file" -> {
                    Object content = args.get("content");
                    if (path.getParent() != null) {
                        Files.createDirectories(path.getParent());
                    }
                    Files.writeString(path, content == null ? "" : content.toString(), StandardCharsets.UTF_8);
                    yield ToolReply.ok("wrote " + root.relativize(path));
                }
                case "read_file" -> {
                    if (Files.size(path) > MAX_READ_BYTES) {
                        yield ToolReply.error("file larger than " + MAX_READ_BYTES + " bytes");
                    }
                    yield ToolReply.ok(Files.readString(path, StandardCharsets.UTF_8));
                }
                case "list_directory" -> {
                    try (Stream<Path> entries = Files.list(path)) {
                        yield ToolReply.ok(entries
                                .map(p -> p.getFileName() + (Files.isDirectory(p) ? "/" : ""))
                                .sorted()
                                .collect(Collectors.joining("\n")));
                    }
                }
                default -> throw new ToolException(ToolErrorKind.INVALID_ARGS, "Unknown filesystem tool: " + toolName);
            };
        } catch (NoSuchFileException e) {
            return ToolReply.error("no such file: " + root.relativize(path));
        } catch (IOException e) {
            log.warn("Filesystem tool {} failed on {}: {}", toolName, path, e.getMessage());
            throw new ToolException(ToolErrorKind.REMOTE_ERROR, toolName + " failed: " + e.getMessage(), e);
        }
    }

    Path resolve(Object rawPath) {
        if (rawPath == null || rawPath.toString().isBlank()) {
            throw new ToolException(ToolErrorKind.INVALID_ARGS, "Missing 'path' argument");
        }
        Path candidate = root.resolve(rawPath.toString()).normalize();
        if (!candidate.startsWith(root)) {
            throw new ToolException(ToolErrorKind.INVALID_ARGS, "Path escapes workspace: " + rawPath);
        }
        return candidate;
    }

    static Map<String, Object> schema(Map<String, Object> properties, List<String> required) {
        return Map.of("type", "object", "properties", properties, "required", required);
    }

    static Map<String, Object> string(String description) {
        return Map.of("type", "string", "description", description);
    }
}
