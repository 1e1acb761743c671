package com.keystone.broker;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Checks call arguments against the subset of JSON schema tool servers publish:
 * required properties and primitive property types.
 */
final class ArgumentValidator {

    private ArgumentValidator() {}

    static void validate(ToolDescriptor descriptor, Map<String, Object> args) {
        Map<String, Object> schema = descriptor.inputSchema();
        if (schema.get("required") instanceof List<?> required) {
            for (Object name : required) {
                if (args.get(String.valueOf(name)) == null) {
                    throw new ToolException(ToolErrorKind.INVALID_ARGS,
                            descriptor.toolName() + ": missing required argument '" + name + "'");
                }
            }
        }
        if (schema.get("properties") instanceof Map<?, ?> properties) {
            for (Map.Entry<String, Object> arg : args.entrySet()) {
                if (arg.getValue() != null && properties.get(arg.getKey()) instanceof Map<?, ?> property
                        && property.get("type") instanceof String type
                        && !matches(type, arg.getValue())) {
                    throw new ToolException(ToolErrorKind.INVALID_ARGS,
                            descriptor.toolName() + ": argument '" + arg.getKey() + "' must be " + type);
                }
            }
        }
    }

    private static boolean matches(String type, Object value) {
        return switch (type) {
            case "string" -> value instanceof String;
            case "integer" -> value instanceof Integer || value instanceof Long
                    || (value instanceof String s && s.matches("-?\\d+"));
            case "number" -> value instanceof Number;
            case "boolean" -> value instanceof Boolean;
            case "array" -> value instanceof Collection<?> || value.getClass().isArray();
            case "object" -> value instanceof Map<?, ?>;
            default -> true;
        };
    }
}
