package org.iceforge.terra.gateway.service;

import java.util.Map;

/**
 * One tool invocation requested by the model, e.g. {@code {"tool":"query","args":{...}}}.
 */
public record ToolCall(String tool, Map<String, Object> args) {

    public ToolCall {
        args = args == null ? Map.of() : args;
    }
}
