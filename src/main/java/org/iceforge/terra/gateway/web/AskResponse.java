package org.iceforge.terra.gateway.web;

import org.iceforge.terra.gateway.service.ToolCall;

import java.util.List;

public record AskResponse(List<ToolCall> toolCalls, List<ToolResult> results) {

    public record ToolResult(String tool, String status, Object data, ErrorResponse error) {

        public static ToolResult success(String tool, Object data) {
            return new ToolResult(tool, "success", data, null);
        }

        public static ToolResult failure(String tool, ErrorResponse error) {
            return new ToolResult(tool, "error", null, error);
        }
    }
}
