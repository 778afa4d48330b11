package com.qwen.gateway.dto.chat;

import java.util.List;

/**
 * 客户端声明的工具定义，每个请求重新提供
 */
public record ToolDefinition(String name, String description, List<ToolParameter> parameters) {

    public ToolDefinition {
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }

    public ToolParameter parameter(String paramName) {
        for (ToolParameter p : parameters) {
            if (p.name().equals(paramName)) {
                return p;
            }
        }
        return null;
    }
}
