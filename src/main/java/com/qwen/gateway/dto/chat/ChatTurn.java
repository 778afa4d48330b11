package com.qwen.gateway.dto.chat;

import java.util.List;

/**
 * 协议无关的对话轮次
 *
 * @param role       角色
 * @param content    文本内容，缺省为空串，永不为 null
 * @param toolCalls  工具调用（仅 assistant）
 * @param toolResult 工具结果（仅 tool）
 */
public record ChatTurn(Role role, String content, List<ToolCall> toolCalls, ToolResult toolResult) {

    public ChatTurn {
        content = content != null ? content : "";
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
    }

    public static ChatTurn system(String content) {
        return new ChatTurn(Role.SYSTEM, content, null, null);
    }

    public static ChatTurn user(String content) {
        return new ChatTurn(Role.USER, content, null, null);
    }

    public static ChatTurn assistant(String content, List<ToolCall> toolCalls) {
        return new ChatTurn(Role.ASSISTANT, content, toolCalls, null);
    }

    public static ChatTurn tool(ToolResult result) {
        return new ChatTurn(Role.TOOL, result.output(), null, result);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
