package com.qwen.gateway.dto.chat;

/**
 * 客户端回传的工具执行结果
 *
 * @param toolCallId 对应 ToolCall 的 id
 * @param output     原始输出，可能为空串
 */
public record ToolResult(String toolCallId, String output) {

    public ToolResult {
        output = output != null ? output : "";
    }
}
