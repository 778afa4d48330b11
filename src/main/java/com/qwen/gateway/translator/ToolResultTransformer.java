package com.qwen.gateway.translator;

import com.qwen.gateway.dto.chat.ChatTurn;
import com.qwen.gateway.dto.chat.Role;
import com.qwen.gateway.dto.chat.ToolCall;
import com.qwen.gateway.dto.chat.ToolResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 工具结果 → 后端 user 轮次
 * <p>
 * 后端没有 tool 角色。输出为空时必须替换为显式的成功标记，
 * 部分模型把空轮次当成重试信号，会无限重复同一个调用
 */
@Component
public class ToolResultTransformer {

    public static final String EMPTY_OUTPUT_MARKER = "(completed with no output)";
    public static final String UNKNOWN_TOOL = "unknown tool";

    public ChatTurn transform(ToolResult result, String toolName) {
        String name = toolName == null || toolName.isBlank() ? UNKNOWN_TOOL : toolName;
        String output = result.output();
        String body = output.isBlank() ? EMPTY_OUTPUT_MARKER : output;
        return new ChatTurn(Role.USER, "Result from " + name + ":\n" + body, null, null);
    }

    /**
     * 在之前的 assistant 轮次中查找调用 id 对应的工具名
     *
     * @return 未找到返回 null
     */
    public String resolveToolName(List<ChatTurn> turns, String toolCallId) {
        if (toolCallId == null) return null;
        for (int i = turns.size() - 1; i >= 0; i--) {
            ChatTurn turn = turns.get(i);
            if (turn.role() != Role.ASSISTANT) continue;
            for (ToolCall call : turn.toolCalls()) {
                if (toolCallId.equals(call.id())) {
                    return call.name();
                }
            }
        }
        return null;
    }
}
