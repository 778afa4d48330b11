package com.qwen.gateway.dto.chat;

import java.util.List;

/**
 * 解析后的客户端请求
 *
 * @param model              请求的模型，可为 null（使用默认模型）
 * @param stream             是否流式
 * @param turns              全部对话轮次（含 system）
 * @param tools              工具定义
 * @param sensitiveArguments 工具参数是否敏感（敏感时不落日志）
 */
public record ChatRequest(String model, boolean stream, List<ChatTurn> turns,
                          List<ToolDefinition> tools, boolean sensitiveArguments) {

    public ChatRequest {
        turns = turns != null ? List.copyOf(turns) : List.of();
        tools = tools != null ? List.copyOf(tools) : List.of();
    }

    public boolean hasTools() {
        return !tools.isEmpty();
    }

    /**
     * 第一条 user 轮次的文本，没有则为空串
     */
    public String firstUserText() {
        for (ChatTurn turn : turns) {
            if (turn.role() == Role.USER) return turn.content();
        }
        return "";
    }

    /**
     * 是否包含 assistant 轮次（即非首轮请求）
     */
    public boolean hasAssistantTurn() {
        for (ChatTurn turn : turns) {
            if (turn.role() == Role.ASSISTANT) return true;
        }
        return false;
    }
}
