package com.qwen.gateway.dto.qwen;

import com.qwen.gateway.dto.chat.TurnUsage;

/**
 * Qwen 非流式响应
 *
 * @param content     生成的完整文本
 * @param tailPointer 新的尾指针（后端的 parent_id）
 * @param responseId  本条回复的消息 id
 * @param usage       Token 使用量
 */
public record QwenCompletion(String content, String tailPointer, String responseId, TurnUsage usage) {

    public QwenCompletion {
        content = content != null ? content : "";
        usage = usage != null ? usage : TurnUsage.EMPTY;
    }
}
