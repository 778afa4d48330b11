package com.qwen.gateway.exception;

/**
 * 同一会话已有进行中的轮次
 */
public class ConversationBusyException extends GatewayException {

    public ConversationBusyException(String conversationId) {
        super("会话正在处理上一轮请求: " + conversationId, 409, "conversation_busy");
    }
}
