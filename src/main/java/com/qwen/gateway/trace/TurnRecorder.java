package com.qwen.gateway.trace;

import com.qwen.gateway.dto.chat.TurnUsage;

/**
 * 轮次审计记录
 * <p>
 * 实现必须是 fire-and-forget：不阻塞、不抛异常，丢失记录可以接受
 */
public interface TurnRecorder {

    /**
     * 记录轮次请求（客户端请求 + 发往后端的请求）
     */
    void recordTurn(String turnId, String conversationId, String request, String backendRequest);

    /**
     * 记录轮次结果
     *
     * @param error 成功时为 null
     */
    void recordResult(String turnId, String response, String tailPointer, TurnUsage usage, long durationMs, String error);
}
