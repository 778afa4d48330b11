package com.qwen.gateway.proxy;

/**
 * Qwen 流式回调接口
 * <p>
 * 处理从 Qwen SSE 流解析出的各类事件
 */
public interface StreamCallback {

    /**
     * 收到 response.created（首个事件，携带新的尾指针）
     */
    void onResponseCreated(String chatId, String parentId, String responseId);

    /**
     * 收到文本增量
     */
    void onText(String text);

    /**
     * 收到 Token 使用统计
     */
    void onUsage(int inputTokens, int outputTokens);

    /**
     * 后端在流中报告错误
     */
    void onError(String error);
}
