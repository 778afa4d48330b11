package com.qwen.gateway.trace;

import java.time.Instant;
import java.util.UUID;

/**
 * 单个轮次的追踪上下文
 * <p>
 * 贯穿整个请求链路：① 客户端请求 → ② 后端请求 → ③ 客户端响应
 */
public class TraceContext {

    private final String turnId;
    private final Instant startTime;

    // ① 客户端请求
    private volatile String clientRequest;
    private volatile String model;
    private volatile boolean stream;

    // ② 后端请求
    private volatile String conversationId;
    private volatile String backendRequest;

    // ③ 结果
    private volatile boolean success = true;
    private volatile String errorMessage;

    private TraceContext(String turnId) {
        this.turnId = turnId;
        this.startTime = Instant.now();
    }

    /**
     * 创建新的追踪上下文
     */
    public static TraceContext create() {
        return new TraceContext(UUID.randomUUID().toString().replace("-", "").substring(0, 16));
    }

    /**
     * 使用指定 turnId 创建
     */
    public static TraceContext create(String turnId) {
        return new TraceContext(turnId);
    }

    /**
     * 记录客户端请求（阶段 ①）
     */
    public void recordClientRequest(String requestBody, String model, boolean stream) {
        this.clientRequest = requestBody;
        this.model = model;
        this.stream = stream;
    }

    /**
     * 记录后端请求（阶段 ②）
     */
    public void recordBackendRequest(String conversationId, String requestBody) {
        this.conversationId = conversationId;
        this.backendRequest = requestBody;
    }

    /**
     * 记录错误
     */
    public void recordError(String errorMessage) {
        this.success = false;
        this.errorMessage = errorMessage;
    }

    /**
     * 计算耗时（毫秒）
     */
    public long durationMs() {
        return Instant.now().toEpochMilli() - startTime.toEpochMilli();
    }

    // --- getter ---

    public String turnId() { return turnId; }
    public Instant startTime() { return startTime; }
    public String clientRequest() { return clientRequest; }
    public String model() { return model; }
    public boolean stream() { return stream; }
    public String conversationId() { return conversationId; }
    public String backendRequest() { return backendRequest; }
    public boolean success() { return success; }
    public String errorMessage() { return errorMessage; }
}
