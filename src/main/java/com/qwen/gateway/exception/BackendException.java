package com.qwen.gateway.exception;

import lombok.Getter;

/**
 * Qwen 后端调用异常
 * <p>
 * 错误码固定为 backend_timeout / backend_unavailable / backend_rate_limited /
 * backend_auth_failed / backend_error 之一
 */
@Getter
public class BackendException extends GatewayException {

    private final int backendStatus;
    private final String responseBody;

    public BackendException(String message, int statusCode, String errorCode,
                            int backendStatus, String responseBody, Throwable cause) {
        super(message, statusCode, errorCode, cause);
        this.backendStatus = backendStatus;
        this.responseBody = responseBody;
    }

    public static BackendException timeout(long timeoutMs) {
        return new BackendException("Qwen 后端响应超时: " + timeoutMs + "ms",
                504, "backend_timeout", 0, null, null);
    }

    public static BackendException unavailable(Throwable cause) {
        return new BackendException("Qwen 后端连接失败: " + cause.getMessage(),
                502, "backend_unavailable", 0, null, cause);
    }

    /**
     * 流在结束标记之前被后端关闭
     */
    public static BackendException truncated() {
        return new BackendException("Qwen 后端流在结束标记前关闭",
                502, "backend_unavailable", 200, null, null);
    }

    /**
     * 按后端 HTTP 状态码归类
     */
    public static BackendException fromStatus(int status, String body) {
        if (status == 401 || status == 403) {
            return new BackendException("Qwen 后端认证失败: " + status,
                    401, "backend_auth_failed", status, body, null);
        }
        if (status == 429) {
            return new BackendException("Qwen 后端限流: " + status,
                    429, "backend_rate_limited", status, body, null);
        }
        return new BackendException("Qwen 后端错误: " + status + " - " + abbreviate(body),
                502, "backend_error", status, body, null);
    }

    /**
     * 后端返回 200 但业务失败（success=false 或 SSE error 事件）
     */
    public static BackendException rejected(String detail) {
        return new BackendException("Qwen 后端拒绝请求: " + detail,
                502, "backend_error", 200, detail, null);
    }

    public boolean isTimeout() {
        return "backend_timeout".equals(getErrorCode());
    }

    public boolean isRateLimit() {
        return backendStatus == 429;
    }

    public boolean isAuthError() {
        return backendStatus == 401 || backendStatus == 403;
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
