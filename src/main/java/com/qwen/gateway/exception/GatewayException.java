package com.qwen.gateway.exception;

import lombok.Getter;

/**
 * Qwen Gateway 异常基类
 * <p>
 * statusCode 为返回给客户端的 HTTP 状态码，errorCode 为稳定的错误码
 */
@Getter
public class GatewayException extends RuntimeException {

    private final int statusCode;
    private final String errorCode;

    public GatewayException(String message) {
        this(message, 500, "internal_error");
    }

    public GatewayException(String message, int statusCode, String errorCode) {
        super(message);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    public GatewayException(String message, int statusCode, String errorCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    /**
     * OpenAI 风格的 error.type
     */
    public String errorType() {
        return switch (statusCode) {
            case 400 -> "invalid_request_error";
            case 401, 403 -> "authentication_error";
            case 409 -> "conflict_error";
            case 429 -> "rate_limit_error";
            default -> statusCode >= 500 ? "api_error" : "invalid_request_error";
        };
    }
}
