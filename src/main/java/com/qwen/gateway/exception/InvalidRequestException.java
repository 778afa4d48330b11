package com.qwen.gateway.exception;

/**
 * 客户端请求不合法
 */
public class InvalidRequestException extends GatewayException {

    public InvalidRequestException(String message) {
        super(message, 400, "invalid_request");
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, 400, "invalid_request", cause);
    }
}
