package com.qwen.gateway.exception;

/**
 * 调用块存在但无法解析
 * <p>
 * 调用方捕获后降级为原文输出，不会直接返回给客户端
 */
public class ExtractionException extends GatewayException {

    public ExtractionException(String message) {
        super(message, 502, "tool_call_parse_error");
    }
}
