package com.qwen.gateway.exception;

/**
 * 工具定义不合法（调用方契约错误，在调用后端之前拒绝）
 */
public class SchemaException extends GatewayException {

    public SchemaException(String message) {
        super(message, 400, "invalid_tool_schema");
    }
}
