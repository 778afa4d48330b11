package com.qwen.gateway.exception;

import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * 全局异常处理器
 * <p>
 * 错误体为 OpenAI 格式：{"error":{"message","type","code"}}
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BackendException.class)
    public ResponseEntity<String> handleBackend(BackendException e) {
        log.error("Qwen 后端异常: code={}, status={}, body={}",
                e.getErrorCode(), e.getBackendStatus(), e.getResponseBody());
        return buildErrorResponse(e.getStatusCode(), e.errorType(), e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<String> handleGateway(GatewayException e) {
        if (e.getStatusCode() >= 500) {
            log.error("网关异常: {}", e.getMessage(), e);
        } else {
            log.warn("请求被拒绝: code={}, message={}", e.getErrorCode(), e.getMessage());
        }
        return buildErrorResponse(e.getStatusCode(), e.errorType(), e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<String> handleResponseStatus(ResponseStatusException e) {
        int statusCode = e.getStatusCode().value();
        log.warn("HTTP 状态异常: {} {}", statusCode, e.getReason());
        String type = statusCode == 404 ? "not_found_error" : "invalid_request_error";
        return buildErrorResponse(statusCode, type, null, e.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleUnexpected(Exception e) {
        log.error("未预期异常: {}", e.getMessage(), e);
        return buildErrorResponse(500, "api_error", "internal_error", "服务器内部错误");
    }

    private ResponseEntity<String> buildErrorResponse(int statusCode, String errorType, String code, String message) {
        JSONObject body = JSONObject.of(
                "error", JSONObject.of( //
                        "message", message, //
                        "type", errorType, //
                        "code", code //
                ) //
        );
        return ResponseEntity
                .status(HttpStatus.valueOf(Math.min(statusCode, 599)))
                .contentType(MediaType.APPLICATION_JSON)
                .body(body.toJSONString());
    }
}
