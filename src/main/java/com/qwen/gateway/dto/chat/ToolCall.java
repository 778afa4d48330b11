package com.qwen.gateway.dto.chat;

import com.alibaba.fastjson2.JSON;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次工具调用
 *
 * @param id        网关生成的调用 id（后端不提供）
 * @param name      工具名
 * @param arguments 参数，保持声明顺序
 */
public record ToolCall(String id, String name, Map<String, Object> arguments) {

    public ToolCall {
        arguments = arguments != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                : Map.of();
    }

    /**
     * 参数序列化为 OpenAI function.arguments 所需的 JSON 字符串
     */
    public String argumentsJson() {
        return JSON.toJSONString(arguments);
    }
}
