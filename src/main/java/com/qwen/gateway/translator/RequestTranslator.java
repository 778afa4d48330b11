package com.qwen.gateway.translator;

import com.alibaba.fastjson2.JSONObject;
import com.qwen.gateway.dto.chat.ChatRequest;

/**
 * 请求转换接口
 * <p>
 * 将客户端协议的请求体转换为协议无关的 {@link ChatRequest}
 */
public interface RequestTranslator {

    /**
     * 转换请求
     *
     * @param request 原始请求体 JSON
     * @return 解析后的请求
     * @throws com.qwen.gateway.exception.InvalidRequestException 请求结构不合法
     * @throws com.qwen.gateway.exception.SchemaException         工具定义不合法
     */
    ChatRequest translate(JSONObject request);
}
