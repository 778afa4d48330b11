package com.qwen.gateway.auth;

/**
 * 当前生效的后端端点与凭证
 *
 * @param baseUrl   后端地址
 * @param token     bx-umidtoken
 * @param cookies   Cookie 头
 * @param userAgent User-Agent 头
 * @param source    来源：database / config
 */
public record BackendCredentials(String baseUrl, String token, String cookies, String userAgent, String source) {

    /**
     * 脱敏 token，只保留前 8 位
     */
    public String maskedToken() {
        if (token == null) return "***";
        return token.length() > 8 ? token.substring(0, 8) + "***" : "***";
    }
}
