package com.qwen.gateway.auth;

/**
 * 后端凭证提供者，每个轮次调用一次
 */
public interface CredentialsProvider {

    /**
     * 获取当前凭证
     *
     * @throws com.qwen.gateway.exception.CredentialsMissingException 未配置凭证
     */
    BackendCredentials current();

    /**
     * 凭证状态：database / config / missing
     */
    String status();
}
