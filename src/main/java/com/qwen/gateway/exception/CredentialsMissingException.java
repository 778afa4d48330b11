package com.qwen.gateway.exception;

/**
 * 未配置后端凭证
 */
public class CredentialsMissingException extends GatewayException {

    public CredentialsMissingException() {
        super("未配置 Qwen 凭证（token / cookies）", 503, "credentials_missing");
    }
}
