package com.qwen.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 应用配置属性绑定
 */
@Data
@Component
@ConfigurationProperties(prefix = "qwen")
public class AppProperties {

    private BackendConfig backend = new BackendConfig();
    private SessionConfig session = new SessionConfig();
    private ProxyConfig proxy = new ProxyConfig();
    private LoggingConfig logging = new LoggingConfig();
    private DatabaseConfig database = new DatabaseConfig();

    // --- 嵌套配置类 ---

    @Data
    public static class BackendConfig {
        private String baseUrl = "https://chat.qwen.ai";
        // 单轮后端调用的总超时（流式为整条流）
        private long timeoutMs = 120000;
        private long connectTimeoutMs = 30000;
        private String defaultModel = "qwen3-max";
        private String token = "";
        private String cookies = "";
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
        private String chatMode = "guest";
    }

    @Data
    public static class SessionConfig {
        private int idleTimeoutMinutes = 30;
        private long lockTimeoutMs = 5000;
    }

    @Data
    public static class ProxyConfig {
        private boolean enabled = false;
        private String url = "";
    }

    @Data
    public static class LoggingConfig {
        private String filePath = "data/logs";
        private int requestLogRetention = 100000;
    }

    @Data
    public static class DatabaseConfig {
        private String path = "data/qwen.db";
    }
}
