package com.qwen.gateway.controller;

import com.alibaba.fastjson2.JSONObject;
import com.qwen.gateway.auth.CredentialsProvider;
import com.qwen.gateway.session.ContinuityManager;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 健康检查端点
 */
@RestController
public class HealthController {

    private final CredentialsProvider credentialsProvider;
    private final ContinuityManager continuity;

    public HealthController(CredentialsProvider credentialsProvider, ContinuityManager continuity) {
        this.credentialsProvider = credentialsProvider;
        this.continuity = continuity;
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> health() {
        String credentials = credentialsProvider.status();
        JSONObject result = new JSONObject();
        result.put("status", "missing".equals(credentials) ? "degraded" : "ok");
        result.put("version", "1.0.0");
        result.put("credentials", credentials);
        result.put("conversations", continuity.size());
        return Mono.just(result.toJSONString());
    }
}
