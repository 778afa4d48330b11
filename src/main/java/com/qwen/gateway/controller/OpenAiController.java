package com.qwen.gateway.controller;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.qwen.gateway.auth.CredentialsProvider;
import com.qwen.gateway.config.AppProperties;
import com.qwen.gateway.dto.chat.ChatRequest;
import com.qwen.gateway.exception.GatewayException;
import com.qwen.gateway.proxy.QwenApiClient;
import com.qwen.gateway.service.TurnOrchestrator;
import com.qwen.gateway.trace.TraceContext;
import com.qwen.gateway.trace.TraceFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * OpenAI 兼容 API 端点
 * <p>
 * POST /v1/chat/completions: 流式 + 非流式
 * GET  /v1/models: 模型列表
 */
@RestController
@RequestMapping("/v1")
public class OpenAiController {

    private static final Logger log = LoggerFactory.getLogger(OpenAiController.class);

    private final TurnOrchestrator orchestrator;
    private final QwenApiClient apiClient;
    private final CredentialsProvider credentialsProvider;
    private final AppProperties properties;

    public OpenAiController(TurnOrchestrator orchestrator, QwenApiClient apiClient,
                            CredentialsProvider credentialsProvider, AppProperties properties) {
        this.orchestrator = orchestrator;
        this.apiClient = apiClient;
        this.credentialsProvider = credentialsProvider;
        this.properties = properties;
    }

    /**
     * POST /v1/chat/completions
     */
    @PostMapping(value = "/chat/completions")
    public Mono<Void> chatCompletions(@RequestBody String body, ServerWebExchange exchange) {
        TraceContext traceCtx = TraceFilter.getTraceContext(exchange);
        ChatRequest request = orchestrator.parse(body);

        // 记录客户端请求（阶段 ①）
        traceCtx.recordClientRequest(body, request.model(), request.stream());

        DataBufferFactory bufferFactory = exchange.getResponse().bufferFactory();

        if (request.stream()) {
            return orchestrator.handleStreamingTurn(request, traceCtx)
                    .flatMap(sseFlux -> {
                        exchange.getResponse().getHeaders().setContentType(MediaType.TEXT_EVENT_STREAM);
                        exchange.getResponse().getHeaders().setCacheControl("no-cache");
                        return exchange.getResponse().writeAndFlushWith(
                                sseFlux.map(s -> Mono.just(bufferFactory.wrap(s.getBytes(StandardCharsets.UTF_8))))
                        );
                    });
        }

        // 非流式：直接写 JSON 字节，避免 Jackson 二次序列化
        return orchestrator.handleTurn(request, traceCtx)
                .map(completion -> completion.toJSONString())
                .flatMap(json -> {
                    exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
                    byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
                    exchange.getResponse().getHeaders().setContentLength(bytes.length);
                    DataBuffer buffer = bufferFactory.wrap(bytes);
                    return exchange.getResponse().writeWith(Mono.just(buffer));
                });
    }

    /**
     * GET /v1/models
     * <p>
     * 后端不可用时只返回默认模型
     */
    @GetMapping(value = "/models", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> listModels() {
        return Mono.fromCallable(this::buildModelList)
                .subscribeOn(Schedulers.boundedElastic());
    }

    private String buildModelList() {
        List<QwenApiClient.ModelInfo> models;
        try {
            models = apiClient.listModels(credentialsProvider.current());
        } catch (GatewayException e) {
            log.warn("获取模型列表失败，返回默认模型: {}", e.getMessage());
            models = List.of();
        }
        if (models.isEmpty()) {
            String defaultModel = properties.getBackend().getDefaultModel();
            models = List.of(new QwenApiClient.ModelInfo(defaultModel, defaultModel));
        }

        long created = System.currentTimeMillis() / 1000;
        JSONArray data = new JSONArray();
        for (QwenApiClient.ModelInfo model : models) {
            data.add(JSONObject.of(
                    "id", model.id(), //
                    "object", "model", //
                    "created", created, //
                    "owned_by", "qwen" //
            ));
        }
        return JSONObject.of("object", "list", "data", data).toJSONString();
    }
}
