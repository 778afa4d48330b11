package com.qwen.gateway.service;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.qwen.gateway.auth.BackendCredentials;
import com.qwen.gateway.auth.CredentialsProvider;
import com.qwen.gateway.config.AppProperties;
import com.qwen.gateway.dto.chat.ChatRequest;
import com.qwen.gateway.dto.chat.FinishReason;
import com.qwen.gateway.dto.chat.ToolCall;
import com.qwen.gateway.dto.chat.TurnUsage;
import com.qwen.gateway.dto.qwen.QwenCompletion;
import com.qwen.gateway.dto.qwen.QwenPayload;
import com.qwen.gateway.exception.BackendException;
import com.qwen.gateway.exception.ExtractionException;
import com.qwen.gateway.exception.GatewayException;
import com.qwen.gateway.exception.InvalidRequestException;
import com.qwen.gateway.proxy.BackendCall;
import com.qwen.gateway.proxy.QwenApiClient;
import com.qwen.gateway.session.ContinuityManager;
import com.qwen.gateway.session.ConversationState;
import com.qwen.gateway.trace.TraceContext;
import com.qwen.gateway.trace.TurnRecorder;
import com.qwen.gateway.translator.OpenAiTranslator;
import com.qwen.gateway.translator.QwenTranslator;
import com.qwen.gateway.translator.StreamReassembler;
import com.qwen.gateway.translator.ToolCallExtractor;
import com.qwen.gateway.translator.ToolSchemaTransformer;
import com.qwen.gateway.util.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 单轮对话编排
 * <p>
 * 解析 → 定位会话 → 获取租约 → 构建载荷 → 调用后端 → 提取工具调用 → 推进会话。
 * 任何失败都不推进会话，租约在所有路径上释放。不做自动重试
 */
@Component
public class TurnOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TurnOrchestrator.class);
    private static final String MASK = "***";

    private final OpenAiTranslator openAiTranslator;
    private final QwenTranslator qwenTranslator;
    private final ToolSchemaTransformer schemaTransformer;
    private final ToolCallExtractor extractor;
    private final ContinuityManager continuity;
    private final CredentialsProvider credentialsProvider;
    private final QwenApiClient apiClient;
    private final TurnRecorder recorder;
    private final AppProperties properties;

    public TurnOrchestrator(OpenAiTranslator openAiTranslator, QwenTranslator qwenTranslator,
                            ToolSchemaTransformer schemaTransformer, ToolCallExtractor extractor,
                            ContinuityManager continuity, CredentialsProvider credentialsProvider,
                            QwenApiClient apiClient, TurnRecorder recorder, AppProperties properties) {
        this.openAiTranslator = openAiTranslator;
        this.qwenTranslator = qwenTranslator;
        this.schemaTransformer = schemaTransformer;
        this.extractor = extractor;
        this.continuity = continuity;
        this.credentialsProvider = credentialsProvider;
        this.apiClient = apiClient;
        this.recorder = recorder;
        this.properties = properties;
    }

    /**
     * 解析客户端请求体
     *
     * @throws InvalidRequestException 不是合法 JSON 或结构不合法
     */
    public ChatRequest parse(String body) {
        JSONObject json;
        try {
            json = JSONObject.parseObject(body);
        } catch (JSONException e) {
            throw new InvalidRequestException("请求体不是合法 JSON: " + e.getMessage());
        }
        return openAiTranslator.translate(json);
    }

    /**
     * 非流式轮次
     */
    public Mono<JSONObject> handleTurn(ChatRequest request, TraceContext trace) {
        return Mono.fromCallable(() -> executeTurn(request, trace))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * 流式轮次
     * <p>
     * 外层 Mono 在后端流打开后发出 SSE 行（{@code data: ...\n\n}）组成的 Flux。
     * 打开之前的失败以 Mono 错误结束，由调用方转为 HTTP 错误；之后的失败在流内以错误 chunk 报告
     */
    public Mono<Flux<String>> handleStreamingTurn(ChatRequest request, TraceContext trace) {
        return Mono.fromCallable(() -> openStream(request, trace))
                .subscribeOn(Schedulers.boundedElastic())
                // 准备期间客户端已断开
                .doOnDiscard(StartedStream.class, StartedStream::abandon)
                .map(started -> stream(request, trace, started));
    }

    // ==================== 非流式 ====================

    private JSONObject executeTurn(ChatRequest request, TraceContext trace) {
        PreparedTurn turn = null;
        try {
            turn = prepare(request, trace);
            try (ConversationState.Lease ignored = turn.lease()) {
                QwenCompletion completion = apiClient.send(turn.payload(), turn.credentials());
                ConversationState state = turn.state();

                ToolCall call = extractSafely(completion.content(), request, state, trace);
                String content = call != null ? "" : completion.content();
                FinishReason reason = call != null ? FinishReason.TOOL_CALLS : FinishReason.STOP;
                JSONObject response = openAiTranslator.toOpenAiResponse(content, call, completion.usage(),
                        turn.model(), reason);

                continuity.advance(state, completion.tailPointer());
                if (!request.hasAssistantTurn()) {
                    continuity.bindFirstReply(state, request.firstUserText(), content);
                }

                long duration = trace.durationMs();
                recorder.recordResult(trace.turnId(), auditResponse(response, request.sensitiveArguments()),
                        completion.tailPointer(), completion.usage(), duration, null);
                Metrics.instance().recordTurn(false, true, duration, completion.usage());
                log.info("轮次完成: conversationId={}, turnId={}, finish={}, tokens={}, duration={}ms",
                        ContinuityManager.shortId(state.conversationId()), trace.turnId(),
                        reason.wireName(), completion.usage().totalTokens(), duration);
                return response;
            }
        } catch (GatewayException e) {
            failTurn(trace, turn != null ? turn.state() : null, false, e);
            throw e;
        }
    }

    // ==================== 流式 ====================

    private StartedStream openStream(ChatRequest request, TraceContext trace) {
        PreparedTurn turn = null;
        try {
            turn = prepare(request, trace);
            BackendCall call = apiClient.openStream(turn.payload(), turn.credentials());
            return new StartedStream(turn, call);
        } catch (GatewayException e) {
            if (turn != null) {
                turn.lease().close();
            }
            failTurn(trace, turn != null ? turn.state() : null, true, e);
            throw e;
        }
    }

    private Flux<String> stream(ChatRequest request, TraceContext trace, StartedStream started) {
        Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
        StreamReassembler reassembler = new StreamReassembler(OpenAiTranslator.newCompletionId(),
                started.turn().model(), extractor, request.tools(), openAiTranslator,
                new StreamReassembler.DeltaSink() {
                    @Override
                    public void emit(JSONObject chunk) {
                        sink.tryEmitNext("data: " + chunk.toJSONString() + "\n\n");
                    }

                    @Override
                    public void done() {
                        // 会话推进完成后才结束 Flux，见 pump
                        sink.tryEmitNext("data: [DONE]\n\n");
                    }
                });

        long timeoutMs = properties.getBackend().getTimeoutMs();
        BackendCall call = started.call();
        Disposable watchdog = Schedulers.parallel().schedule(call::expire, timeoutMs, TimeUnit.MILLISECONDS);
        Schedulers.boundedElastic().schedule(() -> pump(request, trace, started, reassembler, watchdog, sink));

        return sink.asFlux()
                .doOnCancel(() -> {
                    log.info("客户端断开流: conversationId={}, turnId={}",
                            ContinuityManager.shortId(started.turn().state().conversationId()), trace.turnId());
                    reassembler.cancel();
                    call.cancel();
                });
    }

    private void pump(ChatRequest request, TraceContext trace, StartedStream started,
                      StreamReassembler reassembler, Disposable watchdog, Sinks.Many<String> sink) {
        PreparedTurn turn = started.turn();
        ConversationState state = turn.state();
        long timeoutMs = properties.getBackend().getTimeoutMs();

        try (ConversationState.Lease ignored = turn.lease()) {
            BackendCall.Outcome outcome;
            try {
                outcome = started.call().pump(reassembler);
            } finally {
                watchdog.dispose();
            }

            switch (outcome) {
                case COMPLETED -> {
                    reassembler.onComplete();
                    if (reassembler.failed()) {
                        finishFailedStream(trace, state, reassembler);
                    } else {
                        finishStream(request, trace, turn, reassembler);
                    }
                }
                case TRUNCATED -> {
                    reassembler.fail(BackendException.truncated());
                    finishFailedStream(trace, state, reassembler);
                }
                case EXPIRED -> {
                    reassembler.fail(BackendException.timeout(timeoutMs));
                    finishFailedStream(trace, state, reassembler);
                }
                case CANCELLED -> finishCancelledStream(request, trace, state, reassembler);
            }
        } catch (GatewayException e) {
            reassembler.fail(e);
            finishFailedStream(trace, state, reassembler);
        } catch (RuntimeException e) {
            log.error("流式轮次异常: conversationId={}, turnId={}",
                    ContinuityManager.shortId(state.conversationId()), trace.turnId(), e);
            reassembler.fail(new GatewayException("流处理异常: " + e.getMessage()));
            finishFailedStream(trace, state, reassembler);
        } finally {
            sink.tryEmitComplete();
        }
    }

    private void finishStream(ChatRequest request, TraceContext trace, PreparedTurn turn,
                              StreamReassembler reassembler) {
        ConversationState state = turn.state();
        continuity.advance(state, reassembler.tailPointer());
        if (!request.hasAssistantTurn()) {
            continuity.bindFirstReply(state, request.firstUserText(), reassembler.emittedContent());
        }
        ToolCall call = reassembler.toolCall();
        if (call != null) {
            logToolCall(call, request, state, trace);
        }

        long duration = trace.durationMs();
        TurnUsage usage = reassembler.usage();
        recorder.recordResult(trace.turnId(), auditStream(reassembler, request.sensitiveArguments()),
                reassembler.tailPointer(), usage, duration, null);
        Metrics.instance().recordTurn(true, true, duration, usage);
        log.info("流式轮次完成: conversationId={}, turnId={}, toolCall={}, tokens={}, duration={}ms",
                ContinuityManager.shortId(state.conversationId()), trace.turnId(),
                call != null ? call.name() : "-", usage.totalTokens(), duration);
    }

    /**
     * 客户端断开：后端已确认本轮（见过 response.created）则仍推进，并标记为中断，
     * 客户端重发同一请求或带上已收到的部分回复时都能续上
     */
    private void finishCancelledStream(ChatRequest request, TraceContext trace, ConversationState state,
                                       StreamReassembler reassembler) {
        String tail = reassembler.tailPointer();
        if (tail != null) {
            continuity.advance(state, tail);
            continuity.markInterrupted(state);
            if (!request.hasAssistantTurn()) {
                continuity.bindFirstReply(state, request.firstUserText(), reassembler.emittedContent());
            }
        }
        Metrics.instance().increment("qwen_turns_cancelled_total");
        recorder.recordResult(trace.turnId(), auditStream(reassembler, request.sensitiveArguments()),
                tail, reassembler.usage(), trace.durationMs(), "cancelled");
        log.info("流式轮次被取消: conversationId={}, turnId={}, tail={}",
                ContinuityManager.shortId(state.conversationId()), trace.turnId(), tail);
    }

    private void finishFailedStream(TraceContext trace, ConversationState state, StreamReassembler reassembler) {
        String message = reassembler.errorMessage() != null ? reassembler.errorMessage() : "stream failed";
        trace.recordError(message);
        long duration = trace.durationMs();
        recorder.recordResult(trace.turnId(), null, null, reassembler.usage(), duration,
                reassembler.errorCode() + ": " + message);
        Metrics.instance().recordTurn(true, false, duration, reassembler.usage());
        log.warn("流式轮次失败: conversationId={}, turnId={}, code={}, message={}",
                ContinuityManager.shortId(state.conversationId()), trace.turnId(), reassembler.errorCode(), message);
    }

    // ==================== 公共步骤 ====================

    private PreparedTurn prepare(ChatRequest request, TraceContext trace) {
        if (request.hasTools()) {
            schemaTransformer.validate(request.tools());
        }
        ConversationState state = continuity.resolve(request.turns());
        ConversationState.Lease lease = continuity.acquire(state,
                Duration.ofMillis(properties.getSession().getLockTimeoutMs()));
        try {
            boolean firstTurn = state.tailPointer() == null;
            BackendCredentials credentials = credentialsProvider.current();
            String model = request.model() != null && !request.model().isBlank()
                    ? request.model()
                    : properties.getBackend().getDefaultModel();

            if (state.chatId() == null) {
                state.bindChat(apiClient.createChat(credentials, model));
            }

            QwenPayload payload = qwenTranslator.buildPayload(request, state, model);
            String backendRequest = payload.toJsonString();
            trace.recordBackendRequest(state.conversationId(), backendRequest);
            recorder.recordTurn(trace.turnId(), state.conversationId(), trace.clientRequest(), backendRequest);

            log.info("轮次开始: conversationId={}, turnId={}, model={}, stream={}, firstTurn={}, tools={}",
                    ContinuityManager.shortId(state.conversationId()), trace.turnId(), model,
                    request.stream(), firstTurn, request.tools().size());
            return new PreparedTurn(state, lease, credentials, model, payload);
        } catch (RuntimeException e) {
            lease.close();
            throw e;
        }
    }

    /**
     * 提取失败时降级为纯文本
     */
    private ToolCall extractSafely(String text, ChatRequest request, ConversationState state, TraceContext trace) {
        try {
            ToolCallExtractor.ExtractionResult result = extractor.extract(text, request.tools());
            if (!result.hasCall()) {
                return null;
            }
            logToolCall(result.call(), request, state, trace);
            return result.call();
        } catch (ExtractionException e) {
            Metrics.instance().increment("qwen_tool_call_extraction_failures_total");
            log.warn("调用块解析失败，按文本返回: conversationId={}, turnId={}, reason={}",
                    ContinuityManager.shortId(state.conversationId()), trace.turnId(), e.getMessage());
            return null;
        }
    }

    private void failTurn(TraceContext trace, ConversationState state, boolean stream, GatewayException e) {
        trace.recordError(e.getMessage());
        long duration = trace.durationMs();
        recorder.recordResult(trace.turnId(), null, null, TurnUsage.EMPTY, duration,
                e.getErrorCode() + ": " + e.getMessage());
        Metrics.instance().recordTurn(stream, false, duration, TurnUsage.EMPTY);
        String conversationId = state != null ? ContinuityManager.shortId(state.conversationId()) : "-";
        if (e.getStatusCode() >= 500) {
            log.error("轮次失败: conversationId={}, turnId={}, code={}, message={}",
                    conversationId, trace.turnId(), e.getErrorCode(), e.getMessage());
        } else {
            log.warn("轮次失败: conversationId={}, turnId={}, code={}, message={}",
                    conversationId, trace.turnId(), e.getErrorCode(), e.getMessage());
        }
    }

    private void logToolCall(ToolCall call, ChatRequest request, ConversationState state, TraceContext trace) {
        Metrics.instance().recordToolCall(call.name());
        log.info("工具调用: conversationId={}, turnId={}, name={}, args={}",
                ContinuityManager.shortId(state.conversationId()), trace.turnId(), call.name(),
                request.sensitiveArguments() ? MASK : call.argumentsJson());
    }

    private String auditResponse(JSONObject response, boolean sensitive) {
        if (!sensitive) {
            return response.toJSONString();
        }
        JSONObject copy = JSONObject.parseObject(response.toJSONString());
        JSONObject message = copy.getJSONArray("choices").getJSONObject(0).getJSONObject("message");
        JSONArray toolCalls = message.getJSONArray("tool_calls");
        if (toolCalls != null) {
            for (int i = 0; i < toolCalls.size(); i++) {
                toolCalls.getJSONObject(i).getJSONObject("function").put("arguments", MASK);
            }
        }
        return copy.toJSONString();
    }

    private String auditStream(StreamReassembler reassembler, boolean sensitive) {
        JSONObject summary = JSONObject.of("content", reassembler.emittedContent());
        ToolCall call = reassembler.toolCall();
        if (call != null) {
            summary.put("tool_call", JSONObject.of(
                    "id", call.id(), //
                    "name", call.name(), //
                    "arguments", sensitive ? MASK : call.argumentsJson() //
            ));
        }
        return summary.toJSONString();
    }

    /**
     * 准备完成、持有租约的轮次
     */
    private record PreparedTurn(ConversationState state, ConversationState.Lease lease,
                                BackendCredentials credentials, String model,
                                QwenPayload payload) {}

    /**
     * 已打开后端流的轮次
     */
    private record StartedStream(PreparedTurn turn, BackendCall call) {

        void abandon() {
            call.cancel();
            turn.lease().close();
        }
    }
}
