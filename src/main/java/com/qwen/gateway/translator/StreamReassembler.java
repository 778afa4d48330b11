package com.qwen.gateway.translator;

import com.alibaba.fastjson2.JSONObject;
import com.qwen.gateway.dto.chat.FinishReason;
import com.qwen.gateway.dto.chat.ToolCall;
import com.qwen.gateway.dto.chat.ToolDefinition;
import com.qwen.gateway.dto.chat.TurnUsage;
import com.qwen.gateway.exception.BackendException;
import com.qwen.gateway.exception.ExtractionException;
import com.qwen.gateway.exception.GatewayException;
import com.qwen.gateway.proxy.StreamCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 流式响应重组
 * <p>
 * 后端文本增量 → OpenAI chunk。调用块之前的文本即时转发，
 * 调用块内部静默缓冲，闭合后一次性发出完整的 tool_calls delta。
 * 每轮最多一个调用，调用之后的文本丢弃。
 * <p>
 * 状态：OPEN → CONTENT | TOOL_CALL → DONE，任意状态可进入 ERROR
 */
public class StreamReassembler implements StreamCallback {

    private static final Logger log = LoggerFactory.getLogger(StreamReassembler.class);

    /**
     * chunk 输出目标
     */
    public interface DeltaSink {

        void emit(JSONObject chunk);

        /**
         * 输出 [DONE]，之后不再有 chunk
         */
        void done();
    }

    enum State {
        OPEN,
        CONTENT,
        TOOL_CALL,
        DONE,
        ERROR
    }

    private final String completionId;
    private final long created = System.currentTimeMillis() / 1000;
    private final String model;
    private final ToolCallExtractor extractor;
    private final List<ToolDefinition> tools;
    private final OpenAiTranslator translator;
    private final DeltaSink sink;

    private final StringBuilder buffer = new StringBuilder();
    private final StringBuilder emittedContent = new StringBuilder();
    // buffer 中已处理到的位置
    private int emitted;
    private int callStart = -1;
    private State state = State.OPEN;
    private boolean roleSent;
    private boolean cancelled;

    private ToolCall toolCall;
    private String tailPointer;
    private TurnUsage usage = TurnUsage.EMPTY;
    private String errorCode;
    private String errorMessage;

    public StreamReassembler(String completionId, String model, ToolCallExtractor extractor,
                             List<ToolDefinition> tools, OpenAiTranslator translator, DeltaSink sink) {
        this.completionId = completionId;
        this.model = model;
        this.extractor = extractor;
        this.tools = tools != null ? tools : List.of();
        this.translator = translator;
        this.sink = sink;
    }

    // ==================== StreamCallback ====================

    @Override
    public synchronized void onResponseCreated(String chatId, String parentId, String responseId) {
        if (parentId != null && !parentId.isEmpty()) {
            this.tailPointer = parentId;
        }
    }

    @Override
    public synchronized void onText(String text) {
        if (!accepting() || toolCall != null || text == null || text.isEmpty()) {
            return;
        }
        buffer.append(text);
        scan();
    }

    @Override
    public synchronized void onUsage(int inputTokens, int outputTokens) {
        this.usage = TurnUsage.of(inputTokens, outputTokens);
    }

    @Override
    public synchronized void onError(String error) {
        fail(BackendException.rejected(error));
    }

    // ==================== 生命周期 ====================

    /**
     * 后端流正常结束：冲刷缓冲、发送结束 chunk、usage chunk 和 [DONE]
     */
    public synchronized void onComplete() {
        if (!accepting()) {
            return;
        }
        if (toolCall == null && emitted < buffer.length()) {
            // 未闭合的调用块按普通文本输出
            emitContent(buffer.substring(emitted));
            emitted = buffer.length();
        }
        FinishReason reason = toolCall != null ? FinishReason.TOOL_CALLS : FinishReason.STOP;
        emitChunk(null, null, reason);
        sink.emit(translator.toUsageChunk(completionId, created, model, usage));
        state = State.DONE;
        sink.done();
    }

    /**
     * 后端失败：发送错误对象和 finish_reason=error 的结束 chunk
     */
    public synchronized void fail(GatewayException e) {
        if (!accepting()) {
            return;
        }
        this.errorCode = e.getErrorCode();
        this.errorMessage = e.getMessage();
        sink.emit(translator.toErrorChunk(e.getMessage(), e.errorType(), e.getErrorCode()));
        emitChunk(null, null, FinishReason.ERROR);
        state = State.ERROR;
        sink.done();
    }

    /**
     * 客户端断开，停止转发
     */
    public synchronized void cancel() {
        cancelled = true;
    }

    // ==================== 扫描 ====================

    private void scan() {
        while (true) {
            if (state == State.TOOL_CALL) {
                int end = extractor.findCallEnd(buffer, callStart);
                if (end < 0) {
                    return;
                }
                String block = buffer.substring(callStart, end);
                try {
                    ToolCallExtractor.ExtractionResult result = extractor.extract(block, tools);
                    toolCall = result.call();
                    emitted = buffer.length();
                    emitChunk(null, translator.toolCallJson(toolCall, 0), null);
                    return;
                } catch (ExtractionException e) {
                    log.warn("调用块解析失败，按文本输出: {}", e.getMessage());
                    state = State.CONTENT;
                    emitContent(block);
                    emitted = end;
                    continue;
                }
            }

            int start = extractor.findCallStart(buffer, emitted);
            if (start >= 0) {
                emitContent(buffer.substring(emitted, start));
                emitted = start;
                callStart = start;
                state = State.TOOL_CALL;
                continue;
            }

            int safe = extractor.safeEnd(buffer, emitted);
            if (safe > emitted) {
                emitContent(buffer.substring(emitted, safe));
                emitted = safe;
            }
            return;
        }
    }

    private void emitContent(String text) {
        if (text.isEmpty()) return;
        if (state == State.OPEN) {
            state = State.CONTENT;
        }
        emittedContent.append(text);
        emitChunk(text, null, null);
    }

    private void emitChunk(String content, JSONObject toolCallDelta, FinishReason finishReason) {
        if (cancelled) return;
        JSONObject chunk = translator.toOpenAiStreamChunk(completionId, created, model,
                content, toolCallDelta, finishReason, !roleSent);
        roleSent = true;
        sink.emit(chunk);
    }

    private boolean accepting() {
        return !cancelled && state != State.DONE && state != State.ERROR;
    }

    // --- getter ---

    public synchronized String tailPointer() { return tailPointer; }
    public synchronized ToolCall toolCall() { return toolCall; }
    public synchronized TurnUsage usage() { return usage; }
    public synchronized String emittedContent() { return emittedContent.toString(); }
    public synchronized boolean failed() { return state == State.ERROR; }
    public synchronized String errorCode() { return errorCode; }
    public synchronized String errorMessage() { return errorMessage; }
    synchronized State state() { return state; }
}
