package com.qwen.gateway.trace;

import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.qwen.gateway.dao.RequestDAO;
import com.qwen.gateway.dao.ResponseDAO;
import com.qwen.gateway.dto.chat.TurnUsage;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 轮次审计存储
 * <p>
 * 单线程异步写入 SQLite，写入失败只记日志
 */
@Component
public class TraceStore implements TurnRecorder {

    private static final Logger log = LoggerFactory.getLogger(TraceStore.class);

    private final RequestDAO requestDAO;
    private final ResponseDAO responseDAO;
    private final ExecutorService writer = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "trace-writer");
        t.setDaemon(true);
        return t;
    });

    public TraceStore(RequestDAO requestDAO, ResponseDAO responseDAO) {
        this.requestDAO = requestDAO;
        this.responseDAO = responseDAO;
    }

    @Override
    public void recordTurn(String turnId, String conversationId, String request, String backendRequest) {
        submit(turnId, () -> requestDAO.insert(turnId, conversationId, modelOf(backendRequest),
                streamOf(backendRequest), request, backendRequest));
    }

    @Override
    public void recordResult(String turnId, String response, String tailPointer, TurnUsage usage,
                             long durationMs, String error) {
        TurnUsage u = usage != null ? usage : TurnUsage.EMPTY;
        submit(turnId, () -> responseDAO.insert(turnId, response, tailPointer,
                u.promptTokens(), u.completionTokens(), u.totalTokens(), durationMs, error));
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        writer.shutdown();
        if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
            log.warn("审计写入线程未在 5 秒内结束，剩余记录丢弃");
            writer.shutdownNow();
        }
    }

    private void submit(String turnId, Runnable task) {
        try {
            writer.execute(() -> {
                try {
                    task.run();
                } catch (Exception e) {
                    log.error("持久化审计记录失败: turnId={}", turnId, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("审计写入队列已关闭，丢弃记录: turnId={}", turnId);
        }
    }

    private String modelOf(String backendRequest) {
        if (backendRequest == null) return null;
        try {
            return JSONObject.parseObject(backendRequest).getString("model");
        } catch (JSONException e) {
            return null;
        }
    }

    private boolean streamOf(String backendRequest) {
        if (backendRequest == null) return false;
        try {
            return JSONObject.parseObject(backendRequest).getBooleanValue("stream", false);
        } catch (JSONException e) {
            return false;
        }
    }
}
