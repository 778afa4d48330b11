package com.qwen.gateway.proxy;

import com.qwen.gateway.exception.BackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * 一次进行中的流式后端调用
 * <p>
 * 客户端断开（cancel）或超时看门狗（expire）会关闭响应体，阻塞中的读取随之结束
 */
public class BackendCall {

    private static final Logger log = LoggerFactory.getLogger(BackendCall.class);

    /**
     * 读取结束的方式
     */
    public enum Outcome {
        COMPLETED,
        // 连接正常关闭，但没有收到 status=finished
        TRUNCATED,
        CANCELLED,
        EXPIRED
    }

    private final InputStream body;
    private volatile boolean cancelled;
    private volatile boolean expired;
    private volatile boolean closed;

    public BackendCall(InputStream body) {
        this.body = body;
    }

    /**
     * 读取整个 SSE 流并分发事件（阻塞）
     *
     * @throws BackendException 读取过程中连接异常
     */
    public Outcome pump(StreamCallback callback) {
        SseEventParser parser = new SseEventParser(callback);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (cancelled) return Outcome.CANCELLED;
                if (expired) return Outcome.EXPIRED;
                parser.feedLine(line);
            }
            parser.finish();
        } catch (IOException e) {
            if (cancelled) return Outcome.CANCELLED;
            if (expired) return Outcome.EXPIRED;
            throw BackendException.unavailable(e);
        } finally {
            closed = true;
        }
        if (cancelled) return Outcome.CANCELLED;
        if (expired) return Outcome.EXPIRED;
        return parser.isFinished() ? Outcome.COMPLETED : Outcome.TRUNCATED;
    }

    /**
     * 客户端断开
     */
    public void cancel() {
        if (closed) return;
        cancelled = true;
        closeBody();
    }

    /**
     * 超时看门狗触发
     */
    public void expire() {
        if (closed) return;
        expired = true;
        closeBody();
    }

    private void closeBody() {
        try {
            body.close();
        } catch (IOException e) {
            log.debug("关闭后端响应流失败: {}", e.getMessage());
        }
    }
}
