package com.qwen.gateway.proxy;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Qwen SSE 事件解析器
 * <p>
 * 逐行输入，解析 data: 行并分发到 {@link StreamCallback}
 * <pre>
 * data: {"response.created":{"chat_id":"..","parent_id":"..","response_id":".."}}
 * data: {"choices":[{"delta":{"content":"..","status":"typing","phase":"answer"}}],"usage":{..}}
 * data: {"choices":[{"delta":{"content":"","status":"finished"}}]}
 * </pre>
 */
public class SseEventParser {

    private static final Logger log = LoggerFactory.getLogger(SseEventParser.class);

    private final StreamCallback callback;
    private final StringBuilder pending = new StringBuilder();
    private boolean finished;

    public SseEventParser(StreamCallback callback) {
        this.callback = callback;
    }

    /**
     * 输入一段原始文本（可能包含不完整的行）
     */
    public void feed(String chunk) {
        pending.append(chunk);
        int newline;
        while ((newline = pending.indexOf("\n")) >= 0) {
            String line = pending.substring(0, newline);
            pending.delete(0, newline + 1);
            feedLine(line);
        }
    }

    /**
     * 输入一整行
     */
    public void feedLine(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith(":")) {
            return;
        }

        String data;
        if (trimmed.startsWith("data:")) {
            data = trimmed.substring(5).trim();
        } else if (trimmed.startsWith("{")) {
            // 错误时后端可能直接返回 JSON 行
            data = trimmed;
        } else {
            return;
        }
        if (data.isEmpty() || "[DONE]".equals(data)) {
            return;
        }

        try {
            handleEvent(JSONObject.parseObject(data));
        } catch (JSONException e) {
            log.warn("SSE 行解析失败，已跳过: {}", abbreviate(data));
        }
    }

    /**
     * 流结束，处理末尾未换行的数据
     */
    public void finish() {
        if (!pending.isEmpty()) {
            String line = pending.toString();
            pending.setLength(0);
            feedLine(line);
        }
    }

    /**
     * 是否收到 status=finished
     */
    public boolean isFinished() {
        return finished;
    }

    private void handleEvent(JSONObject event) {
        if (event == null) return;

        JSONObject created = event.getJSONObject("response.created");
        if (created != null) {
            callback.onResponseCreated(created.getString("chat_id"),
                    created.getString("parent_id"), created.getString("response_id"));
            return;
        }

        if (event.containsKey("error")) {
            Object error = event.get("error");
            callback.onError(error instanceof JSONObject obj && obj.getString("message") != null
                    ? obj.getString("message")
                    : String.valueOf(error));
            return;
        }
        if (Boolean.FALSE.equals(event.getBoolean("success"))) {
            JSONObject data = event.getJSONObject("data");
            callback.onError(data != null && data.getString("code") != null ? data.getString("code") : event.toJSONString());
            return;
        }

        JSONObject usage = event.getJSONObject("usage");
        if (usage != null) {
            callback.onUsage(usage.getIntValue("input_tokens"), usage.getIntValue("output_tokens"));
        }

        JSONArray choices = event.getJSONArray("choices");
        if (choices == null || choices.isEmpty()) return;
        JSONObject delta = choices.getJSONObject(0).getJSONObject("delta");
        if (delta == null) return;

        String phase = delta.getString("phase");
        String content = delta.getString("content");
        if (content != null && !content.isEmpty()) {
            if (phase == null || "answer".equals(phase)) {
                callback.onText(content);
            } else {
                log.debug("忽略非 answer 阶段内容: phase={}", phase);
            }
        }
        if ("finished".equals(delta.getString("status"))) {
            finished = true;
        }
    }

    private String abbreviate(String s) {
        return s.length() > 200 ? s.substring(0, 200) + "..." : s;
    }
}
