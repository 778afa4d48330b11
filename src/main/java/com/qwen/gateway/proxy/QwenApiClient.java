package com.qwen.gateway.proxy;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.qwen.gateway.auth.BackendCredentials;
import com.qwen.gateway.config.AppProperties;
import com.qwen.gateway.dto.chat.TurnUsage;
import com.qwen.gateway.dto.qwen.QwenCompletion;
import com.qwen.gateway.dto.qwen.QwenPayload;
import com.qwen.gateway.exception.BackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Qwen API 客户端
 * <p>
 * 不做任何自动重试，失败直接以 {@link BackendException} 抛给调用方
 */
@Component
public class QwenApiClient {

    private static final Logger log = LoggerFactory.getLogger(QwenApiClient.class);

    private final HttpClient httpClient;
    private final AppProperties properties;

    public QwenApiClient(HttpClient qwenHttpClient, AppProperties properties) {
        this.httpClient = qwenHttpClient;
        this.properties = properties;
    }

    /**
     * 创建新的后端会话
     *
     * @return chat id
     */
    public String createChat(BackendCredentials credentials, String model) {
        JSONObject body = JSONObject.of(
                "title", "New Chat", //
                "models", JSONArray.of(model), //
                "chat_mode", properties.getBackend().getChatMode(), //
                "chat_type", "t2t", //
                "timestamp", System.currentTimeMillis() //
        );
        HttpRequest request = requestBuilder(credentials, "/api/v2/chats/new", true)
                .timeout(timeout())
                .POST(HttpRequest.BodyPublishers.ofString(body.toJSONString()))
                .build();

        String responseBody = sendForString(request);
        JSONObject json = parseJson(responseBody);
        JSONObject data = json.getJSONObject("data");
        if (!json.getBooleanValue("success", true) || data == null || data.getString("id") == null) {
            throw BackendException.rejected("创建会话失败: " + abbreviate(responseBody));
        }
        String chatId = data.getString("id");
        log.info("Qwen 会话已创建: chatId={}, model={}", chatId, model);
        return chatId;
    }

    /**
     * 发起流式调用，状态码校验通过后返回可读取的调用句柄
     */
    public BackendCall openStream(QwenPayload payload, BackendCredentials credentials) {
        HttpRequest request = completionRequest(payload, credentials);
        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (HttpTimeoutException e) {
            throw BackendException.timeout(properties.getBackend().getTimeoutMs());
        } catch (IOException e) {
            throw BackendException.unavailable(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw BackendException.unavailable(e);
        }

        int status = response.statusCode();
        if (status != 200) {
            throw BackendException.fromStatus(status, readBody(response.body()));
        }
        // 业务错误时后端返回 200 + JSON 而不是 SSE
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        if (contentType.contains("application/json")) {
            throw BackendException.rejected(abbreviate(readBody(response.body())));
        }
        return new BackendCall(response.body());
    }

    /**
     * 非流式调用，整个调用受总超时约束
     */
    public QwenCompletion send(QwenPayload payload, BackendCredentials credentials) {
        HttpRequest request = completionRequest(payload, credentials);
        long timeoutMs = properties.getBackend().getTimeoutMs();

        CompletableFuture<HttpResponse<String>> future =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        HttpResponse<String> response;
        try {
            response = future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw BackendException.timeout(timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof HttpTimeoutException) {
                throw BackendException.timeout(timeoutMs);
            }
            throw BackendException.unavailable(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw BackendException.unavailable(e);
        }

        if (response.statusCode() != 200) {
            throw BackendException.fromStatus(response.statusCode(), response.body());
        }
        return parseCompletion(response.body());
    }

    /**
     * 解析非流式响应
     * <p>
     * 正常为 {"success":true,"data":{...}}；部分情况下后端仍返回 SSE 文本，按流解析
     */
    public QwenCompletion parseCompletion(String body) {
        String trimmed = body == null ? "" : body.trim();
        if (trimmed.startsWith("{")) {
            JSONObject json = parseJson(trimmed);
            if (!json.getBooleanValue("success", true)) {
                throw BackendException.rejected(abbreviate(trimmed));
            }
            JSONObject data = json.getJSONObject("data");
            if (data == null) {
                throw BackendException.rejected("响应缺少 data: " + abbreviate(trimmed));
            }
            String content = "";
            JSONArray choices = data.getJSONArray("choices");
            if (choices != null && !choices.isEmpty()) {
                JSONObject message = choices.getJSONObject(0).getJSONObject("message");
                if (message != null && message.getString("content") != null) {
                    content = message.getString("content");
                }
            }
            return new QwenCompletion(content, data.getString("parent_id"),
                    data.getString("message_id"), usageOf(data.getJSONObject("usage")));
        }

        CollectingCallback collector = new CollectingCallback();
        SseEventParser parser = new SseEventParser(collector);
        parser.feed(trimmed);
        parser.finish();
        if (collector.error != null) {
            throw BackendException.rejected(collector.error);
        }
        return new QwenCompletion(collector.content.toString(), collector.parentId,
                collector.responseId, collector.usage);
    }

    /**
     * 查询后端可用模型
     *
     * @return 失败时返回空列表
     */
    public List<ModelInfo> listModels(BackendCredentials credentials) {
        try {
            HttpRequest request = requestBuilder(credentials, "/api/models", false)
                    .timeout(timeout())
                    .GET()
                    .build();
            JSONObject json = parseJson(sendForString(request));
            JSONArray data = json.getJSONArray("data");
            List<ModelInfo> models = new ArrayList<>();
            if (data != null) {
                for (int i = 0; i < data.size(); i++) {
                    JSONObject m = data.getJSONObject(i);
                    if (m == null || m.getString("id") == null) continue;
                    models.add(new ModelInfo(m.getString("id"),
                            m.getString("name") != null ? m.getString("name") : m.getString("id")));
                }
            }
            return models;
        } catch (BackendException e) {
            log.warn("获取 Qwen 模型列表失败: {}", e.getMessage());
            return List.of();
        }
    }

    // ==================== 辅助方法 ====================

    private HttpRequest completionRequest(QwenPayload payload, BackendCredentials credentials) {
        String path = "/api/v2/chat/completions?chat_id=" + URLEncoder.encode(payload.chatId(), StandardCharsets.UTF_8);
        return requestBuilder(credentials, path, true)
                .timeout(timeout())
                .POST(HttpRequest.BodyPublishers.ofString(payload.toJsonString()))
                .build();
    }

    private HttpRequest.Builder requestBuilder(BackendCredentials credentials, String path, boolean withToken) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(credentials.baseUrl() + path))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json, text/event-stream")
                .header("User-Agent", credentials.userAgent());
        // 模型列表接口只需要 Cookie
        if (withToken && credentials.token() != null && !credentials.token().isEmpty()) {
            builder.header("bx-umidtoken", credentials.token());
        }
        if (credentials.cookies() != null && !credentials.cookies().isEmpty()) {
            builder.header("Cookie", credentials.cookies());
        }
        return builder;
    }

    private String sendForString(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw BackendException.timeout(properties.getBackend().getTimeoutMs());
        } catch (IOException e) {
            throw BackendException.unavailable(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw BackendException.unavailable(e);
        }
        if (response.statusCode() != 200) {
            throw BackendException.fromStatus(response.statusCode(), response.body());
        }
        return response.body();
    }

    private JSONObject parseJson(String body) {
        try {
            JSONObject json = JSONObject.parseObject(body);
            if (json == null) {
                throw BackendException.rejected("空响应");
            }
            return json;
        } catch (JSONException e) {
            throw BackendException.rejected("响应不是合法 JSON: " + abbreviate(body));
        }
    }

    private TurnUsage usageOf(JSONObject usage) {
        if (usage == null) return TurnUsage.EMPTY;
        return TurnUsage.of(usage.getIntValue("input_tokens"), usage.getIntValue("output_tokens"));
    }

    private Duration timeout() {
        return Duration.ofMillis(properties.getBackend().getTimeoutMs());
    }

    private String readBody(InputStream body) {
        try (InputStream is = body) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "读取响应体失败: " + e.getMessage();
        }
    }

    private String abbreviate(String s) {
        if (s == null) return "";
        return s.length() > 200 ? s.substring(0, 200) + "..." : s;
    }

    /**
     * 非流式 SSE 回退解析时收集内容
     */
    private static class CollectingCallback implements StreamCallback {

        private final StringBuilder content = new StringBuilder();
        private String parentId;
        private String responseId;
        private TurnUsage usage = TurnUsage.EMPTY;
        private String error;

        @Override
        public void onResponseCreated(String chatId, String parentId, String responseId) {
            this.parentId = parentId;
            this.responseId = responseId;
        }

        @Override
        public void onText(String text) {
            content.append(text);
        }

        @Override
        public void onUsage(int inputTokens, int outputTokens) {
            usage = TurnUsage.of(inputTokens, outputTokens);
        }

        @Override
        public void onError(String error) {
            this.error = error;
        }
    }

    /**
     * 模型信息
     */
    public record ModelInfo(String id, String name) {}
}
