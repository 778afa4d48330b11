package com.qwen.gateway.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.qwen.gateway.dto.chat.ChatRequest;
import com.qwen.gateway.dto.chat.ChatTurn;
import com.qwen.gateway.dto.chat.FinishReason;
import com.qwen.gateway.dto.chat.Role;
import com.qwen.gateway.dto.chat.ToolCall;
import com.qwen.gateway.dto.chat.ToolDefinition;
import com.qwen.gateway.dto.chat.ToolParameter;
import com.qwen.gateway.dto.chat.ToolResult;
import com.qwen.gateway.dto.chat.TurnUsage;
import com.qwen.gateway.exception.InvalidRequestException;
import com.qwen.gateway.exception.SchemaException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * OpenAI Chat Completions 协议转换
 * <p>
 * 请求方向解析为 {@link ChatRequest}，响应方向构建 completion / chunk 对象
 */
@Component
public class OpenAiTranslator implements RequestTranslator {

    @Override
    public ChatRequest translate(JSONObject request) {
        if (request == null) {
            throw new InvalidRequestException("请求体不能为空");
        }
        JSONArray messages;
        try {
            messages = request.getJSONArray("messages");
        } catch (JSONException e) {
            throw new InvalidRequestException("messages 必须是数组");
        }
        if (messages == null || messages.isEmpty()) {
            throw new InvalidRequestException("消息数组不能为空");
        }

        List<ChatTurn> turns = new ArrayList<>();
        boolean hasUser = false;
        for (int i = 0; i < messages.size(); i++) {
            JSONObject msg = messages.getJSONObject(i);
            if (msg == null) {
                throw new InvalidRequestException("第 " + (i + 1) + " 条消息不是对象");
            }
            ChatTurn turn = parseTurn(msg, i);
            hasUser |= turn.role() == Role.USER;
            turns.add(turn);
        }
        if (!hasUser) {
            throw new InvalidRequestException("至少需要一条 user 消息");
        }

        return new ChatRequest(
                request.getString("model"),
                request.getBooleanValue("stream", false),
                turns,
                parseTools(request.getJSONArray("tools")),
                request.getBooleanValue("sensitive_tool_arguments", false));
    }

    /**
     * 构建非流式 Chat Completion
     *
     * @param content 文本内容，有工具调用时应为空串
     * @param call    工具调用，可为 null
     */
    public JSONObject toOpenAiResponse(String content, ToolCall call, TurnUsage usage,
                                       String model, FinishReason finishReason) {
        JSONObject message = JSONObject.of(
                "role", "assistant", //
                "content", content != null ? content : "" //
        );
        if (call != null) {
            message.put("tool_calls", JSONArray.of(toolCallJson(call, null)));
        }

        JSONObject choice = JSONObject.of(
                "index", 0, //
                "message", message, //
                "finish_reason", (finishReason != null ? finishReason : FinishReason.STOP).wireName() //
        );

        TurnUsage u = usage != null ? usage : TurnUsage.EMPTY;
        JSONObject result = new JSONObject();
        result.put("id", newCompletionId());
        result.put("object", "chat.completion");
        result.put("created", System.currentTimeMillis() / 1000);
        result.put("model", model);
        result.put("choices", JSONArray.of(choice));
        result.put("usage", usageJson(u));
        return result;
    }

    /**
     * 构建 SSE chunk（流式）
     *
     * @param includeRole 是否携带 role（仅首个 delta）
     */
    public JSONObject toOpenAiStreamChunk(String completionId, long created, String model,
                                          String deltaContent, JSONObject toolCallDelta,
                                          FinishReason finishReason, boolean includeRole) {
        JSONObject delta = new JSONObject();
        if (includeRole) {
            delta.put("role", "assistant");
        }
        if (deltaContent != null) {
            delta.put("content", deltaContent);
        }
        if (toolCallDelta != null) {
            delta.put("tool_calls", JSONArray.of(toolCallDelta));
        }

        JSONObject choice = JSONObject.of(
                "index", 0, //
                "delta", delta //
        );
        choice.put("finish_reason", finishReason != null ? finishReason.wireName() : null);

        return JSONObject.of(
                "id", completionId, //
                "object", "chat.completion.chunk", //
                "created", created, //
                "model", model, //
                "choices", JSONArray.of(choice) //
        );
    }

    /**
     * 流末尾的 usage chunk，choices 为空数组
     */
    public JSONObject toUsageChunk(String completionId, long created, String model, TurnUsage usage) {
        return JSONObject.of(
                "id", completionId, //
                "object", "chat.completion.chunk", //
                "created", created, //
                "model", model, //
                "choices", new JSONArray(), //
                "usage", usageJson(usage != null ? usage : TurnUsage.EMPTY) //
        );
    }

    /**
     * 流中途失败时发送的错误对象
     */
    public JSONObject toErrorChunk(String message, String type, String code) {
        return JSONObject.of("error", JSONObject.of(
                "message", message, //
                "type", type, //
                "code", code //
        ));
    }

    /**
     * OpenAI tool_calls 元素
     *
     * @param index 流式 delta 需要 index，非流式传 null
     */
    public JSONObject toolCallJson(ToolCall call, Integer index) {
        JSONObject json = new JSONObject();
        if (index != null) {
            json.put("index", index);
        }
        json.put("id", call.id());
        json.put("type", "function");
        json.put("function", JSONObject.of(
                "name", call.name(), //
                "arguments", call.argumentsJson() //
        ));
        return json;
    }

    public static String newCompletionId() {
        return "chatcmpl-" + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }

    // ==================== 辅助方法 ====================

    private ChatTurn parseTurn(JSONObject msg, int index) {
        String roleName = msg.getString("role");
        Role role = Role.fromWire(roleName);
        if (role == null) {
            throw new InvalidRequestException("第 " + (index + 1) + " 条消息角色不支持: " + roleName);
        }
        return switch (role) {
            case SYSTEM -> ChatTurn.system(extractText(msg.get("content")));
            case USER -> ChatTurn.user(extractUserText(msg.get("content")));
            case ASSISTANT -> ChatTurn.assistant(extractText(msg.get("content")), parseToolCalls(msg.getJSONArray("tool_calls")));
            case TOOL -> {
                String toolCallId = msg.getString("tool_call_id");
                if (toolCallId == null || toolCallId.isEmpty()) {
                    throw new InvalidRequestException("第 " + (index + 1) + " 条 tool 消息缺少 tool_call_id");
                }
                yield ChatTurn.tool(new ToolResult(toolCallId, extractText(msg.get("content"))));
            }
        };
    }

    private List<ToolCall> parseToolCalls(JSONArray toolCalls) {
        if (toolCalls == null || toolCalls.isEmpty()) return List.of();
        List<ToolCall> result = new ArrayList<>();
        for (int i = 0; i < toolCalls.size(); i++) {
            JSONObject tc = toolCalls.getJSONObject(i);
            JSONObject function = tc != null ? tc.getJSONObject("function") : null;
            if (function == null) continue;
            String raw = function.getString("arguments");
            Map<String, Object> arguments;
            try {
                JSONObject parsed = raw == null || raw.isBlank() ? new JSONObject() : JSONObject.parseObject(raw);
                arguments = parsed != null ? new LinkedHashMap<>(parsed) : Map.of();
            } catch (JSONException e) {
                arguments = Map.of("raw", raw);
            }
            result.add(new ToolCall(tc.getString("id"), function.getString("name"), arguments));
        }
        return result;
    }

    private List<ToolDefinition> parseTools(JSONArray tools) {
        if (tools == null || tools.isEmpty()) return List.of();
        List<ToolDefinition> result = new ArrayList<>();
        for (int i = 0; i < tools.size(); i++) {
            JSONObject tool = tools.getJSONObject(i);
            if (tool == null || !"function".equals(tool.getString("type"))) continue;

            JSONObject function = tool.getJSONObject("function");
            String name = function != null ? function.getString("name") : null;
            if (name == null || name.isBlank()) {
                throw new SchemaException("第 " + (i + 1) + " 个工具缺少名称");
            }
            JSONObject parameters = function.getJSONObject("parameters");
            result.add(new ToolDefinition(name, function.getString("description"),
                    ToolParameter.propertiesOf(parameters)));
        }
        return result;
    }

    private JSONObject usageJson(TurnUsage usage) {
        return JSONObject.of(
                "prompt_tokens", usage.promptTokens(), //
                "completion_tokens", usage.completionTokens(), //
                "total_tokens", usage.totalTokens() //
        );
    }

    private String extractUserText(Object content) {
        if (content == null) return "";
        if (content instanceof String s) return s;
        if (content instanceof JSONArray arr) {
            List<String> parts = new ArrayList<>();
            for (int i = 0; i < arr.size(); i++) {
                JSONObject block = arr.getJSONObject(i);
                if (block == null) continue;
                String type = block.getString("type");
                if ("text".equals(type)) {
                    parts.add(block.getString("text"));
                } else if ("image_url".equals(type)) {
                    JSONObject imageUrl = block.getJSONObject("image_url");
                    if (imageUrl != null) {
                        parts.add("[image: " + imageUrl.getString("url") + "]");
                    }
                }
            }
            return String.join("\n", parts);
        }
        return content.toString();
    }

    private String extractText(Object content) {
        if (content == null) return "";
        if (content instanceof String s) return s;
        if (content instanceof JSONArray arr) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < arr.size(); i++) {
                JSONObject block = arr.getJSONObject(i);
                if (block != null && block.containsKey("text")) {
                    if (!sb.isEmpty()) sb.append("\n");
                    sb.append(block.getString("text"));
                }
            }
            return sb.toString();
        }
        return content.toString();
    }
}
