package com.qwen.gateway.dto.qwen;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;

import java.util.UUID;

/**
 * Qwen 请求载荷构建器
 * <p>
 * 只携带本轮新增的消息，历史由后端按 parent_id 链维护。
 * 消息里的 parentId / parent_id 是后端对同一字段的两种命名，都要带上
 */
public class QwenPayload {

    private final JSONObject root = new JSONObject();
    private final JSONArray messages = new JSONArray();

    private final String chatId;
    private final String parentId;
    private final String model;

    public QwenPayload(String chatId, String parentId, String model, boolean stream, String chatMode) {
        this.chatId = chatId;
        this.parentId = parentId;
        this.model = model;
        root.put("stream", stream);
        root.put("incremental_output", true);
        root.put("chat_id", chatId);
        root.put("chat_mode", chatMode);
        root.put("model", model);
        root.put("parent_id", parentId);
        root.put("messages", messages);
        root.put("timestamp", System.currentTimeMillis() / 1000);
    }

    /**
     * 添加 system 消息（仅会话首轮）
     */
    public QwenPayload addSystemMessage(String content) {
        messages.add(buildMessage("system", content));
        return this;
    }

    /**
     * 添加 user 消息
     */
    public QwenPayload addUserMessage(String content) {
        messages.add(buildMessage("user", content));
        return this;
    }

    private JSONObject buildMessage(String role, String content) {
        JSONObject msg = new JSONObject();
        msg.put("fid", UUID.randomUUID().toString());
        msg.put("parentId", parentId);
        msg.put("parent_id", parentId);
        msg.put("childrenIds", new JSONArray());
        msg.put("role", role);
        msg.put("content", content);
        msg.put("user_action", "chat");
        msg.put("files", new JSONArray());
        msg.put("timestamp", System.currentTimeMillis() / 1000);
        msg.put("models", JSONArray.of(model));
        msg.put("chat_type", "t2t");
        msg.put("sub_chat_type", "t2t");
        msg.put("feature_config", JSONObject.of(
                "thinking_enabled", false, //
                "output_schema", "phase" //
        ));
        msg.put("extra", JSONObject.of("meta", JSONObject.of("subChatType", "t2t")));
        return msg;
    }

    /**
     * 构建最终 JSON 字符串（保留 null 字段，parent_id 为 null 表示首轮）
     */
    public String toJsonString() {
        return root.toJSONString(JSONWriter.Feature.WriteNulls);
    }

    public JSONArray messages() {
        return messages;
    }

    public String chatId() {
        return chatId;
    }

    public String parentId() {
        return parentId;
    }

    public String model() {
        return model;
    }
}
