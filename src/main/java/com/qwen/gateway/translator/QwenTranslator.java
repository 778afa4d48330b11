package com.qwen.gateway.translator;

import com.qwen.gateway.config.AppProperties;
import com.qwen.gateway.dto.chat.ChatRequest;
import com.qwen.gateway.dto.chat.ChatTurn;
import com.qwen.gateway.dto.chat.Role;
import com.qwen.gateway.dto.chat.ToolCall;
import com.qwen.gateway.dto.qwen.QwenPayload;
import com.qwen.gateway.session.ContinuityManager;
import com.qwen.gateway.session.ConversationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * ChatRequest → Qwen 请求载荷
 * <p>
 * 后端按 parent_id 链保存历史，每轮只发送最后一个 assistant 之后新增的 user/tool 轮次，
 * 合并为一条 user 消息。system 指令（含工具说明）只在会话首轮发送
 */
@Component
public class QwenTranslator {

    private static final Logger log = LoggerFactory.getLogger(QwenTranslator.class);

    static final String CONTINUE_PROMPT = "continue";
    static final String HISTORY_HEADER = "Previous conversation:";
    static final String CURRENT_HEADER = "Current message:";

    private final ToolSchemaTransformer schemaTransformer;
    private final ToolResultTransformer resultTransformer;
    private final AppProperties properties;

    public QwenTranslator(ToolSchemaTransformer schemaTransformer,
                          ToolResultTransformer resultTransformer,
                          AppProperties properties) {
        this.schemaTransformer = schemaTransformer;
        this.resultTransformer = resultTransformer;
        this.properties = properties;
    }

    /**
     * 构建本轮的后端载荷
     *
     * @param state 已绑定 chatId 的会话状态
     * @param model 实际使用的模型
     */
    public QwenPayload buildPayload(ChatRequest request, ConversationState state, String model) {
        String tail = state.tailPointer();
        QwenPayload payload = new QwenPayload(state.chatId(), tail, model, request.stream(),
                properties.getBackend().getChatMode());

        List<ChatTurn> turns = request.turns();
        int lastAssistant = -1;
        for (int i = turns.size() - 1; i >= 0; i--) {
            if (turns.get(i).role() == Role.ASSISTANT) {
                lastAssistant = i;
                break;
            }
        }

        if (tail == null) {
            String system = systemInstructions(request);
            if (!system.isEmpty()) {
                payload.addSystemMessage(system);
            }
        }

        String current = mergeTrailing(turns, lastAssistant + 1);
        // 后端还没有这段历史（网关重启或会话被清理），把历史拼成文字补上
        if (tail == null && lastAssistant >= 0) {
            log.info("会话首轮但请求已含历史，以文本形式重放: conversationId={}, turns={}",
                    ContinuityManager.shortId(state.conversationId()), lastAssistant + 1);
            current = transcript(turns, lastAssistant + 1) + "\n\n" + CURRENT_HEADER + "\n" + current;
        }
        payload.addUserMessage(current);
        return payload;
    }

    // ==================== 辅助方法 ====================

    private String systemInstructions(ChatRequest request) {
        List<String> parts = new ArrayList<>();
        for (ChatTurn turn : request.turns()) {
            if (turn.role() == Role.SYSTEM && !turn.content().isBlank()) {
                parts.add(turn.content());
            }
        }
        String system = String.join("\n\n", parts);
        if (request.hasTools()) {
            return schemaTransformer.injectInto(system, request.tools());
        }
        return system;
    }

    /**
     * 合并 from 之后的 user/tool 轮次
     */
    private String mergeTrailing(List<ChatTurn> turns, int from) {
        List<String> parts = new ArrayList<>();
        for (int i = from; i < turns.size(); i++) {
            ChatTurn turn = turns.get(i);
            if (turn.role() == Role.USER) {
                if (!turn.content().isEmpty()) parts.add(turn.content());
            } else if (turn.role() == Role.TOOL) {
                parts.add(toolTurn(turns, turn).content());
            }
        }
        return parts.isEmpty() ? CONTINUE_PROMPT : String.join("\n\n", parts);
    }

    private String transcript(List<ChatTurn> turns, int end) {
        StringBuilder sb = new StringBuilder(HISTORY_HEADER);
        for (int i = 0; i < end; i++) {
            ChatTurn turn = turns.get(i);
            switch (turn.role()) {
                case USER -> sb.append("\n\nUser: ").append(turn.content());
                case TOOL -> sb.append("\n\nUser: ").append(toolTurn(turns, turn).content());
                case ASSISTANT -> {
                    sb.append("\n\nAssistant: ").append(turn.content());
                    for (ToolCall call : turn.toolCalls()) {
                        sb.append("\n").append(schemaTransformer.renderCall(call.name(), call.arguments()));
                    }
                }
                default -> {
                    // system 已单独发送
                }
            }
        }
        return sb.toString();
    }

    private ChatTurn toolTurn(List<ChatTurn> turns, ChatTurn turn) {
        String name = resultTransformer.resolveToolName(turns, turn.toolResult().toolCallId());
        return resultTransformer.transform(turn.toolResult(), name);
    }
}
