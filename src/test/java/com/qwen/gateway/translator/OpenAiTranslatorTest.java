package com.qwen.gateway.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.qwen.gateway.dto.chat.ChatRequest;
import com.qwen.gateway.dto.chat.ChatTurn;
import com.qwen.gateway.dto.chat.FinishReason;
import com.qwen.gateway.dto.chat.ParamType;
import com.qwen.gateway.dto.chat.Role;
import com.qwen.gateway.dto.chat.ToolCall;
import com.qwen.gateway.dto.chat.ToolDefinition;
import com.qwen.gateway.dto.chat.TurnUsage;
import com.qwen.gateway.exception.InvalidRequestException;
import com.qwen.gateway.exception.SchemaException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiTranslatorTest {

    private final OpenAiTranslator translator = new OpenAiTranslator();

    @Test
    void shouldParseMessagesToolsAndFlags() {
        JSONObject body = JSONObject.parseObject("""
                {
                  "model": "qwen3-max",
                  "stream": true,
                  "sensitive_tool_arguments": true,
                  "messages": [
                    {"role": "developer", "content": "Be brief."},
                    {"role": "user", "content": [{"type": "text", "text": "read a.txt"}, {"type": "image_url", "image_url": {"url": "http://x/y.png"}}]},
                    {"role": "assistant", "content": null, "tool_calls": [{"id": "call_1", "type": "function", "function": {"name": "read", "arguments": "{\\"path\\":\\"a.txt\\"}"}}]},
                    {"role": "tool", "tool_call_id": "call_1", "content": "hello"}
                  ],
                  "tools": [
                    {"type": "function", "function": {"name": "read", "description": "Read a file",
                      "parameters": {"type": "object", "properties": {"path": {"type": "string"}, "depth": {"type": "integer"}}, "required": ["path"]}}}
                  ]
                }
                """);

        ChatRequest request = translator.translate(body);

        assertThat(request.model()).isEqualTo("qwen3-max");
        assertThat(request.stream()).isTrue();
        assertThat(request.sensitiveArguments()).isTrue();
        assertThat(request.turns()).extracting(ChatTurn::role)
                .containsExactly(Role.SYSTEM, Role.USER, Role.ASSISTANT, Role.TOOL);
        assertThat(request.turns().get(1).content()).isEqualTo("read a.txt\n[image: http://x/y.png]");

        ChatTurn assistant = request.turns().get(2);
        assertThat(assistant.content()).isEmpty();
        assertThat(assistant.toolCalls()).hasSize(1);
        assertThat(assistant.toolCalls().get(0).arguments()).isEqualTo(Map.of("path", "a.txt"));

        ChatTurn tool = request.turns().get(3);
        assertThat(tool.toolResult().toolCallId()).isEqualTo("call_1");
        assertThat(tool.toolResult().output()).isEqualTo("hello");

        ToolDefinition read = request.tools().get(0);
        assertThat(read.name()).isEqualTo("read");
        assertThat(read.parameter("path").required()).isTrue();
        assertThat(read.parameter("depth").required()).isFalse();
        assertThat(read.parameter("depth").type()).isEqualTo(ParamType.INTEGER);
    }

    @Test
    void shouldKeepUnparsableToolArgumentsAsRaw() {
        JSONObject body = JSONObject.parseObject("""
                {"messages": [
                  {"role": "user", "content": "hi"},
                  {"role": "assistant", "content": "", "tool_calls": [{"id": "c", "function": {"name": "x", "arguments": "not json"}}]}
                ]}
                """);

        ChatRequest request = translator.translate(body);

        assertThat(request.stream()).isFalse();
        assertThat(request.turns().get(1).toolCalls().get(0).arguments()).isEqualTo(Map.of("raw", "not json"));
    }

    @Test
    void shouldRejectInvalidRequests() {
        assertThatThrownBy(() -> translator.translate(JSONObject.of("messages", new JSONArray())))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> translator.translate(JSONObject.parseObject("""
                {"messages": [{"role": "system", "content": "x"}]}
                """))).isInstanceOf(InvalidRequestException.class).hasMessageContaining("user");
        assertThatThrownBy(() -> translator.translate(JSONObject.parseObject("""
                {"messages": [{"role": "robot", "content": "x"}]}
                """))).isInstanceOf(InvalidRequestException.class).hasMessageContaining("robot");
        assertThatThrownBy(() -> translator.translate(JSONObject.parseObject("""
                {"messages": [{"role": "user", "content": "x"}, {"role": "tool", "content": "y"}]}
                """))).isInstanceOf(InvalidRequestException.class).hasMessageContaining("tool_call_id");
    }

    @Test
    void shouldRejectToolWithoutName() {
        JSONObject body = JSONObject.parseObject("""
                {"messages": [{"role": "user", "content": "x"}],
                 "tools": [{"type": "function", "function": {"description": "nameless"}}]}
                """);

        assertThatThrownBy(() -> translator.translate(body)).isInstanceOf(SchemaException.class);
    }

    @Test
    void shouldBuildResponseWithEmptyContentForToolCall() {
        ToolCall call = new ToolCall("call_1", "read", Map.of("path", "a.txt"));

        JSONObject response = translator.toOpenAiResponse("", call, TurnUsage.of(10, 5), "qwen3-max", FinishReason.TOOL_CALLS);

        JSONObject choice = response.getJSONArray("choices").getJSONObject(0);
        JSONObject message = choice.getJSONObject("message");
        assertThat(response.getString("object")).isEqualTo("chat.completion");
        assertThat(message.getString("content")).isEqualTo("");
        assertThat(choice.getString("finish_reason")).isEqualTo("tool_calls");
        JSONObject toolCall = message.getJSONArray("tool_calls").getJSONObject(0);
        assertThat(toolCall.getString("id")).isEqualTo("call_1");
        assertThat(toolCall.containsKey("index")).isFalse();
        assertThat(toolCall.getJSONObject("function").getString("arguments")).isEqualTo("{\"path\":\"a.txt\"}");
        assertThat(response.getJSONObject("usage").getIntValue("total_tokens")).isEqualTo(15);
    }

    @Test
    void shouldNeverEmitNullContent() {
        JSONObject response = translator.toOpenAiResponse(null, null, null, "m", null);

        JSONObject choice = response.getJSONArray("choices").getJSONObject(0);
        assertThat(choice.getJSONObject("message").getString("content")).isEqualTo("");
        assertThat(choice.getString("finish_reason")).isEqualTo("stop");
    }

    @Test
    void shouldBuildStreamAndUsageChunks() {
        JSONObject first = translator.toOpenAiStreamChunk("chatcmpl-1", 100L, "m", "Hi", null, null, true);
        JSONObject usage = translator.toUsageChunk("chatcmpl-1", 100L, "m", TurnUsage.of(3, 4));

        JSONObject delta = first.getJSONArray("choices").getJSONObject(0).getJSONObject("delta");
        assertThat(delta.getString("role")).isEqualTo("assistant");
        assertThat(delta.getString("content")).isEqualTo("Hi");
        assertThat(usage.getJSONArray("choices")).isEmpty();
        assertThat(usage.getJSONObject("usage").getIntValue("completion_tokens")).isEqualTo(4);
    }
}
