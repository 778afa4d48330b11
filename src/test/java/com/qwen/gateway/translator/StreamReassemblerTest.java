package com.qwen.gateway.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.qwen.gateway.dto.chat.ParamType;
import com.qwen.gateway.dto.chat.ToolDefinition;
import com.qwen.gateway.dto.chat.ToolParameter;
import com.qwen.gateway.exception.BackendException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StreamReassemblerTest {

    private static final String CALL_TEXT = "I'll read it.\n<call>\n<name>read</name>\n<args>\n<path>/tmp/a.txt</path>\n</args>\n</call>";

    private final List<ToolDefinition> tools = List.of(new ToolDefinition("read", "Read a file",
            List.of(ToolParameter.of("path", ParamType.STRING, true, null))));

    @Test
    void shouldEmitContentThenSingleToolCallAcrossTwoFragments() {
        CollectingSink sink = new CollectingSink();
        StreamReassembler reassembler = newReassembler(sink);

        reassembler.onResponseCreated("chat-1", "msg-1", "resp-1");
        reassembler.onText("I'll read it.\n<call>\n<name>read</name>\n<args>\n<path>/tmp/");
        reassembler.onText("a.txt</path>\n</args>\n</call>");
        reassembler.onUsage(12, 8);
        reassembler.onComplete();

        assertThat(sink.content()).isEqualTo("I'll read it.\n");
        List<JSONObject> calls = sink.toolCalls();
        assertThat(calls).hasSize(1);
        JSONObject call = calls.get(0);
        assertThat(call.getIntValue("index")).isEqualTo(0);
        assertThat(call.getString("id")).isEqualTo("call_fixed");
        assertThat(call.getString("type")).isEqualTo("function");
        assertThat(call.getJSONObject("function").getString("name")).isEqualTo("read");
        assertThat(call.getJSONObject("function").getString("arguments")).isEqualTo("{\"path\":\"/tmp/a.txt\"}");

        assertThat(sink.finishReasons()).containsExactly("tool_calls");
        JSONObject usage = sink.chunks.get(sink.chunks.size() - 1);
        assertThat(usage.getJSONArray("choices")).isEmpty();
        assertThat(usage.getJSONObject("usage").getIntValue("total_tokens")).isEqualTo(20);
        assertThat(sink.doneCount).isEqualTo(1);
        assertThat(reassembler.tailPointer()).isEqualTo("msg-1");
        assertThat(reassembler.emittedContent()).isEqualTo("I'll read it.\n");
    }

    @Test
    void shouldProduceSameResultForEverySplitPoint() {
        CollectingSink whole = new CollectingSink();
        StreamReassembler single = newReassembler(whole);
        single.onText(CALL_TEXT);
        single.onComplete();

        for (int split = 1; split < CALL_TEXT.length(); split++) {
            CollectingSink sink = new CollectingSink();
            StreamReassembler reassembler = newReassembler(sink);
            reassembler.onText(CALL_TEXT.substring(0, split));
            reassembler.onText(CALL_TEXT.substring(split));
            reassembler.onComplete();

            assertThat(sink.content()).as("split at %d", split).isEqualTo(whole.content());
            assertThat(sink.toolCalls()).as("split at %d", split).isEqualTo(whole.toolCalls());
            assertThat(sink.finishReasons()).as("split at %d", split).isEqualTo(whole.finishReasons());
        }
    }

    @Test
    void shouldProduceSameResultForCharacterByCharacterStream() {
        CollectingSink whole = new CollectingSink();
        StreamReassembler single = newReassembler(whole);
        single.onText(CALL_TEXT);
        single.onComplete();

        CollectingSink sink = new CollectingSink();
        StreamReassembler reassembler = newReassembler(sink);
        for (char c : CALL_TEXT.toCharArray()) {
            reassembler.onText(String.valueOf(c));
        }
        reassembler.onComplete();

        assertThat(sink.content()).isEqualTo(whole.content());
        assertThat(sink.toolCalls()).isEqualTo(whole.toolCalls());
    }

    @Test
    void shouldNeverCarryContentAndToolCallsInOneChunk() {
        CollectingSink sink = new CollectingSink();
        StreamReassembler reassembler = newReassembler(sink);
        reassembler.onText(CALL_TEXT);
        reassembler.onComplete();

        for (JSONObject chunk : sink.chunks) {
            JSONArray choices = chunk.getJSONArray("choices");
            if (choices == null || choices.isEmpty()) continue;
            JSONObject delta = choices.getJSONObject(0).getJSONObject("delta");
            assertThat(delta.containsKey("content") && delta.containsKey("tool_calls")).isFalse();
        }
    }

    @Test
    void shouldStreamPlainTextAndFinishWithStop() {
        CollectingSink sink = new CollectingSink();
        StreamReassembler reassembler = newReassembler(sink);

        reassembler.onText("Hello ");
        reassembler.onText("a < b <ca");
        reassembler.onText("t");
        reassembler.onComplete();

        assertThat(sink.content()).isEqualTo("Hello a < b <cat");
        assertThat(sink.toolCalls()).isEmpty();
        assertThat(sink.finishReasons()).containsExactly("stop");
        JSONObject first = sink.chunks.get(0).getJSONArray("choices").getJSONObject(0).getJSONObject("delta");
        assertThat(first.getString("role")).isEqualTo("assistant");
    }

    @Test
    void shouldFlushUnclosedCallAsContent() {
        CollectingSink sink = new CollectingSink();
        StreamReassembler reassembler = newReassembler(sink);

        reassembler.onText("Let me check <call><name>read</name>");
        reassembler.onComplete();

        assertThat(sink.content()).isEqualTo("Let me check <call><name>read</name>");
        assertThat(sink.finishReasons()).containsExactly("stop");
    }

    @Test
    void shouldEmitBrokenBlockAsContentAndKeepScanning() {
        CollectingSink sink = new CollectingSink();
        StreamReassembler reassembler = newReassembler(sink);

        reassembler.onText("A <call>oops</call> B ");
        reassembler.onText("<call><name>read</name><args><path>x</path></args></call>");
        reassembler.onComplete();

        assertThat(sink.content()).isEqualTo("A <call>oops</call> B ");
        assertThat(sink.toolCalls()).hasSize(1);
        assertThat(sink.finishReasons()).containsExactly("tool_calls");
    }

    @Test
    void shouldIgnoreTextAfterToolCall() {
        CollectingSink sink = new CollectingSink();
        StreamReassembler reassembler = newReassembler(sink);

        reassembler.onText(CALL_TEXT + "\nI will wait.");
        reassembler.onText("<call><name>read</name></call>");
        reassembler.onComplete();

        assertThat(sink.content()).isEqualTo("I'll read it.\n");
        assertThat(sink.toolCalls()).hasSize(1);
    }

    @Test
    void shouldEmitErrorChunkOnFailure() {
        CollectingSink sink = new CollectingSink();
        StreamReassembler reassembler = newReassembler(sink);

        reassembler.onText("partial");
        reassembler.fail(BackendException.timeout(1000));
        reassembler.onComplete();

        assertThat(reassembler.failed()).isTrue();
        assertThat(reassembler.errorCode()).isEqualTo("backend_timeout");
        JSONObject error = sink.chunks.stream()
                .filter(chunk -> chunk.containsKey("error"))
                .findFirst()
                .orElseThrow();
        assertThat(error.getJSONObject("error").getString("code")).isEqualTo("backend_timeout");
        assertThat(error.getJSONObject("error").getString("type")).isEqualTo("api_error");
        assertThat(sink.finishReasons()).containsExactly("error");
        assertThat(sink.doneCount).isEqualTo(1);
    }

    @Test
    void shouldReportBackendErrorEvent() {
        CollectingSink sink = new CollectingSink();
        StreamReassembler reassembler = newReassembler(sink);

        reassembler.onError("RateLimited");

        assertThat(reassembler.failed()).isTrue();
        assertThat(reassembler.errorCode()).isEqualTo("backend_error");
        assertThat(sink.finishReasons()).containsExactly("error");
    }

    @Test
    void shouldStopForwardingAfterCancel() {
        CollectingSink sink = new CollectingSink();
        StreamReassembler reassembler = newReassembler(sink);

        reassembler.onResponseCreated("chat-1", "msg-9", "resp-9");
        reassembler.onText("Hello");
        int before = sink.chunks.size();
        reassembler.cancel();
        reassembler.onText(" world");
        reassembler.onComplete();

        assertThat(sink.chunks).hasSize(before);
        assertThat(sink.doneCount).isZero();
        assertThat(reassembler.tailPointer()).isEqualTo("msg-9");
    }

    private StreamReassembler newReassembler(CollectingSink sink) {
        return new StreamReassembler("chatcmpl-test", "qwen3-max", new ToolCallExtractor(() -> "call_fixed"),
                tools, new OpenAiTranslator(), sink);
    }

    private static class CollectingSink implements StreamReassembler.DeltaSink {

        private final List<JSONObject> chunks = new ArrayList<>();
        private int doneCount;

        @Override
        public void emit(JSONObject chunk) {
            chunks.add(chunk);
        }

        @Override
        public void done() {
            doneCount++;
        }

        String content() {
            StringBuilder sb = new StringBuilder();
            for (JSONObject delta : deltas()) {
                if (delta.getString("content") != null) {
                    sb.append(delta.getString("content"));
                }
            }
            return sb.toString();
        }

        List<JSONObject> toolCalls() {
            List<JSONObject> calls = new ArrayList<>();
            for (JSONObject delta : deltas()) {
                JSONArray toolCalls = delta.getJSONArray("tool_calls");
                if (toolCalls != null) {
                    for (int i = 0; i < toolCalls.size(); i++) {
                        calls.add(toolCalls.getJSONObject(i));
                    }
                }
            }
            return calls;
        }

        List<String> finishReasons() {
            List<String> reasons = new ArrayList<>();
            for (JSONObject chunk : chunks) {
                JSONArray choices = chunk.getJSONArray("choices");
                if (choices == null || choices.isEmpty()) continue;
                String reason = choices.getJSONObject(0).getString("finish_reason");
                if (reason != null) reasons.add(reason);
            }
            return reasons;
        }

        private List<JSONObject> deltas() {
            List<JSONObject> deltas = new ArrayList<>();
            for (JSONObject chunk : chunks) {
                JSONArray choices = chunk.getJSONArray("choices");
                if (choices == null || choices.isEmpty()) continue;
                deltas.add(choices.getJSONObject(0).getJSONObject("delta"));
            }
            return deltas;
        }
    }
}
