package com.qwen.gateway.util;

import com.qwen.gateway.dto.chat.TurnUsage;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricsTest {

    private final Metrics metrics = new Metrics();

    @Test
    void shouldCountTurnsByModeAndResult() {
        metrics.recordTurn(true, false, 42, TurnUsage.of(7, 3));
        metrics.recordTurn(true, true, 42, TurnUsage.of(1, 1));
        metrics.recordTurn(false, true, 42, null);

        assertThat(metrics.get("qwen_turns_total", "mode", "stream", "result", "error")).isEqualTo(1);
        assertThat(metrics.get("qwen_turns_total", "mode", "stream", "result", "success")).isEqualTo(1);
        assertThat(metrics.get("qwen_turns_total", "mode", "non_stream", "result", "success")).isEqualTo(1);
        assertThat(metrics.get("qwen_tokens_total", "kind", "prompt")).isEqualTo(8);
        assertThat(metrics.get("qwen_tokens_total", "kind", "completion")).isEqualTo(4);
    }

    @Test
    void shouldRenderLabelledCountersUnderOneTypeLine() {
        metrics.recordToolCall("bash");
        metrics.recordToolCall("read");
        metrics.recordToolCall("bash");

        String text = metrics.toPrometheusFormat();

        assertThat(text).containsOnlyOnce("# TYPE qwen_tool_calls_total counter\n");
        assertThat(text).contains("qwen_tool_calls_total{tool=\"bash\"} 2\n");
        assertThat(text).contains("qwen_tool_calls_total{tool=\"read\"} 1\n");
    }

    @Test
    void shouldRenderCumulativeHistogramWithSum() {
        metrics.recordTurn(false, true, 100, TurnUsage.EMPTY);
        metrics.recordTurn(false, true, 700, TurnUsage.EMPTY);
        metrics.recordTurn(false, true, 500000, TurnUsage.EMPTY);

        String text = metrics.toPrometheusFormat();

        assertThat(text).contains("# TYPE qwen_turn_latency_ms histogram\n");
        assertThat(text).contains("qwen_turn_latency_ms_bucket{mode=\"non_stream\",le=\"250\"} 1\n");
        assertThat(text).contains("qwen_turn_latency_ms_bucket{mode=\"non_stream\",le=\"1000\"} 2\n");
        assertThat(text).contains("qwen_turn_latency_ms_bucket{mode=\"non_stream\",le=\"+Inf\"} 3\n");
        assertThat(text).contains("qwen_turn_latency_ms_sum{mode=\"non_stream\"} 500800\n");
        assertThat(text).contains("qwen_turn_latency_ms_count{mode=\"non_stream\"} 3\n");
    }

    @Test
    void shouldReadGaugesAtRenderTime() {
        long[] value = {3};
        metrics.gauge("qwen_conversations_active", () -> value[0]);
        value[0] = 5;

        assertThat(metrics.toPrometheusFormat()).contains("qwen_conversations_active 5\n");
    }

    @Test
    void shouldRejectUnpairedLabels() {
        assertThatThrownBy(() -> metrics.increment("x", "only_name"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
